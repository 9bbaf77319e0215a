package flowsim.simulation;

import flowsim.topology.NodeId;

import java.util.Objects;

/**
 * Inspectable description of the work a scheduled event performs.
 */
public record SimulationCommand(Kind kind, NodeId targetNodeId) {

    public enum Kind {
        /** Run one tick of the generator at {@code targetNodeId}. */
        GENERATE_ENTITIES
    }

    public SimulationCommand {
        Objects.requireNonNull(kind, "Command kind cannot be null");
        Objects.requireNonNull(targetNodeId, "Target node cannot be null");
    }

    public static SimulationCommand generate(NodeId generatorId) {
        return new SimulationCommand(Kind.GENERATE_ENTITIES, generatorId);
    }
}
