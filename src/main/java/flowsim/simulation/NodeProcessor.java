package flowsim.simulation;

import flowsim.entity.Entity;
import flowsim.stats.CounterStatistics;
import flowsim.topology.CounterConfig;
import flowsim.topology.NodeId;
import flowsim.topology.RoleConfig;
import flowsim.topology.SinkConfig;

/**
 * Role-specific behavior of a node when an entity arrives at it.
 */
final class NodeProcessor {

    /**
     * What happens to an entity after a node has processed it.
     */
    enum Disposition {
        /** Keep routing from this node. */
        CONTINUE,
        /** The entity left the simulation. */
        CONSUMED
    }

    private final SimulationState state;
    private final SimulationListener listener;

    NodeProcessor(SimulationState state, SimulationListener listener) {
        this.state = state;
        this.listener = listener;
    }

    Disposition onArrival(Entity entity, NodeId nodeId, RoleConfig config) {
        if (config instanceof SinkConfig sink) {
            return consume(entity, nodeId, sink);
        }
        if (config instanceof CounterConfig counter) {
            return count(entity, nodeId, counter);
        }
        // chance, clock, dashboard, generator and generic nodes only forward
        return Disposition.CONTINUE;
    }

    private Disposition consume(Entity entity, NodeId sinkId, SinkConfig config) {
        listener.onSimulationEvent(new SimulationEvent(state.now(), SimulationEventType.ENTITY_CONSUMED, sinkId,
                entity.snapshot(), entity + " consumed at " + config.name()));
        return Disposition.CONSUMED;
    }

    private Disposition count(Entity entity, NodeId counterId, CounterConfig config) {
        CounterStatistics stats = state.statistics()
                .recordArrival(counterId, config.throughputWindow(), entity.getEntityType(), state.now());
        listener.onSimulationEvent(new SimulationEvent(state.now(), SimulationEventType.COUNTER_UPDATED, counterId,
                entity.snapshot(), "Counter: " + stats.getTotalCount() + " total"));
        return Disposition.CONTINUE;
    }
}
