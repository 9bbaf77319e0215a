package flowsim.simulation;

import flowsim.entity.EntitySnapshot;
import flowsim.topology.NodeId;

/**
 * Notification raised while an event executes.
 *
 * @param simulationTime clock time of the executing event
 * @param eventType what happened
 * @param nodeId the node where it happened
 * @param entity snapshot of the entity involved
 * @param message human readable description
 */
public record SimulationEvent(double simulationTime, SimulationEventType eventType, NodeId nodeId,
                              EntitySnapshot entity, String message) {
}
