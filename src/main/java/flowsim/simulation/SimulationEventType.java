package flowsim.simulation;

public enum SimulationEventType {
    ENTITY_CREATED,
    ENTITY_CONSUMED,
    COUNTER_UPDATED
}
