package flowsim.topology;

/**
 * Role a node plays during a simulation run.
 */
public enum SimulationRole {
    GENERATOR,
    COUNTER,
    CHANCE,
    SINK,
    // informational roles, entities pass straight through
    CLOCK,
    DASHBOARD,
    GENERIC;

    /**
     * Lenient lookup used when decoding models: unknown or missing names map to GENERIC.
     */
    public static SimulationRole fromName(String name) {
        if (name == null) {
            return GENERIC;
        }
        String normalized = name.trim().toUpperCase().replace('-', '_');
        for (SimulationRole role : values()) {
            if (role.name().equals(normalized)) {
                return role;
            }
        }
        return GENERIC;
    }
}
