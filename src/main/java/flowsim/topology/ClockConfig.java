package flowsim.topology;

import java.util.Objects;

/**
 * Informational clock node. It displays simulation time and forwards entities unchanged.
 */
public record ClockConfig(String name) implements RoleConfig {

    public ClockConfig {
        Objects.requireNonNull(name, "Clock name cannot be null");
    }

    @Override
    public SimulationRole role() {
        return SimulationRole.CLOCK;
    }
}
