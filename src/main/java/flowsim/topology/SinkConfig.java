package flowsim.topology;

import java.util.Objects;

/**
 * Terminal node that consumes every entity arriving at it.
 */
public record SinkConfig(String name) implements RoleConfig {

    public SinkConfig {
        Objects.requireNonNull(name, "Sink name cannot be null");
    }

    public static SinkConfig named(String name) {
        return new SinkConfig(name);
    }

    @Override
    public SimulationRole role() {
        return SimulationRole.SINK;
    }
}
