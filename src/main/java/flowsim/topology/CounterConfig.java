package flowsim.topology;

import java.util.Objects;

/**
 * Pass-through node recording arrival statistics.
 *
 * @param name display name
 * @param throughputWindow trailing time window used for the throughput figure
 */
public record CounterConfig(String name, double throughputWindow) implements RoleConfig {

    public static final double DEFAULT_THROUGHPUT_WINDOW = 60.0;

    public CounterConfig {
        Objects.requireNonNull(name, "Counter name cannot be null");
        if (Double.isNaN(throughputWindow)) {
            throw new IllegalArgumentException("throughputWindow cannot be NaN");
        }
    }

    public static CounterConfig named(String name) {
        return new CounterConfig(name, DEFAULT_THROUGHPUT_WINDOW);
    }

    @Override
    public SimulationRole role() {
        return SimulationRole.COUNTER;
    }
}
