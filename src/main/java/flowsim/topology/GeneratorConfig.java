package flowsim.topology;

import flowsim.random.Distribution;

import java.util.Objects;

/**
 * Configuration of a generator node: what it emits, how often, and when it stops.
 * Immutable configuration object with builder pattern support.
 */
public final class GeneratorConfig implements RoleConfig {

    // === Identity ===
    private final String name;
    private final String entityType;
    private final String color;

    // === Timing ===
    private final Distribution distribution;
    private final TimingMode timingMode;
    private final double startTime;
    private final int batchSize;

    // === Termination ===
    private final TerminationCondition termination;
    private final double stopTime;
    private final int maxEntities;

    private GeneratorConfig(Builder builder) {
        this.name = builder.name;
        this.entityType = builder.entityType;
        this.color = builder.color;
        this.distribution = builder.distribution;
        this.timingMode = builder.timingMode;
        this.startTime = builder.startTime;
        this.batchSize = builder.batchSize;
        this.termination = builder.termination;
        this.stopTime = builder.stopTime;
        this.maxEntities = builder.maxEntities;

        validate();
    }

    private void validate() {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(entityType, "entityType cannot be null");
        Objects.requireNonNull(color, "color cannot be null");
        Objects.requireNonNull(distribution, "distribution cannot be null");
        Objects.requireNonNull(timingMode, "timingMode cannot be null");
        Objects.requireNonNull(termination, "termination cannot be null");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        if (maxEntities < 0) {
            throw new IllegalArgumentException("maxEntities cannot be negative");
        }
        if (Double.isNaN(startTime) || startTime < 0) {
            throw new IllegalArgumentException("startTime must be a non-negative number");
        }
        if (Double.isNaN(stopTime)) {
            throw new IllegalArgumentException("stopTime cannot be NaN");
        }
    }

    @Override
    public SimulationRole role() {
        return SimulationRole.GENERATOR;
    }

    @Override
    public String name() {
        return name;
    }

    public String entityType() {
        return entityType;
    }

    public String color() {
        return color;
    }

    public Distribution distribution() {
        return distribution;
    }

    public TimingMode timingMode() {
        return timingMode;
    }

    public double startTime() {
        return startTime;
    }

    public int batchSize() {
        return batchSize;
    }

    public TerminationCondition termination() {
        return termination;
    }

    public double stopTime() {
        return stopTime;
    }

    public int maxEntities() {
        return maxEntities;
    }

    /**
     * Creates a builder with default values.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a configuration with default values.
     */
    public static GeneratorConfig defaults() {
        return builder().build();
    }

    @Override
    public String toString() {
        return String.format("GeneratorConfig{name=%s, entityType=%s, distribution=%s, timingMode=%s, batchSize=%d, "
                        + "startTime=%s, termination=%s, stopTime=%s, maxEntities=%d}",
                name, entityType, distribution, timingMode, batchSize, startTime, termination, stopTime, maxEntities);
    }

    /**
     * Builder for GeneratorConfig with fluent API.
     */
    public static final class Builder {
        private String name = "Generator";
        private String entityType = "Entity";
        private String color = "#4CAF50";
        private Distribution distribution = Distribution.exponential(1.0);
        private TimingMode timingMode = TimingMode.INTERVAL;
        private double startTime = 0.0;
        private int batchSize = 1;
        private TerminationCondition termination = TerminationCondition.NONE;
        private double stopTime = 1000.0;
        private int maxEntities = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder entityType(String entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder color(String color) {
            this.color = color;
            return this;
        }

        public Builder distribution(Distribution distribution) {
            this.distribution = distribution;
            return this;
        }

        public Builder timingMode(TimingMode timingMode) {
            this.timingMode = timingMode;
            return this;
        }

        public Builder startTime(double startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder termination(TerminationCondition termination) {
            this.termination = termination;
            return this;
        }

        public Builder stopTime(double stopTime) {
            this.stopTime = stopTime;
            return this;
        }

        public Builder maxEntities(int maxEntities) {
            this.maxEntities = maxEntities;
            return this;
        }

        public GeneratorConfig build() {
            return new GeneratorConfig(this);
        }
    }
}
