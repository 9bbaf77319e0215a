package flowsim.simulation;

/**
 * Configuration of an engine: random seed, playback pacing and routing safeguards.
 * Immutable configuration object with builder pattern support.
 */
public final class SimulationConfig {

    // === Reproducibility ===
    private final long seed;

    // === Playback pacing ===
    private final boolean pacingEnabled;
    private final double speedMultiplier;
    private final double millisPerTimeUnit;
    private final double fastModeThreshold;
    private final int fastModeYieldInterval;

    // === Engine safeguards ===
    private final double generatorEpsilon;
    private final int maxRoutingDepth;

    private SimulationConfig(Builder builder) {
        this.seed = builder.seed;
        this.pacingEnabled = builder.pacingEnabled;
        this.speedMultiplier = builder.speedMultiplier;
        this.millisPerTimeUnit = builder.millisPerTimeUnit;
        this.fastModeThreshold = builder.fastModeThreshold;
        this.fastModeYieldInterval = builder.fastModeYieldInterval;
        this.generatorEpsilon = builder.generatorEpsilon;
        this.maxRoutingDepth = builder.maxRoutingDepth;

        validate();
    }

    private void validate() {
        if (!(speedMultiplier > 0)) {
            throw new IllegalArgumentException("speedMultiplier must be positive");
        }
        if (!(millisPerTimeUnit >= 0)) {
            throw new IllegalArgumentException("millisPerTimeUnit cannot be negative");
        }
        if (!(fastModeThreshold > 0)) {
            throw new IllegalArgumentException("fastModeThreshold must be positive");
        }
        if (fastModeYieldInterval <= 0) {
            throw new IllegalArgumentException("fastModeYieldInterval must be positive");
        }
        if (!(generatorEpsilon > 0)) {
            throw new IllegalArgumentException("generatorEpsilon must be positive");
        }
        if (maxRoutingDepth <= 0) {
            throw new IllegalArgumentException("maxRoutingDepth must be positive");
        }
    }

    public long seed() {
        return seed;
    }

    public boolean pacingEnabled() {
        return pacingEnabled;
    }

    public double speedMultiplier() {
        return speedMultiplier;
    }

    public double millisPerTimeUnit() {
        return millisPerTimeUnit;
    }

    public double fastModeThreshold() {
        return fastModeThreshold;
    }

    public int fastModeYieldInterval() {
        return fastModeYieldInterval;
    }

    public double generatorEpsilon() {
        return generatorEpsilon;
    }

    public int maxRoutingDepth() {
        return maxRoutingDepth;
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
    public static SimulationConfig defaults() {
        return builder().build();
    }

    /**
     * Creates an unpaced configuration, useful for batch runs and tests.
     */
    public static SimulationConfig unpaced(long seed) {
        return builder().seed(seed).pacingEnabled(false).build();
    }

    @Override
    public String toString() {
        return String.format("SimulationConfig{seed=%d, pacingEnabled=%s, speedMultiplier=%s, millisPerTimeUnit=%s, "
                        + "fastModeThreshold=%s, fastModeYieldInterval=%d, generatorEpsilon=%s, maxRoutingDepth=%d}",
                seed, pacingEnabled, speedMultiplier, millisPerTimeUnit, fastModeThreshold, fastModeYieldInterval,
                generatorEpsilon, maxRoutingDepth);
    }

    /**
     * Builder for SimulationConfig with fluent API.
     */
    public static final class Builder {
        private long seed = 42L;
        private boolean pacingEnabled = true;
        private double speedMultiplier = 1.0;
        private double millisPerTimeUnit = 1000.0; // one simulated unit per wall-clock second at 1x
        private double fastModeThreshold = 10.0;
        private int fastModeYieldInterval = 100;
        private double generatorEpsilon = 0.001;
        private int maxRoutingDepth = 10_000;

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder pacingEnabled(boolean pacingEnabled) {
            this.pacingEnabled = pacingEnabled;
            return this;
        }

        public Builder speedMultiplier(double speedMultiplier) {
            this.speedMultiplier = speedMultiplier;
            return this;
        }

        public Builder millisPerTimeUnit(double millisPerTimeUnit) {
            this.millisPerTimeUnit = millisPerTimeUnit;
            return this;
        }

        public Builder fastModeThreshold(double fastModeThreshold) {
            this.fastModeThreshold = fastModeThreshold;
            return this;
        }

        public Builder fastModeYieldInterval(int fastModeYieldInterval) {
            this.fastModeYieldInterval = fastModeYieldInterval;
            return this;
        }

        public Builder generatorEpsilon(double generatorEpsilon) {
            this.generatorEpsilon = generatorEpsilon;
            return this;
        }

        public Builder maxRoutingDepth(int maxRoutingDepth) {
            this.maxRoutingDepth = maxRoutingDepth;
            return this;
        }

        public SimulationConfig build() {
            return new SimulationConfig(this);
        }
    }
}
