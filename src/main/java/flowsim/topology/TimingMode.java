package flowsim.topology;

/**
 * How a generator's sampled value is interpreted.
 */
public enum TimingMode {
    /** The sample is the time until the next arrival. */
    INTERVAL,
    /** The sample is a rate (entities per time unit); the interval is its reciprocal. */
    RATE_PER_UNIT
}
