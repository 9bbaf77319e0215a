package flowsim.topology;

/**
 * When a generator stops emitting entities.
 */
public enum TerminationCondition {
    NONE,
    TIME,
    COUNT,
    COUNT_OR_TIME;

    public boolean isTimeBounded() {
        return this == TIME || this == COUNT_OR_TIME;
    }

    public boolean isCountBounded() {
        return this == COUNT || this == COUNT_OR_TIME;
    }
}
