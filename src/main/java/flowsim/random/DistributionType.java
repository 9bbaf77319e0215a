package flowsim.random;

/**
 * Distributions a generator can draw its inter-arrival values from.
 * Parameter meaning per kind is documented on {@link Distribution}.
 */
public enum DistributionType {
    CONSTANT,
    UNIFORM,
    EXPONENTIAL,
    NORMAL,
    TRIANGULAR,
    ERLANG,
    /** Inter-event time of a Poisson process with rate lambda, not a discrete count. */
    POISSON,
    BINOMIAL;

    /**
     * Number of parameters the distribution reads.
     */
    public int parameterCount() {
        return switch (this) {
            case CONSTANT, EXPONENTIAL, POISSON -> 1;
            case UNIFORM, NORMAL, ERLANG, BINOMIAL -> 2;
            case TRIANGULAR -> 3;
        };
    }
}
