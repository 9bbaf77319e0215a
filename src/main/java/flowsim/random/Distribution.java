package flowsim.random;

import java.util.Objects;

/**
 * A distribution kind together with its parameters.
 *
 * <pre>
 * CONSTANT     param1 = value
 * UNIFORM      param1 = min,  param2 = max
 * EXPONENTIAL  param1 = mean
 * NORMAL       param1 = mean, param2 = standard deviation
 * TRIANGULAR   param1 = min,  param2 = mode, param3 = max
 * ERLANG       param1 = mean, param2 = k (shape)
 * POISSON      param1 = lambda (rate)
 * BINOMIAL     param1 = p,    param2 = n (trials)
 * </pre>
 */
public record Distribution(DistributionType type, double param1, double param2, double param3) {

    public Distribution {
        Objects.requireNonNull(type, "Distribution type cannot be null");
    }

    public static Distribution constant(double value) {
        return new Distribution(DistributionType.CONSTANT, value, 0, 0);
    }

    public static Distribution uniform(double min, double max) {
        return new Distribution(DistributionType.UNIFORM, min, max, 0);
    }

    public static Distribution exponential(double mean) {
        return new Distribution(DistributionType.EXPONENTIAL, mean, 0, 0);
    }

    public static Distribution normal(double mean, double stdDev) {
        return new Distribution(DistributionType.NORMAL, mean, stdDev, 0);
    }

    public static Distribution triangular(double min, double mode, double max) {
        return new Distribution(DistributionType.TRIANGULAR, min, mode, max);
    }

    public static Distribution erlang(double mean, int k) {
        return new Distribution(DistributionType.ERLANG, mean, k, 0);
    }

    public static Distribution poisson(double lambda) {
        return new Distribution(DistributionType.POISSON, lambda, 0, 0);
    }

    public static Distribution binomial(double p, int n) {
        return new Distribution(DistributionType.BINOMIAL, p, n, 0);
    }
}
