package flowsim.random;

import java.util.Objects;
import java.util.Random;

/**
 * Draws samples from the supported distributions using one seeded pseudo-random source.
 *
 * A single sampler is shared by everything random in a run (generator intervals and chance
 * branches), so a fixed seed reproduces the entire run.
 *
 * Invalid parameters are clamped rather than rejected:
 * - UNIFORM/TRIANGULAR with max &lt; min swap the bounds; a triangular mode outside the bounds is clamped into them
 * - EXPONENTIAL/ERLANG with a non-positive mean and POISSON with a non-positive rate return 0
 * - NORMAL uses the absolute standard deviation
 * - ERLANG shape below 1 is treated as 1
 * - BINOMIAL clamps p into [0, 1] and negative trial counts to 0
 */
public class RandomVariateSampler {

    private final long seed;
    private final Random random;

    /**
     * Creates a sampler seeded for deterministic behavior.
     *
     * @param seed the seed of the shared pseudo-random source
     */
    public RandomVariateSampler(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    public long getSeed() {
        return seed;
    }

    /**
     * Restores the source to its initial seed so the next run replays the same sequence.
     */
    public void reset() {
        random.setSeed(seed);
    }

    /**
     * @return a uniform sample in [0, 1)
     */
    public double nextUniform() {
        return random.nextDouble();
    }

    public double sample(Distribution distribution) {
        Objects.requireNonNull(distribution, "Distribution cannot be null");
        return sample(distribution.type(), distribution.param1(), distribution.param2(), distribution.param3());
    }

    public double sample(DistributionType type, double param1, double param2, double param3) {
        Objects.requireNonNull(type, "Distribution type cannot be null");
        return switch (type) {
            case CONSTANT -> param1;
            case UNIFORM -> uniform(param1, param2);
            case EXPONENTIAL -> exponential(param1);
            case NORMAL -> normal(param1, param2);
            case TRIANGULAR -> triangular(param1, param2, param3);
            case ERLANG -> erlang(param1, (int) param2);
            case POISSON -> poisson(param1);
            case BINOMIAL -> binomial(param1, (int) param2);
        };
    }

    private double uniform(double min, double max) {
        if (max < min) {
            double swap = min;
            min = max;
            max = swap;
        }
        return min + random.nextDouble() * (max - min);
    }

    private double exponential(double mean) {
        if (mean <= 0) {
            return 0.0;
        }
        return -mean * Math.log(1 - random.nextDouble());
    }

    // Box-Muller
    private double normal(double mean, double stdDev) {
        double u1 = 1.0 - random.nextDouble();
        double u2 = 1.0 - random.nextDouble();
        double z = Math.sqrt(-2.0 * Math.log(u1)) * Math.sin(2.0 * Math.PI * u2);
        return mean + z * Math.abs(stdDev);
    }

    private double triangular(double min, double mode, double max) {
        if (max < min) {
            double swap = min;
            min = max;
            max = swap;
        }
        if (max == min) {
            return min;
        }
        mode = Math.min(Math.max(mode, min), max);
        double u = random.nextDouble();
        double breakpoint = (mode - min) / (max - min);
        if (u < breakpoint) {
            return min + Math.sqrt(u * (max - min) * (mode - min));
        }
        return max - Math.sqrt((1 - u) * (max - min) * (max - mode));
    }

    private double erlang(double mean, int k) {
        int shape = Math.max(1, k);
        double sum = 0;
        for (int i = 0; i < shape; i++) {
            sum += exponential(mean / shape);
        }
        return sum;
    }

    private double poisson(double lambda) {
        if (lambda <= 0) {
            return 0.0;
        }
        return exponential(1.0 / lambda);
    }

    private double binomial(double p, int n) {
        double probability = Math.min(Math.max(p, 0.0), 1.0);
        int successes = 0;
        for (int i = 0; i < n; i++) {
            if (random.nextDouble() < probability) {
                successes++;
            }
        }
        return successes;
    }

    @Override
    public String toString() {
        return "RandomVariateSampler{seed=" + seed + "}";
    }
}
