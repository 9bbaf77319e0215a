package flowsim.random;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RandomVariateSamplerTest {

    private static final int SAMPLES = 100_000;

    private static double mean(RandomVariateSampler sampler, Distribution distribution) {
        double sum = 0;
        for (int i = 0; i < SAMPLES; i++) {
            sum += sampler.sample(distribution);
        }
        return sum / SAMPLES;
    }

    @Test
    void shouldReproduceSequenceForSameSeed() {
        RandomVariateSampler first = new RandomVariateSampler(42);
        RandomVariateSampler second = new RandomVariateSampler(42);

        for (int i = 0; i < 100; i++) {
            assertEquals(first.sample(Distribution.exponential(3)), second.sample(Distribution.exponential(3)));
            assertEquals(first.nextUniform(), second.nextUniform());
        }
    }

    @Test
    void shouldReplayAfterReset() {
        RandomVariateSampler sampler = new RandomVariateSampler(7);
        double[] firstRun = new double[20];
        for (int i = 0; i < firstRun.length; i++) {
            firstRun[i] = sampler.sample(Distribution.normal(0, 1));
        }

        sampler.reset();

        for (double expected : firstRun) {
            assertEquals(expected, sampler.sample(Distribution.normal(0, 1)));
        }
    }

    @Test
    void shouldReturnConstantValue() {
        RandomVariateSampler sampler = new RandomVariateSampler(1);

        assertEquals(5.0, sampler.sample(Distribution.constant(5)));
        assertEquals(5.0, sampler.sample(DistributionType.CONSTANT, 5, 99, 99));
    }

    @Test
    void shouldSampleUniformWithinBounds() {
        RandomVariateSampler sampler = new RandomVariateSampler(1);

        for (int i = 0; i < 10_000; i++) {
            double value = sampler.sample(Distribution.uniform(2, 4));
            assertTrue(value >= 2 && value < 4, "out of range: " + value);
        }
        assertEquals(3.0, mean(sampler, Distribution.uniform(2, 4)), 0.05);
    }

    @Test
    void shouldSwapReversedUniformBounds() {
        RandomVariateSampler sampler = new RandomVariateSampler(1);

        for (int i = 0; i < 1_000; i++) {
            double value = sampler.sample(Distribution.uniform(4, 2));
            assertTrue(value >= 2 && value <= 4, "out of range: " + value);
        }
    }

    @Test
    void shouldMatchExponentialMean() {
        RandomVariateSampler sampler = new RandomVariateSampler(3);

        assertEquals(2.0, mean(sampler, Distribution.exponential(2)), 0.05);
    }

    @Test
    void shouldMatchNormalMeanAndSpread() {
        RandomVariateSampler sampler = new RandomVariateSampler(5);
        double sum = 0;
        double sumSquares = 0;
        for (int i = 0; i < SAMPLES; i++) {
            double value = sampler.sample(Distribution.normal(10, 2));
            sum += value;
            sumSquares += value * value;
        }
        double mean = sum / SAMPLES;
        double variance = sumSquares / SAMPLES - mean * mean;

        assertEquals(10.0, mean, 0.05);
        assertEquals(2.0, Math.sqrt(variance), 0.05);
    }

    @Test
    void shouldSampleTriangularWithinBounds() {
        RandomVariateSampler sampler = new RandomVariateSampler(11);

        for (int i = 0; i < 10_000; i++) {
            double value = sampler.sample(Distribution.triangular(1, 2, 6));
            assertTrue(value >= 1 && value <= 6, "out of range: " + value);
        }
        assertEquals(3.0, mean(sampler, Distribution.triangular(1, 2, 6)), 0.05);
    }

    @Test
    void shouldCollapseDegenerateTriangular() {
        RandomVariateSampler sampler = new RandomVariateSampler(11);

        assertEquals(4.0, sampler.sample(Distribution.triangular(4, 4, 4)));
    }

    @Test
    void shouldMatchErlangMean() {
        RandomVariateSampler sampler = new RandomVariateSampler(13);

        assertEquals(6.0, mean(sampler, Distribution.erlang(6, 3)), 0.1);
    }

    @Test
    void shouldTreatPoissonAsInterArrivalTime() {
        RandomVariateSampler sampler = new RandomVariateSampler(17);

        // rate 4 per unit gives a mean gap of 0.25
        assertEquals(0.25, mean(sampler, Distribution.poisson(4)), 0.01);
    }

    @Test
    void shouldCountBinomialSuccesses() {
        RandomVariateSampler sampler = new RandomVariateSampler(19);

        for (int i = 0; i < 1_000; i++) {
            double value = sampler.sample(Distribution.binomial(0.3, 10));
            assertTrue(value >= 0 && value <= 10, "out of range: " + value);
            assertEquals(Math.rint(value), value);
        }
        assertEquals(3.0, mean(sampler, Distribution.binomial(0.3, 10)), 0.05);
    }

    @Test
    void shouldClampInvalidParameters() {
        RandomVariateSampler sampler = new RandomVariateSampler(23);

        assertEquals(0.0, sampler.sample(Distribution.exponential(0)));
        assertEquals(0.0, sampler.sample(Distribution.exponential(-1)));
        assertEquals(0.0, sampler.sample(Distribution.poisson(0)));
        assertEquals(0.0, sampler.sample(Distribution.binomial(-0.5, 10)));
        assertEquals(10.0, sampler.sample(Distribution.binomial(1.5, 10)));
        assertEquals(0.0, sampler.sample(Distribution.binomial(0.5, -3)));
        assertTrue(sampler.sample(Distribution.erlang(2, 0)) >= 0);
        assertEquals(5.0, sampler.sample(Distribution.normal(5, 0)));
    }

    @Test
    void shouldTakeAbsoluteStandardDeviation() {
        RandomVariateSampler negative = new RandomVariateSampler(29);
        RandomVariateSampler positive = new RandomVariateSampler(29);

        for (int i = 0; i < 100; i++) {
            assertEquals(positive.sample(Distribution.normal(1, 3)), negative.sample(Distribution.normal(1, -3)));
        }
    }

    @Test
    void shouldExposeParameterCounts() {
        assertEquals(1, DistributionType.CONSTANT.parameterCount());
        assertEquals(3, DistributionType.TRIANGULAR.parameterCount());
    }
}
