package flowsim.simulation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimulationConfigTest {

    @Test
    void shouldCreateDefaultConfig() {
        SimulationConfig config = SimulationConfig.defaults();

        assertEquals(42L, config.seed());
        assertTrue(config.pacingEnabled());
        assertEquals(1.0, config.speedMultiplier());
        assertEquals(1000.0, config.millisPerTimeUnit());
        assertEquals(10.0, config.fastModeThreshold());
        assertEquals(100, config.fastModeYieldInterval());
        assertEquals(0.001, config.generatorEpsilon());
        assertEquals(10_000, config.maxRoutingDepth());
    }

    @Test
    void shouldCreateConfigWithBuilder() {
        SimulationConfig config = SimulationConfig.builder()
                .seed(7)
                .pacingEnabled(false)
                .speedMultiplier(4.0)
                .millisPerTimeUnit(10)
                .maxRoutingDepth(50)
                .build();

        assertEquals(7L, config.seed());
        assertFalse(config.pacingEnabled());
        assertEquals(4.0, config.speedMultiplier());
        assertEquals(10.0, config.millisPerTimeUnit());
        assertEquals(50, config.maxRoutingDepth());
    }

    @Test
    void shouldCreateUnpacedConfig() {
        SimulationConfig config = SimulationConfig.unpaced(99);

        assertEquals(99L, config.seed());
        assertFalse(config.pacingEnabled());
    }

    @Test
    void shouldValidateSpeedMultiplier() {
        assertThrows(IllegalArgumentException.class, () -> {
            SimulationConfig.builder()
                    .speedMultiplier(0)
                    .build();
        });

        assertThrows(IllegalArgumentException.class, () -> {
            SimulationConfig.builder()
                    .speedMultiplier(Double.NaN)
                    .build();
        });
    }

    @Test
    void shouldValidatePacingParameters() {
        assertThrows(IllegalArgumentException.class, () -> SimulationConfig.builder().millisPerTimeUnit(-1).build());
        assertThrows(IllegalArgumentException.class, () -> SimulationConfig.builder().fastModeThreshold(0).build());
        assertThrows(IllegalArgumentException.class, () -> SimulationConfig.builder().fastModeYieldInterval(0).build());
    }

    @Test
    void shouldValidateSafeguards() {
        assertThrows(IllegalArgumentException.class, () -> SimulationConfig.builder().generatorEpsilon(0).build());
        assertThrows(IllegalArgumentException.class, () -> SimulationConfig.builder().maxRoutingDepth(0).build());
    }

    @Test
    void shouldAllowZeroMillisPerTimeUnit() {
        SimulationConfig config = SimulationConfig.builder().millisPerTimeUnit(0).build();

        assertEquals(0.0, config.millisPerTimeUnit());
    }

    @Test
    void shouldPaceProportionallyBelowFastModeThreshold() {
        RealTimePacer pacer = new RealTimePacer(SimulationConfig.builder().millisPerTimeUnit(1000).build());

        assertEquals(2_000_000_000L, pacer.delayNanos(4.0, 2.0, 1));
        assertEquals(0L, pacer.delayNanos(0.0, 2.0, 1));
    }

    @Test
    void shouldOnlyYieldPeriodicallyInFastMode() {
        RealTimePacer pacer = new RealTimePacer(SimulationConfig.builder()
                .fastModeThreshold(10)
                .fastModeYieldInterval(100)
                .build());

        assertEquals(1_000_000L, pacer.delayNanos(50.0, 10.0, 200));
        assertEquals(0L, pacer.delayNanos(50.0, 10.0, 201));
        assertEquals(0L, Pacer.NONE.delayNanos(50.0, 1.0, 1));
    }
}
