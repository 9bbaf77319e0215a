package flowsim.simulation;

import java.util.concurrent.TimeUnit;

/**
 * Paces playback proportionally to simulated time: {@code delta * millisPerTimeUnit / speed}.
 * At or above the fast-mode threshold it only yields for a millisecond every few events,
 * which keeps the run cancellable without slowing it down.
 */
public final class RealTimePacer implements Pacer {

    private static final long FAST_MODE_YIELD_NANOS = TimeUnit.MILLISECONDS.toNanos(1);

    private final double millisPerTimeUnit;
    private final double fastModeThreshold;
    private final int fastModeYieldInterval;

    public RealTimePacer(SimulationConfig config) {
        this.millisPerTimeUnit = config.millisPerTimeUnit();
        this.fastModeThreshold = config.fastModeThreshold();
        this.fastModeYieldInterval = config.fastModeYieldInterval();
    }

    @Override
    public long delayNanos(double simulatedDelta, double speedMultiplier, long eventsConsumed) {
        if (speedMultiplier >= fastModeThreshold) {
            return eventsConsumed % fastModeYieldInterval == 0 ? FAST_MODE_YIELD_NANOS : 0L;
        }
        if (simulatedDelta <= 0) {
            return 0L;
        }
        double millis = simulatedDelta * millisPerTimeUnit / speedMultiplier;
        return (long) (millis * 1_000_000L);
    }
}
