package flowsim.simulation;

/**
 * Decides how long the scheduler waits after an event so observers can follow the run in real time.
 */
@FunctionalInterface
public interface Pacer {

    /** Never waits; the run proceeds as fast as events can execute. */
    Pacer NONE = (simulatedDelta, speedMultiplier, eventsConsumed) -> 0L;

    /**
     * @param simulatedDelta simulated time that passed with the last event
     * @param speedMultiplier current playback speed
     * @param eventsConsumed events consumed so far in this run
     * @return the wait in nanoseconds, 0 for none
     */
    long delayNanos(double simulatedDelta, double speedMultiplier, long eventsConsumed);
}
