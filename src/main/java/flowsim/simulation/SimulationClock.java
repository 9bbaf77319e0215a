package flowsim.simulation;

/**
 * Single source of truth for simulated time in one engine.
 *
 * Time is a non-decreasing real value that only moves when the scheduler consumes an event;
 * it is unrelated to wall-clock time.
 */
public final class SimulationClock {

    private double now = 0.0;

    /**
     * Advances the clock to the time of the event being consumed.
     * This is the ONLY place where simulated time moves forward.
     *
     * @param time the new time, never earlier than the current time
     * @return the new current time
     * @throws IllegalArgumentException if time would move the clock backwards or is NaN
     */
    public double advanceTo(double time) {
        if (Double.isNaN(time) || time < now) {
            throw new IllegalArgumentException("Clock cannot move backwards from " + now + " to " + time);
        }
        now = time;
        return now;
    }

    /**
     * Gets the current simulation time without advancing it.
     */
    public double now() {
        return now;
    }

    /**
     * Resets the clock to 0 for a new run.
     */
    public void reset() {
        now = 0.0;
    }
}
