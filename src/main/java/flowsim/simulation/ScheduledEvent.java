package flowsim.simulation;

/**
 * An entry of the event queue. Ordered by time, then by the sequence number assigned at enqueue
 * time, which makes the order total and keeps insertion order among events at the same instant.
 */
public record ScheduledEvent(double time, long sequence, SimulationCommand command)
        implements Comparable<ScheduledEvent> {

    @Override
    public int compareTo(ScheduledEvent other) {
        int byTime = Double.compare(time, other.time);
        return byTime != 0 ? byTime : Long.compare(sequence, other.sequence);
    }
}
