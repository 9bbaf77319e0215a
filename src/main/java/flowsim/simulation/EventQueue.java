package flowsim.simulation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * Time-ordered queue of scheduled events.
 * Dequeue always yields the minimum (time, sequence) pair.
 */
public final class EventQueue {

    private final PriorityQueue<ScheduledEvent> events = new PriorityQueue<>();
    private long nextSequence = 0;

    /**
     * Enqueues a command to run at the given simulated time.
     *
     * @return the enqueued event
     * @throws IllegalArgumentException if time is NaN
     */
    public ScheduledEvent schedule(double time, SimulationCommand command) {
        Objects.requireNonNull(command, "Command cannot be null");
        if (Double.isNaN(time)) {
            throw new IllegalArgumentException("Event time cannot be NaN");
        }
        ScheduledEvent event = new ScheduledEvent(time, nextSequence++, command);
        events.offer(event);
        return event;
    }

    /**
     * Removes and returns the earliest event, or null when the queue is empty.
     */
    public ScheduledEvent poll() {
        return events.poll();
    }

    public ScheduledEvent peek() {
        return events.peek();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public int size() {
        return events.size();
    }

    /**
     * Returns the pending events in execution order without consuming them.
     */
    public List<ScheduledEvent> pending() {
        List<ScheduledEvent> ordered = new ArrayList<>(events);
        Collections.sort(ordered);
        return Collections.unmodifiableList(ordered);
    }

    /**
     * Drops all pending events and restarts the sequence counter.
     */
    public void clear() {
        events.clear();
        nextSequence = 0;
    }
}
