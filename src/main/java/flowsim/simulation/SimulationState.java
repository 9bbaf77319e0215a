package flowsim.simulation;

import flowsim.stats.StatisticsCollector;
import flowsim.topology.NodeId;

import java.util.HashMap;
import java.util.Map;

/**
 * All mutable state of one simulation run: clock, event queue, entity id counter,
 * per-generator emission ledgers and counter statistics.
 *
 * Owned by a single engine and touched only by its simulation thread.
 */
public final class SimulationState {

    private final SimulationClock clock = new SimulationClock();
    private final EventQueue eventQueue = new EventQueue();
    private final StatisticsCollector statistics = new StatisticsCollector();
    private final Map<NodeId, Integer> emittedByGenerator = new HashMap<>();
    private long nextEntityId = 1;

    public SimulationClock clock() {
        return clock;
    }

    public EventQueue eventQueue() {
        return eventQueue;
    }

    public StatisticsCollector statistics() {
        return statistics;
    }

    public double now() {
        return clock.now();
    }

    /**
     * @return a fresh, monotonically increasing entity id
     */
    public long nextEntityId() {
        return nextEntityId++;
    }

    public int emittedBy(NodeId generatorId) {
        return emittedByGenerator.getOrDefault(generatorId, 0);
    }

    /**
     * Records one emitted entity for a generator.
     *
     * @return the generator's new emission count
     */
    public int recordEmission(NodeId generatorId) {
        return emittedByGenerator.merge(generatorId, 1, Integer::sum);
    }

    public void registerGenerator(NodeId generatorId) {
        emittedByGenerator.put(generatorId, 0);
    }

    /**
     * Clears everything from a previous run.
     */
    public void reset() {
        clock.reset();
        eventQueue.clear();
        statistics.reset();
        emittedByGenerator.clear();
        nextEntityId = 1;
    }
}
