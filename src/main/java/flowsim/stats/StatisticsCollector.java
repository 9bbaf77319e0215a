package flowsim.stats;

import flowsim.topology.DashboardConfig;
import flowsim.topology.DashboardStat;
import flowsim.topology.NodeId;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Collector of per-counter statistics for one simulation run.
 * Mutated only by the simulation thread; readers take snapshots.
 */
public final class StatisticsCollector {

    private final Map<NodeId, CounterStatistics> counters = new LinkedHashMap<>();

    /**
     * Registers a counter node. Registering an already known counter keeps its statistics.
     */
    public void registerCounter(NodeId nodeId, double throughputWindow) {
        counters.computeIfAbsent(nodeId, id -> new CounterStatistics(id, throughputWindow));
    }

    public boolean isCounter(NodeId nodeId) {
        return counters.containsKey(nodeId);
    }

    /**
     * Records an arrival at a counter, registering it with the given window if it was not known.
     *
     * @return the updated statistics
     */
    public CounterStatistics recordArrival(NodeId nodeId, double throughputWindow, String entityType, double now) {
        CounterStatistics stats = counters.computeIfAbsent(nodeId, id -> new CounterStatistics(id, throughputWindow));
        stats.recordArrival(entityType, now);
        return stats;
    }

    public Optional<CounterSnapshot> snapshot(NodeId nodeId) {
        CounterStatistics stats = counters.get(nodeId);
        return stats == null ? Optional.empty() : Optional.of(stats.snapshot());
    }

    /**
     * Creates snapshots of every counter, in registration order.
     */
    public Map<NodeId, CounterSnapshot> snapshotAll() {
        Map<NodeId, CounterSnapshot> result = new LinkedHashMap<>();
        counters.forEach((id, stats) -> result.put(id, stats.snapshot()));
        return result;
    }

    /**
     * Evaluates the stats of a dashboard against the current counters, in declared order.
     * Stats whose source counter is unknown are left out.
     */
    public Map<String, Double> dashboardValues(DashboardConfig dashboard) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (DashboardStat stat : dashboard.stats()) {
            CounterStatistics stats = counters.get(stat.sourceCounterId());
            if (stats != null) {
                values.put(stat.label(), stats.snapshot().valueOf(stat.statType()));
            }
        }
        return values;
    }

    /**
     * Removes all counters and their statistics.
     */
    public void reset() {
        counters.clear();
    }
}
