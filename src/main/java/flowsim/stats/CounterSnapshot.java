package flowsim.stats;

import flowsim.topology.NodeId;

import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of one counter's statistics, including the derived inter-arrival figures.
 */
public record CounterSnapshot(NodeId nodeId,
                              long totalCount,
                              Map<String, Long> countByType,
                              List<Double> arrivalTimes,
                              List<Double> interArrivalTimes,
                              double lastArrivalTime,
                              double throughput,
                              double averageInterArrival,
                              double minInterArrival,
                              double maxInterArrival,
                              double stdDevInterArrival) {

    public CounterSnapshot {
        countByType = Map.copyOf(countByType);
        arrivalTimes = List.copyOf(arrivalTimes);
        interArrivalTimes = List.copyOf(interArrivalTimes);
    }

    /**
     * Reads the figure a dashboard stat refers to.
     */
    public double valueOf(DashboardStatType statType) {
        return switch (statType) {
            case COUNT -> totalCount;
            case RATE -> throughput;
            case AVERAGE -> averageInterArrival;
            case MIN -> minInterArrival;
            case MAX -> maxInterArrival;
            case STD_DEV -> stdDevInterArrival;
        };
    }
}
