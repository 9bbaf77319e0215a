package flowsim.stats;

import flowsim.topology.NodeId;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Running arrival statistics of a single counter node.
 *
 * Recording an arrival is O(1) amortized: the throughput window is a moving start index into the
 * chronological arrival list. Average, min, max and standard deviation of the inter-arrival times
 * are derived on demand.
 */
public final class CounterStatistics {

    private final NodeId nodeId;
    private final double throughputWindow;

    private long totalCount;
    private final Map<String, Long> countByType = new LinkedHashMap<>();
    private final List<Double> arrivalTimes = new ArrayList<>();
    private final List<Double> interArrivalTimes = new ArrayList<>();
    private double lastArrivalTime;
    private double throughput;
    private int windowStart;

    public CounterStatistics(NodeId nodeId, double throughputWindow) {
        this.nodeId = nodeId;
        this.throughputWindow = throughputWindow;
    }

    /**
     * Records one arrival at simulation time {@code now}. Arrivals must be recorded in
     * non-decreasing time order, which the scheduler guarantees.
     */
    public void recordArrival(String entityType, double now) {
        totalCount++;
        countByType.merge(entityType, 1L, Long::sum);

        if (!arrivalTimes.isEmpty()) {
            interArrivalTimes.add(now - lastArrivalTime);
        }
        arrivalTimes.add(now);
        lastArrivalTime = now;

        updateThroughput(now);
    }

    private void updateThroughput(double now) {
        if (throughputWindow <= 0) {
            throughput = 0.0;
            return;
        }
        double windowFloor = now - throughputWindow;
        while (windowStart < arrivalTimes.size() && arrivalTimes.get(windowStart) < windowFloor) {
            windowStart++;
        }
        throughput = (arrivalTimes.size() - windowStart) / throughputWindow;
    }

    public NodeId getNodeId() {
        return nodeId;
    }

    public long getTotalCount() {
        return totalCount;
    }

    public double getThroughput() {
        return throughput;
    }

    public double getLastArrivalTime() {
        return lastArrivalTime;
    }

    public double averageInterArrival() {
        if (interArrivalTimes.isEmpty()) {
            return 0.0;
        }
        double sum = 0;
        for (double t : interArrivalTimes) {
            sum += t;
        }
        return sum / interArrivalTimes.size();
    }

    public double minInterArrival() {
        return interArrivalTimes.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
    }

    public double maxInterArrival() {
        return interArrivalTimes.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
    }

    /**
     * Sample standard deviation (n - 1 denominator); 0 with fewer than two inter-arrival times.
     */
    public double stdDevInterArrival() {
        int n = interArrivalTimes.size();
        if (n < 2) {
            return 0.0;
        }
        double average = averageInterArrival();
        double sumSquares = 0;
        for (double t : interArrivalTimes) {
            sumSquares += (t - average) * (t - average);
        }
        return Math.sqrt(sumSquares / (n - 1));
    }

    /**
     * Creates an immutable snapshot of current statistics.
     */
    public CounterSnapshot snapshot() {
        return new CounterSnapshot(
                nodeId,
                totalCount,
                countByType,
                arrivalTimes,
                interArrivalTimes,
                lastArrivalTime,
                throughput,
                averageInterArrival(),
                minInterArrival(),
                maxInterArrival(),
                stdDevInterArrival()
        );
    }
}
