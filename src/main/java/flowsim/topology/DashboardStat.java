package flowsim.topology;

import flowsim.stats.DashboardStatType;

import java.util.Objects;

/**
 * A single figure shown on a dashboard, read from one counter node.
 */
public record DashboardStat(String label, DashboardStatType statType, NodeId sourceCounterId) {

    public DashboardStat {
        Objects.requireNonNull(label, "Label cannot be null");
        Objects.requireNonNull(statType, "Stat type cannot be null");
        Objects.requireNonNull(sourceCounterId, "Source counter cannot be null");
    }
}
