package flowsim.topology;

import java.util.List;
import java.util.Objects;

/**
 * Informational node aggregating figures from several counters. Entities pass through it unchanged.
 */
public record DashboardConfig(String name, String title, List<DashboardStat> stats) implements RoleConfig {

    public DashboardConfig {
        Objects.requireNonNull(name, "Dashboard name cannot be null");
        Objects.requireNonNull(title, "Dashboard title cannot be null");
        Objects.requireNonNull(stats, "Stats cannot be null");
        stats = List.copyOf(stats);
    }

    @Override
    public SimulationRole role() {
        return SimulationRole.DASHBOARD;
    }
}
