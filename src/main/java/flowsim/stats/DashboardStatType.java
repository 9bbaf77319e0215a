package flowsim.stats;

/**
 * Figure a dashboard reads from a counter snapshot.
 */
public enum DashboardStatType {
    COUNT,
    RATE,
    AVERAGE,
    MIN,
    MAX,
    STD_DEV
}
