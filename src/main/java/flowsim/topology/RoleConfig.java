package flowsim.topology;

/**
 * Per-node role configuration. Every implementation is immutable and is treated
 * as read-only for the duration of a run.
 */
public sealed interface RoleConfig
        permits GeneratorConfig, CounterConfig, ChanceConfig, SinkConfig, ClockConfig, DashboardConfig, GenericConfig {

    /**
     * @return the role this configuration describes
     */
    SimulationRole role();

    /**
     * @return display name of the node
     */
    String name();
}
