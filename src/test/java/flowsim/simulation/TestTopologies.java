package flowsim.simulation;

import flowsim.random.Distribution;
import flowsim.stats.DashboardStatType;
import flowsim.topology.*;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * Small flow graphs shared by the simulation tests.
 */
final class TestTopologies {

    static final NodeId GENERATOR = NodeId.of(1);
    static final NodeId COUNTER = NodeId.of(2);
    static final NodeId SINK = NodeId.of(3);

    private TestTopologies() {
    }

    /**
     * Generator(Constant(interval), Count, maxEntities) -> Counter -> Sink.
     */
    static Topology countedLine(double interval, int maxEntities) {
        return line(GeneratorConfig.builder()
                .distribution(Distribution.constant(interval))
                .termination(TerminationCondition.COUNT)
                .maxEntities(maxEntities)
                .build());
    }

    static Topology line(GeneratorConfig generator) {
        LinkedHashMap<NodeId, RoleConfig> roles = new LinkedHashMap<>();
        roles.put(GENERATOR, generator);
        roles.put(COUNTER, CounterConfig.named("Counter"));
        roles.put(SINK, SinkConfig.named("Sink"));
        return Topology.of(roles, List.of(new Edge(GENERATOR, COUNTER), new Edge(COUNTER, SINK)));
    }

    /**
     * Exponential arrivals split 30/70 by a chance node into two counted sinks, plus a dashboard
     * reading both counters.
     */
    static Topology stochasticSplit(int maxEntities) {
        LinkedHashMap<NodeId, RoleConfig> roles = new LinkedHashMap<>();
        roles.put(NodeId.of(1), GeneratorConfig.builder()
                .distribution(Distribution.exponential(2.0))
                .batchSize(2)
                .termination(TerminationCondition.COUNT)
                .maxEntities(maxEntities)
                .build());
        roles.put(NodeId.of(2), ChanceConfig.withProbabilities("Split", 0.3, 0.7));
        roles.put(NodeId.of(3), CounterConfig.named("Left"));
        roles.put(NodeId.of(4), CounterConfig.named("Right"));
        roles.put(NodeId.of(5), SinkConfig.named("Left exit"));
        roles.put(NodeId.of(6), SinkConfig.named("Right exit"));
        roles.put(NodeId.of(7), new DashboardConfig("Dashboard", "Overview", List.of(
                new DashboardStat("Left", DashboardStatType.COUNT, NodeId.of(3)),
                new DashboardStat("Right", DashboardStatType.COUNT, NodeId.of(4)))));
        return Topology.of(roles, List.of(
                Edge.of(1, 2),
                Edge.of(2, 3), Edge.of(2, 4),
                Edge.of(3, 5), Edge.of(4, 6)));
    }
}
