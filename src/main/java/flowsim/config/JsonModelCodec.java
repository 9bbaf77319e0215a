package flowsim.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import flowsim.random.Distribution;
import flowsim.random.DistributionType;
import flowsim.stats.CounterSnapshot;
import flowsim.stats.DashboardStatType;
import flowsim.topology.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads flow models from JSON and writes counter reports as JSON.
 *
 * Model layout:
 * <pre>
 * {
 *   "nodes": [
 *     {"id": 1, "role": "GENERATOR", "config": {"distribution": "CONSTANT", "param1": 5, "termination": "COUNT", "maxEntities": 3}},
 *     {"id": 2, "role": "COUNTER", "config": {"throughputWindow": 60}},
 *     {"id": 3, "role": "SINK"}
 *   ],
 *   "edges": [{"from": 1, "to": 2}, {"from": 2, "to": 3}]
 * }
 * </pre>
 * Missing config fields take the builder defaults and unknown roles decode as GENERIC.
 */
public final class JsonModelCodec {

    private final ObjectMapper objectMapper;

    public JsonModelCodec() {
        this.objectMapper = createConfiguredObjectMapper();
    }

    /**
     * Creates the ObjectMapper used for models and reports.
     */
    public static ObjectMapper createConfiguredObjectMapper() {
        return new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Topology read(Path modelFile) throws IOException {
        return decode(Files.readAllBytes(modelFile));
    }

    /**
     * Decodes a model document into a topology.
     *
     * @throws IllegalArgumentException if the document is not valid JSON or lacks node ids
     */
    public Topology decode(byte[] data) {
        JsonNode root;
        try {
            root = objectMapper.readTree(data);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to decode model", e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Model must be a JSON object");
        }

        LinkedHashMap<NodeId, RoleConfig> roles = new LinkedHashMap<>();
        for (JsonNode node : root.path("nodes")) {
            if (!node.hasNonNull("id")) {
                throw new IllegalArgumentException("Node without id: " + node);
            }
            NodeId id = NodeId.of(node.get("id").asInt());
            SimulationRole role = SimulationRole.fromName(text(node, "role", null));
            JsonNode config = node.path("config");
            String name = text(config, "name", text(node, "name", defaultName(role)));
            roles.put(id, decodeRole(role, name, config));
        }

        List<Edge> edges = new ArrayList<>();
        for (JsonNode edge : root.path("edges")) {
            if (!edge.hasNonNull("from") || !edge.hasNonNull("to")) {
                throw new IllegalArgumentException("Edge needs from and to: " + edge);
            }
            edges.add(Edge.of(edge.get("from").asInt(), edge.get("to").asInt()));
        }
        return Topology.of(roles, edges);
    }

    private RoleConfig decodeRole(SimulationRole role, String name, JsonNode config) {
        return switch (role) {
            case GENERATOR -> decodeGenerator(name, config);
            case COUNTER -> new CounterConfig(name,
                    config.path("throughputWindow").asDouble(CounterConfig.DEFAULT_THROUGHPUT_WINDOW));
            case CHANCE -> decodeChance(name, config);
            case SINK -> new SinkConfig(name);
            case CLOCK -> new ClockConfig(name);
            case DASHBOARD -> decodeDashboard(name, config);
            case GENERIC -> new GenericConfig(name);
        };
    }

    private GeneratorConfig decodeGenerator(String name, JsonNode config) {
        GeneratorConfig defaults = GeneratorConfig.defaults();
        Distribution fallback = defaults.distribution();
        Distribution distribution = new Distribution(
                enumValue(DistributionType.class, text(config, "distribution", null), fallback.type()),
                config.path("param1").asDouble(fallback.param1()),
                config.path("param2").asDouble(fallback.param2()),
                config.path("param3").asDouble(fallback.param3()));

        return GeneratorConfig.builder()
                .name(name)
                .entityType(text(config, "entityType", defaults.entityType()))
                .color(text(config, "color", defaults.color()))
                .distribution(distribution)
                .timingMode(enumValue(TimingMode.class, text(config, "timingMode", null), defaults.timingMode()))
                .termination(enumValue(TerminationCondition.class, text(config, "termination", null), defaults.termination()))
                .startTime(config.path("startTime").asDouble(defaults.startTime()))
                .stopTime(config.path("stopTime").asDouble(defaults.stopTime()))
                .maxEntities(config.path("maxEntities").asInt(defaults.maxEntities()))
                .batchSize(config.path("batchSize").asInt(defaults.batchSize()))
                .build();
    }

    private ChanceConfig decodeChance(String name, JsonNode config) {
        List<ChanceBranch> branches = new ArrayList<>();
        int index = 0;
        for (JsonNode branch : config.path("branches")) {
            branches.add(ChanceBranch.of(text(branch, "label", "branch-" + index), branch.path("probability").asDouble()));
            index++;
        }
        return new ChanceConfig(name, branches);
    }

    private DashboardConfig decodeDashboard(String name, JsonNode config) {
        List<DashboardStat> stats = new ArrayList<>();
        for (JsonNode stat : config.path("stats")) {
            if (!stat.hasNonNull("sourceCounterId")) {
                continue; // a stat without a counter has nothing to show
            }
            DashboardStatType type = enumValue(DashboardStatType.class, text(stat, "statType", null), DashboardStatType.COUNT);
            stats.add(new DashboardStat(text(stat, "label", type.name()), type,
                    NodeId.of(stat.get("sourceCounterId").asInt())));
        }
        return new DashboardConfig(name, text(config, "title", "Simulation Dashboard"), stats);
    }

    /**
     * Encodes counter snapshots as a JSON report.
     */
    public byte[] encodeReport(double simulationTime, Map<NodeId, CounterSnapshot> counters) {
        ObjectNode report = objectMapper.createObjectNode();
        report.put("simulationTime", simulationTime);
        ArrayNode list = report.putArray("counters");
        counters.forEach((id, snapshot) -> {
            ObjectNode counter = list.addObject();
            counter.put("nodeId", id.value());
            counter.put("totalCount", snapshot.totalCount());
            counter.set("countByType", objectMapper.valueToTree(snapshot.countByType()));
            counter.put("throughput", snapshot.throughput());
            counter.put("averageInterArrival", snapshot.averageInterArrival());
            counter.put("minInterArrival", snapshot.minInterArrival());
            counter.put("maxInterArrival", snapshot.maxInterArrival());
            counter.put("stdDevInterArrival", snapshot.stdDevInterArrival());
            counter.put("lastArrivalTime", snapshot.lastArrivalTime());
        });
        try {
            return objectMapper.writeValueAsBytes(report);
        } catch (IOException e) {
            throw new RuntimeException("Failed to encode report", e);
        }
    }

    private static String defaultName(SimulationRole role) {
        String lower = role.name().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? fallback : value.asText();
    }

    /**
     * Matches enum constants ignoring case, underscores and dashes, so "RatePerUnit",
     * "rate-per-unit" and "RATE_PER_UNIT" all decode the same way.
     */
    static <E extends Enum<E>> E enumValue(Class<E> type, String text, E fallback) {
        if (text == null) {
            return fallback;
        }
        String wanted = normalize(text);
        for (E constant : type.getEnumConstants()) {
            if (normalize(constant.name()).equals(wanted)) {
                return constant;
            }
        }
        throw new IllegalArgumentException("Unknown " + type.getSimpleName() + ": " + text);
    }

    private static String normalize(String text) {
        return text.replace("_", "").replace("-", "").toUpperCase(Locale.ROOT);
    }
}
