package flowsim.topology;

import java.util.*;

/**
 * Immutable flow graph handed to the engine: node ids, directed edges and the role of every node.
 * Provides id-based lookup of roles and declaration-ordered outgoing edges.
 */
public class Topology {

    private final List<NodeId> nodes;
    private final List<Edge> edges;
    private final Map<NodeId, RoleConfig> roles;
    private final Map<NodeId, List<Edge>> outgoing;

    /**
     * Creates a new Topology.
     *
     * @param nodes the node ids in declaration order (must not be null or contain duplicates)
     * @param edges the directed edges in declaration order (must not be null)
     * @param resolver lookup of each node's role configuration (must not be null)
     * @throws NullPointerException if any argument is null
     * @throws IllegalArgumentException if nodes contains duplicates
     */
    public Topology(List<NodeId> nodes, List<Edge> edges, RoleResolver resolver) {
        Objects.requireNonNull(nodes, "Nodes list cannot be null");
        Objects.requireNonNull(edges, "Edges list cannot be null");
        Objects.requireNonNull(resolver, "Role resolver cannot be null");

        validateNoDuplicates(nodes);

        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);

        Map<NodeId, RoleConfig> roleMap = new HashMap<>();
        for (NodeId node : nodes) {
            RoleConfig config = resolver.resolve(node);
            roleMap.put(node, config != null ? config : GenericConfig.named(node.toString()));
        }
        this.roles = Map.copyOf(roleMap);

        // Edges pointing at unknown nodes stay in the adjacency; the router ignores them on delivery
        Map<NodeId, List<Edge>> adjacency = new HashMap<>();
        for (Edge edge : edges) {
            adjacency.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge);
        }
        Map<NodeId, List<Edge>> frozen = new HashMap<>();
        adjacency.forEach((from, list) -> frozen.put(from, List.copyOf(list)));
        this.outgoing = Map.copyOf(frozen);
    }

    private static void validateNoDuplicates(List<NodeId> nodes) {
        if (nodes.size() != new HashSet<>(nodes).size()) {
            throw new IllegalArgumentException("Nodes list contains duplicates");
        }
    }

    /**
     * Convenience factory for graphs whose roles are already known.
     *
     * @param roles node ids mapped to their configuration; iteration order becomes the node order
     * @param edges the directed edges in declaration order
     */
    public static Topology of(LinkedHashMap<NodeId, RoleConfig> roles, List<Edge> edges) {
        return new Topology(new ArrayList<>(roles.keySet()), edges, roles::get);
    }

    /**
     * Gets the role configuration of a node.
     *
     * @param nodeId the node identifier
     * @return the configuration, or empty if the node is not part of this topology
     */
    public Optional<RoleConfig> roleOf(NodeId nodeId) {
        return Optional.ofNullable(roles.get(nodeId));
    }

    /**
     * Returns the outgoing edges of a node in declaration order.
     *
     * @param nodeId the node identifier
     * @return an immutable list, empty when the node has no outgoing edges or is unknown
     */
    public List<Edge> outgoingEdges(NodeId nodeId) {
        return outgoing.getOrDefault(nodeId, List.of());
    }

    /**
     * Checks if a node with the given id exists in the topology.
     */
    public boolean contains(NodeId nodeId) {
        return roles.containsKey(nodeId);
    }

    /**
     * Returns the ids of all nodes with the given role, in declaration order.
     */
    public List<NodeId> nodesWithRole(SimulationRole role) {
        List<NodeId> result = new ArrayList<>();
        for (NodeId node : nodes) {
            if (roles.get(node).role() == role) {
                result.add(node);
            }
        }
        return result;
    }

    public List<NodeId> getAllNodes() {
        return nodes;
    }

    public List<Edge> getAllEdges() {
        return edges;
    }

    public int size() {
        return nodes.size();
    }
}
