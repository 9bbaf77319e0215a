package flowsim.topology;

import java.util.Objects;

/**
 * Directed edge between two nodes. Edges are kept in declaration order, which is
 * the order the router uses for chance branches and broadcast fan-out.
 */
public record Edge(NodeId from, NodeId to) {

    public Edge {
        Objects.requireNonNull(from, "Edge source cannot be null");
        Objects.requireNonNull(to, "Edge target cannot be null");
    }

    public static Edge of(int from, int to) {
        return new Edge(NodeId.of(from), NodeId.of(to));
    }
}
