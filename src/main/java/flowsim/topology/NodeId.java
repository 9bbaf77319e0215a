package flowsim.topology;

/**
 * Immutable identifier of a node in the simulated flow graph.
 * Node ids are supplied by the graph provider and are not required to be contiguous.
 */
public record NodeId(int value) implements Comparable<NodeId> {

    /**
     * Compact constructor with validation.
     *
     * @param value the node id (must be non-negative)
     * @throws IllegalArgumentException if value is negative
     */
    public NodeId {
        if (value < 0) {
            throw new IllegalArgumentException("Node id must be non-negative, got: " + value);
        }
    }

    /**
     * Factory method to create a NodeId from an integer.
     *
     * @param value the node id as an integer (must be non-negative)
     * @return a new NodeId instance
     */
    public static NodeId of(int value) {
        return new NodeId(value);
    }

    @Override
    public int compareTo(NodeId other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "node-" + value;
    }
}
