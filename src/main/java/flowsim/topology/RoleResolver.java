package flowsim.topology;

/**
 * Lookup from node id to its role configuration, supplied by the graph provider.
 * Returning null means the node has no simulation role and behaves as a generic pass-through.
 */
@FunctionalInterface
public interface RoleResolver {

    RoleConfig resolve(NodeId nodeId);
}
