package flowsim.simulation;

import flowsim.entity.Entity;
import flowsim.random.RandomVariateSampler;
import flowsim.topology.ChanceBranch;
import flowsim.topology.ChanceConfig;
import flowsim.topology.Edge;
import flowsim.topology.NodeId;
import flowsim.topology.RoleConfig;
import flowsim.topology.Topology;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Moves entities along outgoing edges and hands them to the node processor on arrival.
 *
 * Routing is synchronous: an entity travels through every pass-through node in the same event
 * until it is consumed by a sink or reaches a node without outgoing edges. The cascade runs on an
 * explicit work stack, so long chains and cycles never grow the call stack.
 */
final class EntityRouter {

    private static final Logger logger = Logger.getLogger(EntityRouter.class.getName());

    private final Topology topology;
    private final SimulationState state;
    private final RandomVariateSampler sampler;
    private final NodeProcessor processor;
    private final int maxRoutingDepth;
    private final Set<NodeId> reportedChanceMismatches = new HashSet<>();

    EntityRouter(Topology topology, SimulationState state, RandomVariateSampler sampler,
                 NodeProcessor processor, int maxRoutingDepth) {
        this.topology = topology;
        this.state = state;
        this.sampler = sampler;
        this.processor = processor;
        this.maxRoutingDepth = maxRoutingDepth;
    }

    /**
     * A pending hand-over of an entity to a node, {@code depth} hops into the current cascade.
     */
    private record Delivery(Entity entity, NodeId toNodeId, int depth) {
    }

    /**
     * Forwards an entity leaving {@code fromNodeId}.
     */
    void route(Entity entity, NodeId fromNodeId) {
        Deque<Delivery> pending = new ArrayDeque<>();
        forward(entity, fromNodeId, 0, pending);
        deliverAll(pending);
    }

    /**
     * Delivers an entity to a node and lets the node's role decide whether it travels on.
     * Unknown nodes are ignored.
     */
    void sendToNode(Entity entity, NodeId toNodeId) {
        Deque<Delivery> pending = new ArrayDeque<>();
        pending.push(new Delivery(entity, toNodeId, 0));
        deliverAll(pending);
    }

    /**
     * Works through the cascade depth first: a recipient and everything it forwards to are
     * processed before the next recipient of the same fan-out.
     */
    private void deliverAll(Deque<Delivery> pending) {
        while (!pending.isEmpty()) {
            Delivery delivery = pending.pop();
            Optional<RoleConfig> config = topology.roleOf(delivery.toNodeId());
            if (config.isEmpty()) {
                continue;
            }
            Entity entity = delivery.entity();
            entity.moveTo(delivery.toNodeId());
            if (processor.onArrival(entity, delivery.toNodeId(), config.get()) == NodeProcessor.Disposition.CONTINUE) {
                forward(entity, delivery.toNodeId(), delivery.depth(), pending);
            }
        }
    }

    private void forward(Entity entity, NodeId fromNodeId, int depth, Deque<Delivery> pending) {
        List<Edge> outgoing = topology.outgoingEdges(fromNodeId);
        if (outgoing.isEmpty()) {
            return;
        }
        if (depth >= maxRoutingDepth) {
            logger.warning(() -> entity + " dropped at " + fromNodeId + " after " + depth
                    + " hops, the graph contains a cycle without a sink");
            return;
        }

        Optional<ChanceConfig> chance = chanceConfigOf(fromNodeId);
        if (chance.isPresent() && branchesMatch(fromNodeId, chance.get(), outgoing)) {
            Edge selected = selectBranch(chance.get().branches(), outgoing);
            pending.push(new Delivery(entity, selected.to(), depth + 1));
            return;
        }

        broadcast(entity, outgoing, depth, pending);
    }

    /**
     * Walks the cumulative probabilities in declared order; rounding gaps fall through to the last edge.
     */
    private Edge selectBranch(List<ChanceBranch> branches, List<Edge> outgoing) {
        double roll = sampler.nextUniform();
        double cumulative = 0;
        for (int i = 0; i < branches.size(); i++) {
            cumulative += branches.get(i).probability();
            if (cumulative >= roll) {
                return outgoing.get(i);
            }
        }
        return outgoing.get(outgoing.size() - 1);
    }

    private void broadcast(Entity entity, List<Edge> outgoing, int depth, Deque<Delivery> pending) {
        // clones copy the entity before the original moves on
        List<Entity> recipients = new ArrayList<>(outgoing.size());
        recipients.add(entity);
        for (int i = 1; i < outgoing.size(); i++) {
            recipients.add(entity.cloneWithId(state.nextEntityId()));
        }
        // pushed in reverse so the first edge is delivered first
        for (int i = outgoing.size() - 1; i >= 0; i--) {
            pending.push(new Delivery(recipients.get(i), outgoing.get(i).to(), depth + 1));
        }
    }

    private Optional<ChanceConfig> chanceConfigOf(NodeId nodeId) {
        return topology.roleOf(nodeId)
                .filter(ChanceConfig.class::isInstance)
                .map(ChanceConfig.class::cast);
    }

    private boolean branchesMatch(NodeId nodeId, ChanceConfig config, List<Edge> outgoing) {
        int branches = config.branches().size();
        if (branches > 0 && branches == outgoing.size()) {
            return true;
        }
        if (reportedChanceMismatches.add(nodeId)) {
            logger.warning(() -> "Chance node " + nodeId + " declares " + branches + " branches for "
                    + outgoing.size() + " outgoing edges, broadcasting instead");
        }
        return false;
    }
}
