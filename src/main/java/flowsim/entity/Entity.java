package flowsim.entity;

import flowsim.topology.NodeId;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A discrete unit flowing through the simulated graph.
 *
 * Entities are owned by the simulation thread: only {@code currentNodeId} and the attribute map
 * change while an entity is routed. Observers receive {@link EntitySnapshot}s instead.
 */
public final class Entity {

    private final long id;
    private final String entityType;
    private final String colorHint;
    private final double createdAt;
    private final NodeId sourceNodeId;
    private NodeId currentNodeId;
    private final Map<String, Object> attributes;

    public Entity(long id, String entityType, String colorHint, double createdAt, NodeId sourceNodeId) {
        this(id, entityType, colorHint, createdAt, sourceNodeId, sourceNodeId, new HashMap<>());
    }

    private Entity(long id, String entityType, String colorHint, double createdAt,
                   NodeId sourceNodeId, NodeId currentNodeId, Map<String, Object> attributes) {
        this.id = id;
        this.entityType = Objects.requireNonNull(entityType, "Entity type cannot be null");
        this.colorHint = colorHint;
        this.createdAt = createdAt;
        this.sourceNodeId = Objects.requireNonNull(sourceNodeId, "Source node cannot be null");
        this.currentNodeId = currentNodeId;
        this.attributes = attributes;
    }

    /**
     * Creates a copy for multi-edge fan-out. The copy gets the given id, keeps creation time,
     * source, type and color, and receives its own copy of the attributes.
     */
    public Entity cloneWithId(long newId) {
        return new Entity(newId, entityType, colorHint, createdAt, sourceNodeId, currentNodeId,
                new HashMap<>(attributes));
    }

    public long getId() {
        return id;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getColorHint() {
        return colorHint;
    }

    public double getCreatedAt() {
        return createdAt;
    }

    public NodeId getSourceNodeId() {
        return sourceNodeId;
    }

    public NodeId getCurrentNodeId() {
        return currentNodeId;
    }

    public void moveTo(NodeId nodeId) {
        this.currentNodeId = Objects.requireNonNull(nodeId, "Node cannot be null");
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public EntitySnapshot snapshot() {
        return new EntitySnapshot(id, entityType, colorHint, createdAt, sourceNodeId, currentNodeId, attributes);
    }

    @Override
    public String toString() {
        return entityType + " #" + id;
    }
}
