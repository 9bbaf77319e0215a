package flowsim.entity;

import flowsim.topology.NodeId;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Immutable view of an entity at the moment a notification was raised.
 */
public record EntitySnapshot(long id, String entityType, String colorHint, double createdAt,
                             NodeId sourceNodeId, NodeId currentNodeId, Map<String, Object> attributes) {

    public EntitySnapshot {
        attributes = Collections.unmodifiableMap(new HashMap<>(attributes));
    }
}
