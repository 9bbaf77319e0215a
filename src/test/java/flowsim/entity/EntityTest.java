package flowsim.entity;

import flowsim.topology.NodeId;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EntityTest {

    @Test
    void shouldStartAtSourceNode() {
        Entity entity = new Entity(1, "Customer", "#2196F3", 3.5, NodeId.of(4));

        assertEquals(NodeId.of(4), entity.getSourceNodeId());
        assertEquals(NodeId.of(4), entity.getCurrentNodeId());
        assertEquals(3.5, entity.getCreatedAt());
        assertEquals("Customer #1", entity.toString());
    }

    @Test
    void shouldCloneWithNewIdAndOwnAttributes() {
        // Given
        Entity original = new Entity(1, "Customer", "#2196F3", 3.5, NodeId.of(4));
        original.moveTo(NodeId.of(6));
        original.getAttributes().put("vip", true);

        // When
        Entity clone = original.cloneWithId(9);
        clone.getAttributes().put("vip", false);

        // Then
        assertEquals(9, clone.getId());
        assertEquals("Customer", clone.getEntityType());
        assertEquals("#2196F3", clone.getColorHint());
        assertEquals(3.5, clone.getCreatedAt());
        assertEquals(NodeId.of(4), clone.getSourceNodeId());
        assertEquals(NodeId.of(6), clone.getCurrentNodeId());
        assertEquals(true, original.getAttributes().get("vip"));
    }

    @Test
    void shouldFreezeStateInSnapshot() {
        Entity entity = new Entity(2, "Part", null, 0.0, NodeId.of(1));
        entity.getAttributes().put("weight", 12);

        EntitySnapshot snapshot = entity.snapshot();
        entity.moveTo(NodeId.of(3));
        entity.getAttributes().put("weight", 15);

        assertEquals(NodeId.of(1), snapshot.currentNodeId());
        assertEquals(12, snapshot.attributes().get("weight"));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.attributes().put("weight", 1));
    }

    @Test
    void shouldAllowNullAttributeValuesInSnapshot() {
        Entity entity = new Entity(3, "Part", null, 0.0, NodeId.of(1));
        entity.getAttributes().put("note", null);

        EntitySnapshot snapshot = entity.snapshot();

        assertTrue(snapshot.attributes().containsKey("note"));
        assertNull(snapshot.attributes().get("note"));
    }

    @Test
    void shouldRejectMissingTypeOrSource() {
        assertThrows(NullPointerException.class, () -> new Entity(1, null, null, 0.0, NodeId.of(1)));
        assertThrows(NullPointerException.class, () -> new Entity(1, "Part", null, 0.0, null));
    }
}
