package seakers.micscheduler.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResourceCapacityTest {

    @Test
    @DisplayName("defaults follow the resource table")
    void defaults() {
        ResourceCapacity capacity = ResourceCapacity.defaults();
        assertEquals(10, capacity.capacityAt(ResourceType.SKILLED.ordinal(), 0));
        assertEquals(2, capacity.capacityAt(ResourceType.CRANE.ordinal(), 500));
        assertFalse(capacity.isTimeVarying());
    }

    @Test
    @DisplayName("a capacity change applies from its hour on and leaves the original table alone")
    void timeVarying() {
        ResourceCapacity original = ResourceCapacity.defaults();
        ResourceCapacity reduced = original.withCapacity(ResourceType.CRANE, 1, 100);

        assertEquals(2, reduced.capacityAt(ResourceType.CRANE.ordinal(), 99));
        assertEquals(1, reduced.capacityAt(ResourceType.CRANE.ordinal(), 100));
        assertEquals(10, reduced.capacityAt(ResourceType.SKILLED.ordinal(), 100));
        assertEquals(2, original.capacityAt(ResourceType.CRANE.ordinal(), 100));
        assertTrue(reduced.isTimeVarying());

        assertEquals(2, reduced.peakCapacity(ResourceType.CRANE.ordinal(), 0, 200));
        assertEquals(1, reduced.peakCapacity(ResourceType.CRANE.ordinal(), 100, 200));
    }

    @Test
    @DisplayName("a later change overrides earlier ones from its hour")
    void laterChangeOverrides() {
        ResourceCapacity capacity = ResourceCapacity.defaults()
                .withCapacity(ResourceType.CRANE, 4, 200)
                .withCapacity(ResourceType.CRANE, 1, 100);
        assertEquals(1, capacity.capacityAt(ResourceType.CRANE.ordinal(), 150));
        assertEquals(1, capacity.capacityAt(ResourceType.CRANE.ordinal(), 250));
    }

    @Test
    @DisplayName("invalid vectors are rejected")
    void invalid() {
        assertThrows(IllegalArgumentException.class, () -> new ResourceCapacity(new int[]{1, 2}));
        assertThrows(IllegalArgumentException.class, () -> new ResourceCapacity(new int[]{1, 1, 1, -1, 1, 1}));
        assertThrows(IllegalArgumentException.class, () -> ResourceCapacity.defaults().withCapacity(ResourceType.CRANE, -1, 0));
    }
}
