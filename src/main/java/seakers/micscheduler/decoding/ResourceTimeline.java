package seakers.micscheduler.decoding;

import seakers.micscheduler.model.ResourceCapacity;

import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Units in use per hour slot, built up while a chromosome is decoded. Only occupied slots are stored.
 */
class ResourceTimeline {

    private final Map<Integer, int[]> usage = new HashMap<>();
    private final int resourceCount;

    ResourceTimeline(int resourceCount) {
        this.resourceCount = resourceCount;
    }

    /**
     * @return the first slot where adding {@code demand} would exceed capacity, or -1 if all slots fit
     */
    int firstConflict(int[] slots, int[] demand, ResourceCapacity capacity) {
        for (int slot : slots) {
            if (blockingResource(slot, demand, capacity) >= 0) {
                return slot;
            }
        }
        return -1;
    }

    int blockingResource(int slot, int[] demand, ResourceCapacity capacity) {
        int[] used = this.usage.get(slot);
        for (int r = 0; r < this.resourceCount; r++) {
            if (demand[r] == 0) {
                continue;
            }
            int inUse = used == null ? 0 : used[r];
            if (inUse + demand[r] > capacity.capacityAt(r, slot)) {
                return r;
            }
        }
        return -1;
    }

    /**
     * Unit-hours of {@code demand} that would not fit in the given slots
     */
    int overflowUnitHours(int[] slots, int[] demand, ResourceCapacity capacity) {
        int overflow = 0;
        for (int slot : slots) {
            int[] used = this.usage.get(slot);
            for (int r = 0; r < this.resourceCount; r++) {
                int inUse = used == null ? 0 : used[r];
                int free = Math.max(0, capacity.capacityAt(r, slot) - inUse);
                overflow += Math.max(0, demand[r] - free);
            }
        }
        return overflow;
    }

    void reserve(int[] slots, int[] demand) {
        for (int slot : slots) {
            int[] used = this.usage.computeIfAbsent(slot, key -> new int[this.resourceCount]);
            for (int r = 0; r < this.resourceCount; r++) {
                used[r] += demand[r];
            }
        }
    }

    SortedMap<Integer, int[]> snapshot() {
        SortedMap<Integer, int[]> copy = new TreeMap<>();
        for (Map.Entry<Integer, int[]> entry : this.usage.entrySet()) {
            copy.put(entry.getKey(), entry.getValue().clone());
        }
        return copy;
    }
}
