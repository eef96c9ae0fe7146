package seakers.micscheduler.model;

import java.util.Arrays;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Immutable, piecewise-constant capacity table: each change point holds the capacity vector valid from that hour on
 */
public class ResourceCapacity {

    private final NavigableMap<Integer, int[]> changePoints;

    public ResourceCapacity(int[] capacity) {
        this(singleton(capacity));
    }

    private ResourceCapacity(NavigableMap<Integer, int[]> changePoints) {
        this.changePoints = changePoints;
    }

    private static NavigableMap<Integer, int[]> singleton(int[] capacity) {
        validate(capacity);
        NavigableMap<Integer, int[]> map = new TreeMap<>();
        map.put(0, capacity.clone());
        return map;
    }

    private static void validate(int[] capacity) {
        if (capacity == null || capacity.length != ResourceType.COUNT) {
            throw new IllegalArgumentException("Capacity vector must have " + ResourceType.COUNT + " entries");
        }
        for (int units : capacity) {
            if (units < 0) {
                throw new IllegalArgumentException("Capacity must be non-negative: " + Arrays.toString(capacity));
            }
        }
    }

    public static ResourceCapacity defaults() {
        int[] capacity = new int[ResourceType.COUNT];
        for (ResourceType type : ResourceType.values()) {
            capacity[type.ordinal()] = type.getDefaultCapacity();
        }
        return new ResourceCapacity(capacity);
    }

    /**
     * @return a new table where {@code type} has {@code units} from {@code fromHour} onwards, overriding later change points
     */
    public ResourceCapacity withCapacity(ResourceType type, int units, int fromHour) {
        if (units < 0) {
            throw new IllegalArgumentException("Capacity must be non-negative: " + type + "=" + units);
        }
        NavigableMap<Integer, int[]> copy = new TreeMap<>();
        for (Map.Entry<Integer, int[]> entry : this.changePoints.entrySet()) {
            copy.put(entry.getKey(), entry.getValue().clone());
        }
        if (!copy.containsKey(fromHour)) {
            copy.put(fromHour, capacityVectorAt(fromHour));
        }
        for (int[] capacity : copy.tailMap(fromHour, true).values()) {
            capacity[type.ordinal()] = units;
        }
        return new ResourceCapacity(copy);
    }

    public int capacityAt(int typeIndex, int hour) {
        Map.Entry<Integer, int[]> entry = this.changePoints.floorEntry(hour);
        if (entry == null) {
            entry = this.changePoints.firstEntry();
        }
        return entry.getValue()[typeIndex];
    }

    public int[] capacityVectorAt(int hour) {
        Map.Entry<Integer, int[]> entry = this.changePoints.floorEntry(hour);
        if (entry == null) {
            entry = this.changePoints.firstEntry();
        }
        return entry.getValue().clone();
    }

    /**
     * Highest capacity of a resource type anywhere in {@code [from, to)}; a demand above it can never be satisfied
     */
    public int peakCapacity(int typeIndex, int from, int to) {
        int peak = capacityAt(typeIndex, from);
        for (Map.Entry<Integer, int[]> entry : this.changePoints.subMap(from, false, to, false).entrySet()) {
            peak = Math.max(peak, entry.getValue()[typeIndex]);
        }
        return peak;
    }

    public boolean isTimeVarying() {
        return this.changePoints.size() > 1;
    }
}
