package seakers.micscheduler.decoding;

/**
 * One line of a decoded schedule. Frozen entries carry cluster id {@link #NO_CLUSTER}.
 */
public class ScheduledTask {

    public static final int NO_CLUSTER = -1;

    private final int taskId;
    private final int clusterId;
    private final int start;
    private final int end;
    private final int[] units;
    private final boolean frozen;

    public ScheduledTask(int taskId, int clusterId, int start, int end, int[] units, boolean frozen) {
        this.taskId = taskId;
        this.clusterId = clusterId;
        this.start = start;
        this.end = end;
        this.units = units.clone();
        this.frozen = frozen;
    }

    public int getTaskId() {
        return this.taskId;
    }

    public int getClusterId() {
        return this.clusterId;
    }

    public int getStart() {
        return this.start;
    }

    public int getEnd() {
        return this.end;
    }

    public int[] getUnits() {
        return this.units.clone();
    }

    public boolean isFrozen() {
        return this.frozen;
    }

    @Override
    public String toString() {
        return "ScheduledTask{" + "task=" + this.taskId + ", cluster=" + this.clusterId + ", [" + this.start + "," + this.end + ")" + (this.frozen ? ", frozen" : "") + '}';
    }
}
