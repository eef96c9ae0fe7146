package seakers.micscheduler.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An I&M or construction task. All times are hour indices counted from the project origin
 * (see {@link WorkingCalendar}); {@link #UNSET} marks a time that has not been assigned yet.
 *
 * Tasks are mutable records owned by the rolling-horizon controller. Clustering, decoding and
 * optimization only ever see copies taken with {@link #copy()}.
 */
public class Task {

    public static final int UNSET = -1;

    private final int id;
    private final SystemCategory system;
    private final double x;
    private final double y;
    private final double z;
    private final int[] demand;
    private int duration;
    private final Set<Integer> predecessors;
    private int criticality;

    private TaskStatus status;
    private int plannedStart;
    private int plannedEnd;
    private int actualStart;
    private int actualEnd;
    private boolean urgent;
    private int deadline;
    private int releaseHour;
    private int parentId;
    private int completedDuration;
    private String remarks;

    public Task(int id, SystemCategory system, double x, double y, double z, int[] demand, int duration, Set<Integer> predecessors, int criticality) {
        this.id = id;
        this.system = system;
        this.x = x;
        this.y = y;
        this.z = z;
        this.demand = demand == null ? null : demand.clone();
        this.duration = duration;
        this.predecessors = new LinkedHashSet<>();
        if (predecessors != null) {
            this.predecessors.addAll(predecessors);
        }
        this.criticality = criticality;

        this.status = TaskStatus.PENDING;
        this.plannedStart = UNSET;
        this.plannedEnd = UNSET;
        this.actualStart = UNSET;
        this.actualEnd = UNSET;
        this.urgent = false;
        this.deadline = UNSET;
        this.releaseHour = 0;
        this.parentId = UNSET;
        this.completedDuration = 0;
        this.remarks = "";
    }

    /**
     * Deep copy, used to hand immutable snapshots to the clustering and optimization stages
     */
    public Task copy() {
        Task copy = new Task(this.id, this.system, this.x, this.y, this.z, this.demand, this.duration, this.predecessors, this.criticality);
        copy.status = this.status;
        copy.plannedStart = this.plannedStart;
        copy.plannedEnd = this.plannedEnd;
        copy.actualStart = this.actualStart;
        copy.actualEnd = this.actualEnd;
        copy.urgent = this.urgent;
        copy.deadline = this.deadline;
        copy.releaseHour = this.releaseHour;
        copy.parentId = this.parentId;
        copy.completedDuration = this.completedDuration;
        copy.remarks = this.remarks;
        return copy;
    }

    public int getId() {
        return this.id;
    }

    public SystemCategory getSystem() {
        return this.system;
    }

    public double getX() {
        return this.x;
    }

    public double getY() {
        return this.y;
    }

    public double getZ() {
        return this.z;
    }

    public double[] getCoordinates() {
        return new double[]{this.x, this.y, this.z};
    }

    /**
     * @return a copy of the demand vector, indexed by {@link ResourceType#ordinal()}
     */
    public int[] getDemand() {
        return this.demand == null ? null : this.demand.clone();
    }

    public int getDemand(ResourceType type) {
        return this.demand[type.ordinal()];
    }

    public int getDuration() {
        return this.duration;
    }

    public void setDuration(int duration) {
        this.duration = duration;
    }

    public Set<Integer> getPredecessors() {
        return Collections.unmodifiableSet(this.predecessors);
    }

    public void addPredecessor(int predecessorId) {
        this.predecessors.add(predecessorId);
    }

    public void removePredecessor(int predecessorId) {
        this.predecessors.remove(predecessorId);
    }

    public int getCriticality() {
        return this.criticality;
    }

    public void setCriticality(int criticality) {
        this.criticality = criticality;
    }

    public TaskStatus getStatus() {
        return this.status;
    }

    public void setStatus(TaskStatus status) {
        this.status = status;
    }

    public int getPlannedStart() {
        return this.plannedStart;
    }

    public int getPlannedEnd() {
        return this.plannedEnd;
    }

    public void setPlanned(int plannedStart, int plannedEnd) {
        this.plannedStart = plannedStart;
        this.plannedEnd = plannedEnd;
    }

    public boolean isPlanned() {
        return this.plannedStart != UNSET;
    }

    public int getActualStart() {
        return this.actualStart;
    }

    public void setActualStart(int actualStart) {
        this.actualStart = actualStart;
    }

    public int getActualEnd() {
        return this.actualEnd;
    }

    public void setActualEnd(int actualEnd) {
        this.actualEnd = actualEnd;
    }

    public boolean isUrgent() {
        return this.urgent;
    }

    public void setUrgent(boolean urgent) {
        this.urgent = urgent;
    }

    public int getDeadline() {
        return this.deadline;
    }

    public boolean hasDeadline() {
        return this.deadline != UNSET;
    }

    public void setDeadline(int deadline) {
        this.deadline = deadline;
    }

    public int getReleaseHour() {
        return this.releaseHour;
    }

    public void setReleaseHour(int releaseHour) {
        this.releaseHour = releaseHour;
    }

    public int getParentId() {
        return this.parentId;
    }

    public void setParentId(int parentId) {
        this.parentId = parentId;
    }

    public int getCompletedDuration() {
        return this.completedDuration;
    }

    public void setCompletedDuration(int completedDuration) {
        this.completedDuration = completedDuration;
    }

    public String getRemarks() {
        return this.remarks;
    }

    public void setRemarks(String remarks) {
        this.remarks = remarks == null ? "" : remarks;
    }

    public boolean requiresAnyOf(int[] otherDemand) {
        for (int i = 0; i < this.demand.length && i < otherDemand.length; i++) {
            if (this.demand[i] > 0 && otherDemand[i] > 0) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "Task{" + "id=" + this.id + ", system=" + this.system + ", duration=" + this.duration
                + ", criticality=" + this.criticality + ", status=" + this.status
                + ", demand=" + Arrays.toString(this.demand) + ", predecessors=" + this.predecessors + '}';
    }
}
