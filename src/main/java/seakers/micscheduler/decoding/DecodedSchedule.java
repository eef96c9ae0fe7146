package seakers.micscheduler.decoding;

import seakers.micscheduler.diagnostics.Diagnostic;
import seakers.micscheduler.diagnostics.DiagnosticType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Concrete timed, resourced schedule produced from one chromosome, with its objective values
 */
public class DecodedSchedule {

    private final List<ScheduledTask> entries;
    private final Map<Integer, ScheduledTask> entryByTask;
    private final double cost;
    private final double risk;
    private final double delay;
    private final int clusterActivations;
    private final int overflowUnitHours;
    private final List<Diagnostic> diagnostics;
    private final SortedMap<Integer, int[]> utilization;

    public DecodedSchedule(List<ScheduledTask> entries, double cost, double risk, double delay, int clusterActivations, int overflowUnitHours, List<Diagnostic> diagnostics, SortedMap<Integer, int[]> utilization) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        Map<Integer, ScheduledTask> byTask = new LinkedHashMap<>();
        for (ScheduledTask entry : entries) {
            byTask.put(entry.getTaskId(), entry);
        }
        this.entryByTask = Collections.unmodifiableMap(byTask);
        this.cost = cost;
        this.risk = risk;
        this.delay = delay;
        this.clusterActivations = clusterActivations;
        this.overflowUnitHours = overflowUnitHours;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
        this.utilization = Collections.unmodifiableSortedMap(utilization);
    }

    /**
     * Frozen entries first, then decoded tasks in placement order
     */
    public List<ScheduledTask> getEntries() {
        return this.entries;
    }

    public ScheduledTask entryFor(int taskId) {
        return this.entryByTask.get(taskId);
    }

    public double getCost() {
        return this.cost;
    }

    public double getRisk() {
        return this.risk;
    }

    public double getDelay() {
        return this.delay;
    }

    public double[] getObjectives() {
        return new double[]{this.cost, this.risk, this.delay};
    }

    public int getClusterActivations() {
        return this.clusterActivations;
    }

    public int getOverflowUnitHours() {
        return this.overflowUnitHours;
    }

    public List<Diagnostic> getDiagnostics() {
        return this.diagnostics;
    }

    /**
     * False when at least one task could not be placed at all
     */
    public boolean isFeasible() {
        for (Diagnostic diagnostic : this.diagnostics) {
            if (diagnostic.getType() == DiagnosticType.SCHEDULE_INFEASIBLE) {
                return false;
            }
        }
        return true;
    }

    /**
     * Units in use per occupied hour slot, indexed by resource type ordinal
     */
    public SortedMap<Integer, int[]> getUtilization() {
        return this.utilization;
    }

    public int getMakespanEnd() {
        int end = 0;
        for (ScheduledTask entry : this.entries) {
            end = Math.max(end, entry.getEnd());
        }
        return end;
    }
}
