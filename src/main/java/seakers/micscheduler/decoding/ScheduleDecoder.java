package seakers.micscheduler.decoding;

import seakers.micscheduler.diagnostics.Diagnostic;
import seakers.micscheduler.diagnostics.DiagnosticType;
import seakers.micscheduler.model.ResourceCapacity;
import seakers.micscheduler.model.ResourceType;
import seakers.micscheduler.model.ScheduleChromosome;
import seakers.micscheduler.model.Task;
import seakers.micscheduler.model.TaskStatus;
import seakers.micscheduler.model.WorkingCalendar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Serial schedule generation: turns a cluster-order chromosome into a timed, resourced schedule.
 *
 * Stateless, and a pure function of (chromosome, instance), so any number of threads may share one decoder.
 */
public class ScheduleDecoder {

    public DecodedSchedule decode(ScheduleChromosome chromosome, SchedulingInstance instance) {
        if (chromosome.size() != instance.getClusterCount()) {
            throw new IllegalArgumentException("Chromosome covers " + chromosome.size() + " clusters but the instance has " + instance.getClusterCount());
        }
        return new Pass(instance).run(chromosome);
    }

    /**
     * Mutable working state of a single decode
     */
    private static final class Pass {

        private final SchedulingInstance instance;
        private final WorkingCalendar calendar;
        private final ResourceCapacity capacity;
        private final ResourceTimeline timeline;
        private final Map<Integer, Integer> finish;
        private final Set<Integer> dropped;
        private final Set<Integer> frozenIds;
        private final List<ScheduledTask> entries;
        private final List<Diagnostic> diagnostics;

        private double cost;
        private double risk;
        private double delay;
        private int activations;
        private int overflowUnitHours;
        private int previousCluster;

        Pass(SchedulingInstance instance) {
            this.instance = instance;
            this.calendar = instance.getCalendar();
            this.capacity = instance.getCapacity();
            this.timeline = new ResourceTimeline(ResourceType.COUNT);
            this.finish = new HashMap<>(instance.getExternalFinish());
            this.dropped = new HashSet<>();
            this.frozenIds = new HashSet<>();
            this.entries = new ArrayList<>();
            this.diagnostics = new ArrayList<>();
            this.previousCluster = Integer.MIN_VALUE;
        }

        DecodedSchedule run(ScheduleChromosome chromosome) {
            placeFrozen();

            LinkedList<Integer> remaining = new LinkedList<>();
            for (int position = 0; position < chromosome.size(); position++) {
                remaining.addAll(this.instance.membersOf(chromosome.get(position)));
            }

            while (!remaining.isEmpty()) {
                Integer next = null;
                boolean droppedAny = false;
                Iterator<Integer> iterator = remaining.iterator();
                while (iterator.hasNext()) {
                    int taskId = iterator.next();
                    Integer blocked = droppedPredecessor(taskId);
                    if (blocked != null) {
                        iterator.remove();
                        drop(Diagnostic.infeasiblePredecessor(taskId, blocked, "Task " + taskId + " depends on task " + blocked + ", which could not be scheduled"));
                        droppedAny = true;
                        continue;
                    }
                    if (predecessorsResolved(taskId)) {
                        iterator.remove();
                        next = taskId;
                        break;
                    }
                }
                if (next == null && droppedAny) {
                    continue;
                }
                if (next == null) {
                    // nothing is eligible: the rest wait on each other
                    for (int taskId : remaining) {
                        drop(Diagnostic.infeasiblePredecessor(taskId, firstUnresolved(taskId), "Task " + taskId + " waits on an unsatisfiable predecessor chain"));
                    }
                    remaining.clear();
                    break;
                }
                place(this.instance.getTask(next));
            }

            return new DecodedSchedule(this.entries, this.cost, this.risk, this.delay, this.activations, this.overflowUnitHours, this.diagnostics, this.timeline.snapshot());
        }

        private void placeFrozen() {
            for (Task task : this.instance.getFrozen()) {
                int start = task.getStatus() == TaskStatus.IN_PROGRESS && task.getActualStart() != Task.UNSET ? task.getActualStart() : task.getPlannedStart();
                int end = task.getPlannedEnd();
                List<Integer> slots = new ArrayList<>();
                for (int t = start; t < end; t++) {
                    if (this.calendar.isWorkingHour(t)) {
                        slots.add(t);
                    }
                }
                int[] slotArray = new int[slots.size()];
                for (int i = 0; i < slotArray.length; i++) {
                    slotArray[i] = slots.get(i);
                }
                this.timeline.reserve(slotArray, task.getDemand());
                this.finish.put(task.getId(), end);
                this.frozenIds.add(task.getId());
                this.entries.add(new ScheduledTask(task.getId(), ScheduledTask.NO_CLUSTER, start, end, task.getDemand(), true));
            }
        }

        private boolean isKnown(int taskId) {
            return this.instance.getTasks().containsKey(taskId) || this.frozenIds.contains(taskId) || this.instance.getExternalFinish().containsKey(taskId);
        }

        private boolean predecessorsResolved(int taskId) {
            for (int predecessor : this.instance.getTask(taskId).getPredecessors()) {
                if (isKnown(predecessor) && !this.finish.containsKey(predecessor)) {
                    return false;
                }
            }
            return true;
        }

        private Integer droppedPredecessor(int taskId) {
            for (int predecessor : this.instance.getTask(taskId).getPredecessors()) {
                if (this.dropped.contains(predecessor)) {
                    return predecessor;
                }
            }
            return null;
        }

        private Integer firstUnresolved(int taskId) {
            for (int predecessor : this.instance.getTask(taskId).getPredecessors()) {
                if (isKnown(predecessor) && !this.finish.containsKey(predecessor)) {
                    return predecessor;
                }
            }
            return null;
        }

        private void drop(Diagnostic diagnostic) {
            int taskId = diagnostic.getTaskIds().get(0);
            this.dropped.add(taskId);
            this.diagnostics.add(diagnostic);
            // an unplaced task counts as finishing at the horizon so that dropping work never looks attractive
            Task task = this.instance.getTask(taskId);
            int target = this.instance.targetFinish(taskId);
            this.delay += Math.max(0, this.instance.getHorizonEnd() - target) * task.getCriticality() / 10.0;
        }

        private void place(Task task) {
            int[] demand = task.getDemand();
            int origin = this.instance.getOrigin();
            int horizonEnd = this.instance.getHorizonEnd();

            for (ResourceType type : ResourceType.values()) {
                int peak = this.capacity.peakCapacity(type.ordinal(), origin, horizonEnd);
                if (demand[type.ordinal()] > peak) {
                    drop(Diagnostic.infeasibleResource(task.getId(), type, "Task " + task.getId() + " needs " + demand[type.ordinal()] + " x " + type.getLabel() + " but at most " + peak + " are ever available"));
                    return;
                }
            }

            int earliest = Math.max(origin, task.getReleaseHour());
            Integer latestPredecessor = null;
            for (int predecessor : task.getPredecessors()) {
                Integer predecessorFinish = this.finish.get(predecessor);
                if (predecessorFinish != null && predecessorFinish > earliest) {
                    earliest = predecessorFinish;
                    latestPredecessor = predecessor;
                }
            }
            earliest = this.calendar.nextWorkingHour(earliest);

            int[] slots = this.calendar.workingSlots(earliest, task.getDuration());
            if (slots[slots.length - 1] >= horizonEnd) {
                String message = "Task " + task.getId() + " cannot finish before the horizon end at hour " + horizonEnd;
                if (latestPredecessor != null) {
                    drop(Diagnostic.infeasiblePredecessor(task.getId(), latestPredecessor, message));
                } else {
                    drop(new Diagnostic(DiagnosticType.SCHEDULE_INFEASIBLE, Collections.singletonList(task.getId()), Collections.emptyList(), null, null, message));
                }
                return;
            }

            int start = earliest;
            int[] placed = null;
            while (true) {
                slots = this.calendar.workingSlots(start, task.getDuration());
                if (slots[slots.length - 1] >= horizonEnd) {
                    break;
                }
                int conflict = this.timeline.firstConflict(slots, demand, this.capacity);
                if (conflict < 0) {
                    placed = slots;
                    break;
                }
                start = this.calendar.nextWorkingHour(conflict + 1);
            }

            if (placed == null) {
                slots = this.calendar.workingSlots(earliest, task.getDuration());
                if (this.instance.isOverflowAllowed()) {
                    placed = slots;
                    int overflow = this.timeline.overflowUnitHours(slots, demand, this.capacity);
                    this.overflowUnitHours += overflow;
                    this.cost += overflow * this.instance.getCostModel().getOverflowPenalty();
                } else {
                    int conflict = this.timeline.firstConflict(slots, demand, this.capacity);
                    int blocking = conflict < 0 ? 0 : this.timeline.blockingResource(conflict, demand, this.capacity);
                    ResourceType type = ResourceType.values()[Math.max(0, blocking)];
                    drop(Diagnostic.infeasibleResource(task.getId(), type, "Task " + task.getId() + " finds no free " + type.getLabel() + " before the horizon end at hour " + horizonEnd));
                    return;
                }
            }

            int begin = placed[0];
            int end = placed[placed.length - 1] + 1;
            this.timeline.reserve(placed, demand);
            this.finish.put(task.getId(), end);
            int clusterId = this.instance.clusterOf(task.getId());
            this.entries.add(new ScheduledTask(task.getId(), clusterId, begin, end, demand, false));

            if (clusterId != this.previousCluster) {
                this.activations++;
                this.cost += this.instance.getCostModel().getSetupCost();
                this.previousCluster = clusterId;
            }
            this.cost += this.instance.getCostModel().directCost(demand, task.getDuration(), this.calendar.getHoursPerDay(), task.isUrgent());

            double weight = task.getCriticality() / 10.0;
            for (int slot : placed) {
                this.risk += weight * this.instance.getRiskProvider().riskMultiplier(this.calendar.monthAt(slot), task.getSystem());
            }
            this.delay += Math.max(0, end - this.instance.targetFinish(task.getId())) * weight;
        }
    }
}
