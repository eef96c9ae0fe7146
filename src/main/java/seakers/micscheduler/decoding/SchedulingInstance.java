package seakers.micscheduler.decoding;

import seakers.micscheduler.model.Cluster;
import seakers.micscheduler.model.ResourceCapacity;
import seakers.micscheduler.model.Task;
import seakers.micscheduler.model.WorkingCalendar;
import seakers.micscheduler.risk.EnvironmentalRiskProvider;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of everything a decode depends on. Tasks are copied on the way in, so later changes
 * to the controller's registry never leak into an optimization that is already running.
 */
public class SchedulingInstance {

    private final Map<Integer, Task> tasks;
    private final List<Cluster> clusters;
    private final List<List<Integer>> clusterOrder;
    private final Map<Integer, Integer> clusterOfTask;
    private final List<Task> frozen;
    private final Map<Integer, Integer> externalFinish;
    private final ResourceCapacity capacity;
    private final WorkingCalendar calendar;
    private final int origin;
    private final int horizonEnd;
    private final CostModel costModel;
    private final EnvironmentalRiskProvider riskProvider;
    private final boolean overflowAllowed;
    private final Map<Integer, Integer> targetFinish;

    /**
     * @param tasks schedulable tasks, each a member of exactly one cluster
     * @param clusters clusters over {@code tasks}
     * @param frozen committed tasks placed as-is before decoding starts
     * @param externalFinish finish hours of completed (possibly archived) tasks that may appear as predecessors
     * @param origin earliest hour anything may be scheduled
     * @param horizonEnd hour by which every task must be finished
     * @param overflowAllowed whether over-capacity placement with a cost penalty is permitted
     */
    public SchedulingInstance(Collection<Task> tasks, List<Cluster> clusters, Collection<Task> frozen, Map<Integer, Integer> externalFinish,
                              ResourceCapacity capacity, WorkingCalendar calendar, int origin, int horizonEnd,
                              CostModel costModel, EnvironmentalRiskProvider riskProvider, boolean overflowAllowed) {
        if (horizonEnd <= origin) {
            throw new IllegalArgumentException("Horizon end " + horizonEnd + " is not after origin " + origin);
        }
        Map<Integer, Task> taskCopies = new LinkedHashMap<>();
        List<Task> sorted = new ArrayList<>(tasks);
        sorted.sort(Comparator.comparingInt(Task::getId));
        for (Task task : sorted) {
            taskCopies.put(task.getId(), task.copy());
        }
        this.tasks = Collections.unmodifiableMap(taskCopies);
        this.clusters = Collections.unmodifiableList(new ArrayList<>(clusters));

        Map<Integer, Integer> membership = new HashMap<>();
        List<List<Integer>> order = new ArrayList<>();
        for (int index = 0; index < clusters.size(); index++) {
            Cluster cluster = clusters.get(index);
            List<Integer> members = new ArrayList<>();
            for (int taskId : cluster.getMemberIds()) {
                if (!taskCopies.containsKey(taskId)) {
                    throw new IllegalArgumentException("Cluster " + cluster.getId() + " refers to task " + taskId + " outside the instance");
                }
                if (membership.put(taskId, cluster.getId()) != null) {
                    throw new IllegalArgumentException("Task " + taskId + " belongs to more than one cluster");
                }
                members.add(taskId);
            }
            members.sort(Comparator.comparingInt((Integer id) -> taskCopies.get(id).getCriticality()).thenComparingInt(id -> id));
            order.add(Collections.unmodifiableList(members));
        }
        if (membership.size() != taskCopies.size()) {
            Set<Integer> missing = new HashSet<>(taskCopies.keySet());
            missing.removeAll(membership.keySet());
            throw new IllegalArgumentException("Tasks without a cluster: " + missing);
        }
        this.clusterOrder = Collections.unmodifiableList(order);
        this.clusterOfTask = Collections.unmodifiableMap(membership);

        List<Task> frozenCopies = new ArrayList<>();
        for (Task task : frozen) {
            frozenCopies.add(task.copy());
        }
        frozenCopies.sort(Comparator.comparingInt(Task::getId));
        this.frozen = Collections.unmodifiableList(frozenCopies);
        this.externalFinish = Collections.unmodifiableMap(new HashMap<>(externalFinish));
        this.capacity = capacity;
        this.calendar = calendar;
        this.origin = origin;
        this.horizonEnd = horizonEnd;
        this.costModel = costModel;
        this.riskProvider = riskProvider;
        this.overflowAllowed = overflowAllowed;
        this.targetFinish = Collections.unmodifiableMap(computeTargetFinish());
    }

    /**
     * Delay reference per task: its deadline when it has one, otherwise the earliest finish ignoring resource limits
     */
    private Map<Integer, Integer> computeTargetFinish() {
        Map<Integer, Integer> frozenFinish = new HashMap<>();
        for (Task task : this.frozen) {
            frozenFinish.put(task.getId(), task.getPlannedEnd());
        }
        Map<Integer, Integer> earliest = new HashMap<>();
        Set<Integer> visiting = new HashSet<>();
        for (int taskId : this.tasks.keySet()) {
            earliestFinish(taskId, frozenFinish, earliest, visiting);
        }
        Map<Integer, Integer> targets = new HashMap<>();
        for (Task task : this.tasks.values()) {
            targets.put(task.getId(), task.hasDeadline() ? task.getDeadline() : earliest.get(task.getId()));
        }
        return targets;
    }

    private int earliestFinish(int taskId, Map<Integer, Integer> frozenFinish, Map<Integer, Integer> earliest, Set<Integer> visiting) {
        Integer known = earliest.get(taskId);
        if (known != null) {
            return known;
        }
        Task task = this.tasks.get(taskId);
        visiting.add(taskId);
        int start = Math.max(this.origin, task.getReleaseHour());
        for (int predecessor : task.getPredecessors()) {
            if (this.tasks.containsKey(predecessor)) {
                if (!visiting.contains(predecessor)) {
                    start = Math.max(start, earliestFinish(predecessor, frozenFinish, earliest, visiting));
                }
            } else if (frozenFinish.containsKey(predecessor)) {
                start = Math.max(start, frozenFinish.get(predecessor));
            } else if (this.externalFinish.containsKey(predecessor)) {
                start = Math.max(start, this.externalFinish.get(predecessor));
            }
        }
        visiting.remove(taskId);
        int finish = this.calendar.addWorkingHours(start, task.getDuration());
        earliest.put(taskId, finish);
        return finish;
    }

    public Map<Integer, Task> getTasks() {
        return this.tasks;
    }

    public Task getTask(int taskId) {
        return this.tasks.get(taskId);
    }

    public List<Cluster> getClusters() {
        return this.clusters;
    }

    public int getClusterCount() {
        return this.clusters.size();
    }

    /**
     * Task ids of the cluster at {@code index}, in intra-cluster execution order
     */
    public List<Integer> membersOf(int index) {
        return this.clusterOrder.get(index);
    }

    public int clusterIdAt(int index) {
        return this.clusters.get(index).getId();
    }

    public Integer clusterOf(int taskId) {
        return this.clusterOfTask.get(taskId);
    }

    public List<Task> getFrozen() {
        return this.frozen;
    }

    public Map<Integer, Integer> getExternalFinish() {
        return this.externalFinish;
    }

    public ResourceCapacity getCapacity() {
        return this.capacity;
    }

    public WorkingCalendar getCalendar() {
        return this.calendar;
    }

    public int getOrigin() {
        return this.origin;
    }

    public int getHorizonEnd() {
        return this.horizonEnd;
    }

    public CostModel getCostModel() {
        return this.costModel;
    }

    public EnvironmentalRiskProvider getRiskProvider() {
        return this.riskProvider;
    }

    public boolean isOverflowAllowed() {
        return this.overflowAllowed;
    }

    public int targetFinish(int taskId) {
        return this.targetFinish.get(taskId);
    }
}
