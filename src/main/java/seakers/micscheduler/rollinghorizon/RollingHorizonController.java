package seakers.micscheduler.rollinghorizon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import seakers.micscheduler.ScheduleSearch;
import seakers.micscheduler.SchedulerConfig;
import seakers.micscheduler.clustering.ClusteringResult;
import seakers.micscheduler.clustering.TaskClusterer;
import seakers.micscheduler.decoding.DecodedSchedule;
import seakers.micscheduler.decoding.ScheduleDecoder;
import seakers.micscheduler.decoding.ScheduledTask;
import seakers.micscheduler.decoding.SchedulingInstance;
import seakers.micscheduler.diagnostics.Diagnostic;
import seakers.micscheduler.diagnostics.DiagnosticType;
import seakers.micscheduler.model.ResourceCapacity;
import seakers.micscheduler.model.ResourceType;
import seakers.micscheduler.model.ScheduleChromosome;
import seakers.micscheduler.model.Task;
import seakers.micscheduler.model.TaskStatus;
import seakers.micscheduler.model.WorkingCalendar;
import seakers.micscheduler.moeaclasses.OptimizationResult;
import seakers.micscheduler.moeaclasses.ParetoMember;
import seakers.micscheduler.risk.EnvironmentalRiskProvider;
import seakers.micscheduler.validation.DataValidationException;
import seakers.micscheduler.validation.TaskValidator;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Keeps a live schedule current as time passes and the site changes.
 *
 * Every public operation holds the controller's monitor for its whole duration, including the re-optimization it
 * triggers, so concurrent requests run one after the other against a consistent task registry.
 */
public class RollingHorizonController implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RollingHorizonController.class);

    private final SchedulerConfig config;
    private final WorkingCalendar calendar;
    private final EnvironmentalRiskProvider riskProvider;
    private final Clock clock;
    private final TaskRegistry registry;
    private final TaskValidator validator;
    private final TaskClusterer clusterer;
    private final ExecutorService evaluationPool;

    private ResourceCapacity capacity;
    private RollingWindow window;
    private int replanCount;
    private ReplanResult lastResult;

    public RollingHorizonController(SchedulerConfig config, WorkingCalendar calendar, ResourceCapacity capacity, EnvironmentalRiskProvider riskProvider, Clock clock) {
        this.config = config;
        this.calendar = calendar;
        this.capacity = capacity;
        this.riskProvider = riskProvider;
        this.clock = clock;
        this.registry = new TaskRegistry();
        this.validator = new TaskValidator(config.getBounds());
        this.clusterer = config.newClusterer();
        this.evaluationPool = config.getEvaluationThreads() > 1 ? Executors.newFixedThreadPool(config.getEvaluationThreads()) : null;
        this.window = new RollingWindow(0, config.getCommitWindowHours(), config.getLookaheadHours());
    }

    /**
     * Registers new tasks after validating them against each other and against every task already known
     */
    public synchronized void addTasks(Collection<Task> tasks) throws DataValidationException {
        List<Integer> clashing = new ArrayList<>();
        List<String> problems = new ArrayList<>();
        for (Task task : tasks) {
            if (this.registry.contains(task.getId())) {
                clashing.add(task.getId());
                problems.add("Task " + task.getId() + ": id already in use");
            }
        }
        if (!clashing.isEmpty()) {
            throw new DataValidationException(clashing, problems);
        }
        this.validator.validate(tasks, this.registry.knownIds());
        for (Task task : tasks) {
            this.registry.register(task);
        }
        log.info("Registered {} tasks", tasks.size());
    }

    public synchronized ReplanResult replan() {
        return replanWith(new ArrayList<>());
    }

    private ReplanResult replanWith(List<Diagnostic> diagnostics) {
        List<Task> schedulable = this.registry.schedulable();
        long seed = this.config.getSeed() + this.replanCount;
        this.replanCount++;

        if (schedulable.isEmpty()) {
            log.info("Nothing to schedule at hour {}", this.window.getOrigin());
            this.lastResult = new ReplanResult(this.window, null, null, null, Collections.emptyList(), diagnostics);
            return this.lastResult;
        }

        ClusteringResult clustering = this.config.getForcedClusters() > 0
                ? this.clusterer.cluster(schedulable, this.config.getForcedClusters(), seed)
                : this.clusterer.cluster(schedulable, seed);
        diagnostics.addAll(clustering.getDiagnostics());

        SchedulingInstance instance = newInstance(schedulable, clustering, this.window.horizonEnd());
        ScheduleSearch search = new ScheduleSearch(instance, this.config, seed, this.replanCount, this.clock, this.config.getReoptimizationBudgetMillis(), this.evaluationPool);
        OptimizationResult optimization = search.call();
        diagnostics.addAll(optimization.getDiagnostics());

        ParetoMember adopted = optimization.recommended(this.config.getObjectiveWeights());
        List<Integer> committed = new ArrayList<>();
        if (adopted != null) {
            DecodedSchedule schedule = adopted.getSchedule();
            for (Task task : schedulable) {
                ScheduledTask entry = schedule.entryFor(task.getId());
                if (entry == null) {
                    task.setPlanned(Task.UNSET, Task.UNSET);
                    continue;
                }
                task.setPlanned(entry.getStart(), entry.getEnd());
                if (entry.getStart() < this.window.commitEnd()) {
                    task.setStatus(TaskStatus.SCHEDULED);
                    committed.add(task.getId());
                }
            }
            for (Diagnostic diagnostic : schedule.getDiagnostics()) {
                log.warn("{}", diagnostic);
            }
            diagnostics.addAll(schedule.getDiagnostics());
        }

        log.info("Replanned {} tasks in {} clusters at hour {}: {} committed, front of {}", schedulable.size(), clustering.getK(), this.window.getOrigin(), committed.size(), optimization.getFront().size());
        this.lastResult = new ReplanResult(this.window, clustering, optimization, adopted, committed, diagnostics);
        return this.lastResult;
    }

    private SchedulingInstance newInstance(List<Task> schedulable, ClusteringResult clustering, int horizonEnd) {
        return new SchedulingInstance(schedulable, clustering.getClusters(), this.registry.frozen(), this.registry.finishedAt(),
                this.capacity, this.calendar, this.window.getOrigin(), horizonEnd,
                this.config.getCostModel(), this.riskProvider, this.config.isOverflowAllowed());
    }

    /**
     * Moves the window to {@code hour}, rolls task states forward, archives finished work and replans
     */
    public synchronized ReplanResult advanceTo(int hour) {
        this.window = this.window.advanceTo(hour);

        for (Task task : this.registry.withStatus(TaskStatus.SCHEDULED)) {
            if (task.getPlannedStart() <= hour) {
                task.setStatus(TaskStatus.IN_PROGRESS);
                task.setActualStart(task.getPlannedStart());
            }
        }
        for (Task task : this.registry.withStatus(TaskStatus.IN_PROGRESS)) {
            if (task.getPlannedEnd() <= hour) {
                task.setStatus(TaskStatus.COMPLETED);
                task.setActualEnd(task.getPlannedEnd());
                task.setCompletedDuration(task.getDuration());
            }
        }
        List<Integer> archived = this.registry.archiveCompleted(hour);
        log.info("Window advanced to hour {}; archived {} completed tasks", hour, archived.size());

        return replanWith(new ArrayList<>());
    }

    /**
     * Registers an urgent task and makes room for it inside its response window, preempting low-criticality
     * in-progress work that competes for the same resources when it does not fit otherwise
     */
    public synchronized ReplanResult injectEmergency(Task emergency) throws DataValidationException {
        addTasks(Collections.singletonList(emergency));
        int now = this.window.getOrigin();
        emergency.setUrgent(true);
        emergency.setStatus(TaskStatus.PENDING);
        emergency.setReleaseHour(Math.max(now, emergency.getReleaseHour()));
        if (!emergency.hasDeadline()) {
            int responseEnd = this.calendar.addWorkingHours(now, Math.max(this.config.getEmergencyResponseHours(), emergency.getDuration()));
            emergency.setDeadline(responseEnd);
        }
        log.warn("Emergency task {} injected at hour {} (criticality {}, due by hour {})", emergency.getId(), now, emergency.getCriticality(), emergency.getDeadline());

        List<Diagnostic> diagnostics = new ArrayList<>();
        for (int predecessor : emergency.getPredecessors()) {
            if (this.registry.knownIds().contains(predecessor) && !this.registry.finishedAt().containsKey(predecessor) && !isFrozen(predecessor)) {
                log.info("Emergency task {} waits on unscheduled predecessor {}; leaving it to the optimizer", emergency.getId(), predecessor);
                return replanWith(diagnostics);
            }
        }

        ScheduledTask slot = fitWithinResponseWindow(emergency);
        if (slot == null) {
            for (Task candidate : preemptionCandidates(emergency)) {
                if (!candidate.getStatus().isFrozen()) {
                    // already released along with an earlier candidate
                    continue;
                }
                if (candidate.getStatus() == TaskStatus.SCHEDULED) {
                    // committed but not started yet: handing it back to the optimizer is enough
                    candidate.setStatus(TaskStatus.PENDING);
                    releaseCommittedSuccessors(candidate.getId());
                    log.info("Released committed task {} to make room for emergency task {}", candidate.getId(), emergency.getId());
                } else {
                    preemptTask(candidate, now);
                }
                slot = fitWithinResponseWindow(emergency);
                if (slot != null) {
                    break;
                }
            }
        }

        if (slot == null) {
            String message = "Emergency task " + emergency.getId() + " cannot be resourced before hour " + emergency.getDeadline() + " even after preemption";
            log.warn(message);
            diagnostics.add(new Diagnostic(DiagnosticType.SCHEDULE_INFEASIBLE, Collections.singletonList(emergency.getId()), Collections.emptyList(), null, null, message));
        } else {
            emergency.setPlanned(slot.getStart(), slot.getEnd());
            emergency.setStatus(TaskStatus.SCHEDULED);
            log.info("Emergency task {} committed to [{}, {})", emergency.getId(), slot.getStart(), slot.getEnd());
        }
        return replanWith(diagnostics);
    }

    private boolean isFrozen(int taskId) {
        for (Task task : this.registry.frozen()) {
            if (task.getId() == taskId) {
                return true;
            }
        }
        return false;
    }

    /**
     * Earliest placement of {@code emergency} against the committed load that finishes by its deadline, or null
     */
    private ScheduledTask fitWithinResponseWindow(Task emergency) {
        List<Task> single = Collections.singletonList(emergency);
        ClusteringResult clustering = this.clusterer.cluster(single, this.config.getSeed());
        int horizonEnd = Math.max(emergency.getDeadline(), this.window.getOrigin() + 1);
        SchedulingInstance instance = new SchedulingInstance(single, clustering.getClusters(), this.registry.frozen(), this.registry.finishedAt(),
                this.capacity, this.calendar, this.window.getOrigin(), horizonEnd,
                this.config.getCostModel(), this.riskProvider, false);
        DecodedSchedule decoded = new ScheduleDecoder().decode(ScheduleChromosome.identity(1), instance);
        if (!decoded.isFeasible()) {
            return null;
        }
        return decoded.entryFor(emergency.getId());
    }

    private List<Task> preemptionCandidates(Task emergency) {
        int threshold = emergency.getCriticality() - this.config.getPreemptionCriticalityMargin();
        List<Task> released = new ArrayList<>();
        List<Task> running = new ArrayList<>();
        for (Task task : this.registry.frozen()) {
            if (task.getId() == emergency.getId() || task.getCriticality() > threshold || !task.requiresAnyOf(emergency.getDemand())) {
                continue;
            }
            if (task.getStatus() == TaskStatus.SCHEDULED) {
                released.add(task);
            } else {
                running.add(task);
            }
        }
        Comparator<Task> order = Comparator.comparingInt(Task::getCriticality).thenComparingInt(Task::getId);
        released.sort(order);
        running.sort(order);
        released.addAll(running);
        return released;
    }

    /**
     * Forced preemption of an in-progress task at the current window origin, followed by a replan
     */
    public synchronized ReplanResult preempt(int taskId) {
        Task task = this.registry.get(taskId);
        if (task.getStatus() != TaskStatus.IN_PROGRESS) {
            throw new IllegalStateException("Only in-progress tasks can be preempted; task " + taskId + " is " + task.getStatus());
        }
        preemptTask(task, this.window.getOrigin());
        return replanWith(new ArrayList<>());
    }

    /**
     * Stops {@code task} at hour {@code now}. The done part becomes a completed task; the rest is registered as a
     * new split remainder that inherits the open dependencies of the original and blocks its successors.
     *
     * @return the remainder, or null when no work had been done and the task simply went back to PENDING
     */
    private Task preemptTask(Task task, int now) {
        int start = task.getActualStart() == Task.UNSET ? task.getPlannedStart() : task.getActualStart();
        int elapsed = Math.min(task.getDuration(), this.calendar.workingHoursBetween(start, now));
        if (elapsed == 0) {
            task.setStatus(TaskStatus.PENDING);
            task.setActualStart(Task.UNSET);
            task.setPlanned(Task.UNSET, Task.UNSET);
            releaseCommittedSuccessors(task.getId());
            log.info("Task {} preempted before doing any work; returned to pending", task.getId());
            return null;
        }

        // PREEMPTED is passed straight through: the done part is closed out as COMPLETED at once
        int remaining = task.getDuration() - elapsed;
        task.setStatus(TaskStatus.COMPLETED);
        task.setActualEnd(now);
        task.setCompletedDuration(elapsed);
        task.setPlanned(start, now);
        if (remaining == 0) {
            log.info("Task {} was already done when preempted", task.getId());
            return null;
        }

        Map<Integer, Integer> finished = this.registry.finishedAt();
        Set<Integer> open = new LinkedHashSet<>();
        for (int predecessor : task.getPredecessors()) {
            if (!finished.containsKey(predecessor)) {
                open.add(predecessor);
            }
        }
        Task remainder = new Task(this.registry.nextFreeId(), task.getSystem(), task.getX(), task.getY(), task.getZ(),
                task.getDemand(), remaining, open, task.getCriticality());
        remainder.setStatus(TaskStatus.SPLIT_REMAINDER);
        remainder.setReleaseHour(now);
        remainder.setParentId(task.getId());
        remainder.setUrgent(task.isUrgent());
        if (task.hasDeadline()) {
            remainder.setDeadline(task.getDeadline());
        }
        remainder.setRemarks("Remainder of task " + task.getId());

        for (Task successor : this.registry.successorsOf(task.getId())) {
            if (successor.getStatus() != TaskStatus.COMPLETED) {
                successor.addPredecessor(remainder.getId());
            }
        }
        // committed slots downstream no longer account for the remainder
        releaseCommittedSuccessors(task.getId());
        this.registry.register(remainder);
        log.info("Task {} preempted at hour {} after {} of {} working hours; remainder is task {}", task.getId(), now, elapsed, task.getDuration(), remainder.getId());
        return remainder;
    }

    /**
     * Sends every committed but not yet started task downstream of {@code taskId}, direct or transitive, back to
     * PENDING so the next replan places it after its predecessors again
     */
    private void releaseCommittedSuccessors(int taskId) {
        Deque<Integer> open = new ArrayDeque<>();
        Set<Integer> visited = new HashSet<>();
        open.push(taskId);
        while (!open.isEmpty()) {
            for (Task successor : this.registry.successorsOf(open.pop())) {
                if (!visited.add(successor.getId())) {
                    continue;
                }
                if (successor.getStatus() == TaskStatus.SCHEDULED) {
                    successor.setStatus(TaskStatus.PENDING);
                    log.info("Released committed task {} behind task {}", successor.getId(), taskId);
                }
                open.push(successor.getId());
            }
        }
    }

    /**
     * Replaces the capacity of one resource from {@code fromHour} on. Committed work that no longer fits is reported,
     * never dropped.
     */
    public synchronized ReplanResult updateCapacity(ResourceType type, int units, int fromHour) {
        this.capacity = this.capacity.withCapacity(type, units, fromHour);
        log.info("{} capacity set to {} from hour {}", type.getLabel(), units, fromHour);

        List<Diagnostic> diagnostics = new ArrayList<>();
        Map<Integer, Integer> load = new HashMap<>();
        Map<Integer, List<Task>> users = new HashMap<>();
        for (Task task : this.registry.frozen()) {
            int demand = task.getDemand(type);
            if (demand == 0) {
                continue;
            }
            int start = task.getActualStart() == Task.UNSET ? task.getPlannedStart() : task.getActualStart();
            for (int t = Math.max(start, fromHour); t < task.getPlannedEnd(); t++) {
                if (this.calendar.isWorkingHour(t)) {
                    load.merge(t, demand, Integer::sum);
                    users.computeIfAbsent(t, key -> new ArrayList<>()).add(task);
                }
            }
        }

        Set<Integer> reported = new LinkedHashSet<>();
        List<Integer> hours = new ArrayList<>(load.keySet());
        Collections.sort(hours);
        for (int t : hours) {
            int available = this.capacity.capacityAt(type.ordinal(), t);
            if (load.get(t) <= available) {
                continue;
            }
            for (Task task : users.get(t)) {
                if (reported.add(task.getId())) {
                    String message = "Committed task " + task.getId() + " needs " + task.getDemand(type) + " x " + type.getLabel()
                            + " at hour " + t + " where only " + available + " remain for " + load.get(t) + " committed units";
                    log.warn(message);
                    diagnostics.add(Diagnostic.capacityMismatch(task.getId(), type, message));
                }
            }
        }
        return replanWith(diagnostics);
    }

    public synchronized RollingWindow getWindow() {
        return this.window;
    }

    public synchronized ResourceCapacity getCapacity() {
        return this.capacity;
    }

    public synchronized Task getTask(int taskId) {
        return this.registry.get(taskId).copy();
    }

    /**
     * Copies of every live (non-archived) task, by id
     */
    public synchronized List<Task> getTasks() {
        List<Task> copies = new ArrayList<>();
        for (Task task : this.registry.all()) {
            copies.add(task.copy());
        }
        return copies;
    }

    public synchronized Map<Integer, Integer> getArchivedFinish() {
        return new HashMap<>(this.registry.getArchivedFinish());
    }

    public synchronized ReplanResult getLastResult() {
        return this.lastResult;
    }

    public WorkingCalendar getCalendar() {
        return this.calendar;
    }

    @Override
    public void close() {
        if (this.evaluationPool != null) {
            this.evaluationPool.shutdown();
        }
    }
}
