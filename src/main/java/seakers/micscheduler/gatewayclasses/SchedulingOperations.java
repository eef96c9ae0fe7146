package seakers.micscheduler.gatewayclasses;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import seakers.micscheduler.SchedulerConfig;
import seakers.micscheduler.decoding.DecodedSchedule;
import seakers.micscheduler.decoding.ScheduledTask;
import seakers.micscheduler.diagnostics.Diagnostic;
import seakers.micscheduler.model.CriticalityScale;
import seakers.micscheduler.model.ResourceCapacity;
import seakers.micscheduler.model.ResourceType;
import seakers.micscheduler.model.SystemCategory;
import seakers.micscheduler.model.Task;
import seakers.micscheduler.model.WorkingCalendar;
import seakers.micscheduler.moeaclasses.ParetoMember;
import seakers.micscheduler.risk.EnvironmentalRiskProvider;
import seakers.micscheduler.risk.MonthlyRiskTable;
import seakers.micscheduler.rollinghorizon.ReplanResult;
import seakers.micscheduler.rollinghorizon.RollingHorizonController;
import seakers.micscheduler.validation.DataValidationException;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for the Python importer and dashboard. Parameters are set first, tasks are added, then
 * {@link #initialize()} builds the controller and produces the first plan. Results come back as plain lists and maps
 * so they cross the Py4J bridge without custom converters.
 */
public class SchedulingOperations {

    private static final Logger log = LoggerFactory.getLogger(SchedulingOperations.class);

    // Parameters for the controller
    private final SchedulerConfig config;
    private LocalDate projectStart;
    private int[] resourceLimits;
    private EnvironmentalRiskProvider riskProvider;

    // Tasks collected before initialisation; criticality 0 marks "not given"
    private final List<Task> pendingTasks;

    private RollingHorizonController controller;
    private ReplanResult lastResult;

    public SchedulingOperations() {
        this.config = SchedulerConfig.defaults();
        this.projectStart = LocalDate.now();
        this.resourceLimits = ResourceCapacity.defaults().capacityVectorAt(0);
        this.riskProvider = MonthlyRiskTable.hongKongDefault();
        this.pendingTasks = new ArrayList<>();
    }

    // Run parameter setting methods before initialize()
    public void setProjectStart(String isoDate) {
        this.projectStart = LocalDate.parse(isoDate);
        log.info("Project start = {}", isoDate);
    }

    public void setSeed(long seed) {
        this.config.setSeed(seed);
    }

    public void setPopulationSize(int populationSize) {
        this.config.setPopulationSize(populationSize);
    }

    public void setGenerations(int generations) {
        this.config.setGenerations(generations);
    }

    public void setCommitWindowHours(int hours) {
        this.config.setCommitWindowHours(hours);
    }

    public void setLookaheadHours(int hours) {
        this.config.setLookaheadHours(hours);
    }

    public void setBudgetMillis(long budgetMillis) {
        this.config.setReoptimizationBudgetMillis(budgetMillis);
    }

    public void setOverflowAllowed(boolean overflowAllowed) {
        this.config.setOverflowAllowed(overflowAllowed);
    }

    public void setForcedClusters(int k) {
        this.config.setForcedClusters(k);
    }

    public void setRiskProvider(EnvironmentalRiskProvider riskProvider) {
        this.riskProvider = riskProvider;
    }

    public void setResourceLimit(String resourceType, int units) {
        this.resourceLimits[ResourceType.valueOf(resourceType.toUpperCase()).ordinal()] = units;
        log.info("{} limit = {}", resourceType, units);
    }

    /**
     * @param criticality 1-10, or 0 to use the project default
     */
    public void addTask(int id, String system, double x, double y, double z, List<Integer> demand, int duration, List<Integer> predecessors, int criticality) {
        this.pendingTasks.add(newTask(id, system, x, y, z, demand, duration, predecessors, criticality));
    }

    public void addTaskWithRpn(int id, String system, double x, double y, double z, List<Integer> demand, int duration, List<Integer> predecessors, int severity, int occurrence, int detection) {
        addTask(id, system, x, y, z, demand, duration, predecessors, CriticalityScale.fromRpn(severity, occurrence, detection));
    }

    private static Task newTask(int id, String system, double x, double y, double z, List<Integer> demand, int duration, List<Integer> predecessors, int criticality) {
        int[] units = new int[demand.size()];
        for (int i = 0; i < units.length; i++) {
            units[i] = demand.get(i);
        }
        return new Task(id, SystemCategory.fromLabel(system), x, y, z, units, duration, new HashSet<>(predecessors), criticality);
    }

    public List<Map<String, Object>> initialize() throws DataValidationException {
        if (this.controller != null) {
            this.controller.close();
        }
        List<Integer> known = new ArrayList<>();
        for (Task task : this.pendingTasks) {
            if (task.getCriticality() != 0) {
                known.add(task.getCriticality());
            }
        }
        int fallback = CriticalityScale.projectDefault(known);
        for (Task task : this.pendingTasks) {
            if (task.getCriticality() == 0) {
                task.setCriticality(fallback);
            }
        }

        this.controller = new RollingHorizonController(this.config, WorkingCalendar.standard(this.projectStart),
                new ResourceCapacity(this.resourceLimits), this.riskProvider, Clock.systemUTC());
        this.controller.addTasks(this.pendingTasks);
        this.pendingTasks.clear();
        this.lastResult = this.controller.replan();
        return getSchedule();
    }

    public List<Map<String, Object>> replan() {
        this.lastResult = controller().replan();
        return getSchedule();
    }

    public List<Map<String, Object>> advanceTo(int hour) {
        this.lastResult = controller().advanceTo(hour);
        return getSchedule();
    }

    public List<Map<String, Object>> injectEmergency(int id, String system, double x, double y, double z, List<Integer> demand, int duration, List<Integer> predecessors, int criticality, int deadline) throws DataValidationException {
        Task emergency = newTask(id, system, x, y, z, demand, duration, predecessors, criticality);
        if (deadline >= 0) {
            emergency.setDeadline(deadline);
        }
        this.lastResult = controller().injectEmergency(emergency);
        return getSchedule();
    }

    public List<Map<String, Object>> preempt(int taskId) {
        this.lastResult = controller().preempt(taskId);
        return getSchedule();
    }

    public List<Map<String, Object>> updateCapacity(String resourceType, int units, int fromHour) {
        this.lastResult = controller().updateCapacity(ResourceType.valueOf(resourceType.toUpperCase()), units, fromHour);
        return getSchedule();
    }

    private RollingHorizonController controller() {
        if (this.controller == null) {
            throw new IllegalStateException("initialize() has not been called");
        }
        return this.controller;
    }

    /**
     * Every live task with its status and planned interval, by id
     */
    public List<Map<String, Object>> getSchedule() {
        List<Map<String, Object>> rows = new ArrayList<>();
        DecodedSchedule adopted = this.lastResult == null ? null : this.lastResult.getSchedule();
        for (Task task : controller().getTasks()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", task.getId());
            row.put("system", task.getSystem().getLabel());
            row.put("status", task.getStatus().name());
            row.put("start", task.getPlannedStart());
            row.put("end", task.getPlannedEnd());
            ScheduledTask entry = adopted == null ? null : adopted.entryFor(task.getId());
            row.put("cluster", entry == null ? ScheduledTask.NO_CLUSTER : entry.getClusterId());
            row.put("criticality", task.getCriticality());
            row.put("urgent", task.isUrgent());
            row.put("parent", task.getParentId());
            rows.add(row);
        }
        return rows;
    }

    /**
     * Objective vectors (cost, risk, delay) of the last front
     */
    public List<List<Double>> getParetoFront() {
        List<List<Double>> front = new ArrayList<>();
        if (this.lastResult == null || this.lastResult.getOptimization() == null) {
            return front;
        }
        for (ParetoMember member : this.lastResult.getOptimization().getFront()) {
            List<Double> objectives = new ArrayList<>();
            for (double value : member.getObjectives()) {
                objectives.add(value);
            }
            front.add(objectives);
        }
        return front;
    }

    public List<String> getDiagnostics() {
        List<String> messages = new ArrayList<>();
        if (this.lastResult != null) {
            for (Diagnostic diagnostic : this.lastResult.getDiagnostics()) {
                messages.add(diagnostic.getType() + ": " + diagnostic.getMessage());
            }
        }
        return messages;
    }

    public int getWindowOrigin() {
        return controller().getWindow().getOrigin();
    }

    public void shutdown() {
        if (this.controller != null) {
            this.controller.close();
        }
    }
}
