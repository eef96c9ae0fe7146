package seakers.micscheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import seakers.micscheduler.clustering.ClusteringResult;
import seakers.micscheduler.decoding.SchedulingInstance;
import seakers.micscheduler.model.ResourceCapacity;
import seakers.micscheduler.model.Task;
import seakers.micscheduler.model.WorkingCalendar;
import seakers.micscheduler.moeaclasses.OptimizationResult;
import seakers.micscheduler.moeaclasses.ParetoMember;
import seakers.micscheduler.problems.SyntheticProjectGenerator;
import seakers.micscheduler.risk.MonthlyRiskTable;
import seakers.micscheduler.validation.DataValidationException;
import seakers.micscheduler.validation.TaskValidator;

import java.io.File;
import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Batch runner: several independently seeded optimizations of one synthetic project, run in parallel, each saving
 * its Pareto front, recommended schedule and resource utilisation
 *
 * Usage: SchedulerRun [taskCount] [numRuns] [saveDirectory]
 */
public class SchedulerRun {

    private static final Logger log = LoggerFactory.getLogger(SchedulerRun.class);

    public static void main(String[] args) throws InterruptedException, ExecutionException, IOException, DataValidationException {

        int taskCount = args.length > 0 ? Integer.parseInt(args[0]) : 40;
        int numRuns = args.length > 1 ? Integer.parseInt(args[1]) : 4;
        String saveDir = args.length > 2 ? args[2] : System.getProperty("user.dir") + File.separator + "results";

        int numCPU = Math.max(1, Math.min(numRuns, Runtime.getRuntime().availableProcessors()));

        SchedulerConfig config = SchedulerConfig.load("scheduler.properties");

        List<Task> tasks = new SyntheticProjectGenerator().generate(taskCount, config.getSeed());
        new TaskValidator(config.getBounds()).validate(tasks, Collections.emptySet());

        WorkingCalendar calendar = WorkingCalendar.standard(LocalDate.now());
        ClusteringResult clustering = config.getForcedClusters() > 0
                ? config.newClusterer().cluster(tasks, config.getForcedClusters(), config.getSeed())
                : config.newClusterer().cluster(tasks, config.getSeed());
        log.info("{} tasks grouped into {} clusters (silhouette {})", tasks.size(), clustering.getK(), clustering.getSilhouette());

        ResourceCapacity capacity = ResourceCapacity.defaults();
        SchedulingInstance instance = new SchedulingInstance(tasks, clustering.getClusters(), Collections.emptyList(), new HashMap<>(),
                capacity, calendar, 0, config.getLookaheadHours(), config.getCostModel(), MonthlyRiskTable.hongKongDefault(), config.isOverflowAllowed());

        ExecutorService pool = Executors.newFixedThreadPool(numCPU);
        CompletionService<OptimizationResult> cs = new ExecutorCompletionService<>(pool);
        try {
            for (int i = 0; i < numRuns; i++) {
                cs.submit(new ScheduleSearch(instance, config, config.getSeed() + i, i, Clock.systemUTC(), ScheduleSearch.UNLIMITED, null));
            }

            ScheduleReport report = new ScheduleReport(saveDir);
            for (int i = 0; i < numRuns; i++) {
                OptimizationResult result = cs.take().get();
                ParetoMember recommended = result.recommended(config.getObjectiveWeights());
                String prefix = "NSGAII_" + i;
                report.saveFront(prefix + "_front.csv", result);
                if (recommended != null) {
                    report.saveSchedule(prefix + "_schedule.csv", recommended.getSchedule(), calendar);
                    report.saveUtilization(prefix + "_utilization.csv", recommended.getSchedule(), capacity);
                    log.info("Recommended schedule: {}", recommended);
                }
            }
        } finally {
            pool.shutdown();
        }
    }
}
