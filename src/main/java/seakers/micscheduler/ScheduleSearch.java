package seakers.micscheduler;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import seakers.micscheduler.decoding.SchedulingInstance;
import seakers.micscheduler.diagnostics.Diagnostic;
import seakers.micscheduler.moeaclasses.OptimizationResult;
import seakers.micscheduler.moeaclasses.OrderCrossover;
import seakers.micscheduler.moeaclasses.ScheduleNSGAII;
import seakers.micscheduler.moeaclasses.SchedulingProblem;
import seakers.micscheduler.moeaclasses.SwapMutation;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

/**
 * One seeded NSGA-II run over a scheduling instance. Stops at the generation limit, when the first front stalls,
 * or when the wall-clock budget runs out; the budget is only checked between generations.
 */
public class ScheduleSearch implements Callable<OptimizationResult> {

    private static final Logger log = LoggerFactory.getLogger(ScheduleSearch.class);

    public static final long UNLIMITED = 0L;

    private final SchedulingInstance instance;
    private final SchedulerConfig config;
    private final long seed;
    private final int runNumber;
    private final Clock clock;
    private final long budgetMillis;
    private final ExecutorService evaluator;

    /**
     * @param budgetMillis wall-clock budget, or {@link #UNLIMITED}
     * @param evaluator pool for parallel fitness evaluation, or null for serial
     */
    public ScheduleSearch(SchedulingInstance instance, SchedulerConfig config, long seed, int runNumber, Clock clock, long budgetMillis, ExecutorService evaluator) {
        this.instance = instance;
        this.config = config;
        this.seed = seed;
        this.runNumber = runNumber;
        this.clock = clock;
        this.budgetMillis = budgetMillis;
        this.evaluator = evaluator;
    }

    public ScheduleSearch(SchedulingInstance instance, SchedulerConfig config, long seed) {
        this(instance, config, seed, 0, Clock.systemUTC(), UNLIMITED, null);
    }

    @Override
    public OptimizationResult call() {
        log.info("Starting schedule search run {} (seed {}, {} clusters, {} tasks)", this.runNumber, this.seed, this.instance.getClusterCount(), this.instance.getTasks().size());

        RandomGenerator random = new MersenneTwister(this.seed);
        SchedulingProblem problem = new SchedulingProblem(this.instance);
        ScheduleNSGAII algorithm = new ScheduleNSGAII(problem, this.config.getPopulationSize(),
                new OrderCrossover(this.config.getCrossoverProbability(), random),
                new SwapMutation(this.config.getMutationProbability(), random),
                random, this.evaluator, this.config.getStallGenerations());

        long startTime = this.clock.millis();
        boolean budgetExceeded = false;

        algorithm.step();
        while (algorithm.getGeneration() < this.config.getGenerations() && !algorithm.isConverged()) {
            if (this.budgetMillis > UNLIMITED && this.clock.millis() - startTime >= this.budgetMillis) {
                budgetExceeded = true;
                break;
            }
            algorithm.step();
            if (algorithm.getGeneration() % 10 == 0) {
                log.debug("Run {} generation {}: {} evaluations, first front of {}", this.runNumber, algorithm.getGeneration(), algorithm.getNumberOfEvaluations(), algorithm.getFirstFront().size());
            }
        }
        algorithm.terminate();
        long elapsed = this.clock.millis() - startTime;

        List<Diagnostic> diagnostics = new ArrayList<>();
        if (budgetExceeded) {
            List<Integer> taskIds = new ArrayList<>(this.instance.getTasks().keySet());
            String message = "Optimization stopped after " + elapsed + " ms at generation " + algorithm.getGeneration() + " with the budget of " + this.budgetMillis + " ms spent; best schedules so far are used";
            diagnostics.add(Diagnostic.budgetExceeded(taskIds, message));
            log.warn(message);
        }

        log.info("Run {} finished after {} generations and {} evaluations in {} s{}", this.runNumber, algorithm.getGeneration(), algorithm.getNumberOfEvaluations(), elapsed / 1000.0, algorithm.isConverged() ? " (converged)" : "");

        return OptimizationResult.fromFront(algorithm.getFirstFront(), problem, algorithm.getGeneration(), algorithm.getNumberOfEvaluations(), algorithm.isConverged(), budgetExceeded, elapsed, diagnostics);
    }

    public int getRunNumber() {
        return this.runNumber;
    }

    public long getSeed() {
        return this.seed;
    }
}
