package seakers.micscheduler.moeaclasses;

import org.apache.commons.math3.random.RandomGenerator;
import org.moeaframework.algorithm.AbstractAlgorithm;
import org.moeaframework.core.NondominatedPopulation;
import org.moeaframework.core.Solution;
import org.moeaframework.core.Variation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import seakers.micscheduler.decoding.SchedulingInstance;
import seakers.micscheduler.model.ScheduleChromosome;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * NSGA-II over cluster execution orders.
 *
 * All randomness is drawn from the generator handed in, on the calling thread only; fitness evaluation may be
 * farmed out to an executor, but results are collected in population order, so a run with a worker pool is
 * identical to a serial run with the same seed.
 */
public class ScheduleNSGAII extends AbstractAlgorithm {

    private static final Logger log = LoggerFactory.getLogger(ScheduleNSGAII.class);

    private final SchedulingProblem schedulingProblem;
    private final int populationSize;
    private final Variation crossover;
    private final Variation mutation;
    private final RandomGenerator random;
    private final ExecutorService evaluator;
    private final int stallGenerations;
    private final NondominatedSorter sorter;

    private List<Solution> population;
    private int evaluations;
    private int generation;
    private int stalledFor;
    private Set<List<Double>> lastFrontObjectives;
    private boolean converged;

    /**
     * @param evaluator worker pool for fitness evaluation, or null to evaluate on the calling thread
     * @param stallGenerations generations without any change in the first front after which the run counts as converged
     */
    public ScheduleNSGAII(SchedulingProblem problem, int populationSize, Variation crossover, Variation mutation, RandomGenerator random, ExecutorService evaluator, int stallGenerations) {
        super(problem);
        if (populationSize < 2) {
            throw new IllegalArgumentException("Population size must be at least 2, was " + populationSize);
        }
        this.schedulingProblem = problem;
        this.populationSize = populationSize;
        this.crossover = crossover;
        this.mutation = mutation;
        this.random = random;
        this.evaluator = evaluator;
        this.stallGenerations = stallGenerations;
        this.sorter = new NondominatedSorter();
        this.population = new ArrayList<>();
        this.lastFrontObjectives = Collections.emptySet();
    }

    @Override
    protected void initialize() {
        super.initialize();

        List<Solution> initial = new ArrayList<>();
        initial.add(this.schedulingProblem.newSolution(criticalityFirstOrder()));
        int n = this.schedulingProblem.getInstance().getClusterCount();
        while (initial.size() < this.populationSize) {
            initial.add(this.schedulingProblem.newSolution(ScheduleChromosome.of(shuffled(n))));
        }
        evaluateInOrder(initial);
        this.population = initial;
        this.sorter.sort(this.population);
        this.lastFrontObjectives = frontObjectives();

        log.debug("Initial population of {} evaluated over {} clusters", this.populationSize, n);
    }

    @Override
    protected void iterate() {
        List<Solution> offspring = new ArrayList<>();
        while (offspring.size() < this.populationSize) {
            Solution[] parents = {tournament(), tournament()};
            for (Solution child : this.crossover.evolve(parents)) {
                if (offspring.size() < this.populationSize) {
                    offspring.add(this.mutation.evolve(new Solution[]{child})[0]);
                }
            }
        }
        evaluateInOrder(offspring);

        List<Solution> merged = new ArrayList<>(this.population);
        merged.addAll(offspring);
        List<List<Integer>> fronts = this.sorter.sort(merged);

        List<Solution> next = new ArrayList<>();
        for (List<Integer> front : fronts) {
            if (next.size() + front.size() <= this.populationSize) {
                for (int index : front) {
                    next.add(merged.get(index));
                }
            } else {
                List<Integer> byCrowding = new ArrayList<>(front);
                byCrowding.sort(Comparator.comparingDouble((Integer index) -> NondominatedSorter.crowdingOf(merged.get(index))).reversed());
                for (int index : byCrowding) {
                    if (next.size() == this.populationSize) {
                        break;
                    }
                    next.add(merged.get(index));
                }
            }
            if (next.size() == this.populationSize) {
                break;
            }
        }
        this.population = next;
        // crowding of survivors is recomputed against the new population for the next tournament
        this.sorter.sort(this.population);
        this.generation++;

        Set<List<Double>> objectives = frontObjectives();
        if (objectives.equals(this.lastFrontObjectives)) {
            this.stalledFor++;
        } else {
            this.stalledFor = 0;
            this.lastFrontObjectives = objectives;
        }
        if (this.stallGenerations > 0 && this.stalledFor >= this.stallGenerations) {
            this.converged = true;
        }
    }

    private Solution tournament() {
        Solution a = this.population.get(this.random.nextInt(this.population.size()));
        Solution b = this.population.get(this.random.nextInt(this.population.size()));
        int rankA = NondominatedSorter.rankOf(a);
        int rankB = NondominatedSorter.rankOf(b);
        if (rankA != rankB) {
            return rankA < rankB ? a : b;
        }
        return NondominatedSorter.crowdingOf(b) > NondominatedSorter.crowdingOf(a) ? b : a;
    }

    private void evaluateInOrder(List<Solution> solutions) {
        if (this.evaluator == null) {
            for (Solution solution : solutions) {
                this.problem.evaluate(solution);
            }
        } else {
            List<Future<?>> pending = new ArrayList<>();
            for (Solution solution : solutions) {
                pending.add(this.evaluator.submit(() -> this.problem.evaluate(solution)));
            }
            for (Future<?> future : pending) {
                try {
                    future.get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while evaluating schedules", e);
                } catch (ExecutionException e) {
                    throw new IllegalStateException("Schedule evaluation failed", e.getCause());
                }
            }
        }
        this.evaluations += solutions.size();
    }

    /**
     * Heuristic seed: clusters in descending order of mean criticality, ties by index
     */
    private ScheduleChromosome criticalityFirstOrder() {
        SchedulingInstance instance = this.schedulingProblem.getInstance();
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < instance.getClusterCount(); i++) {
            order.add(i);
        }
        order.sort(Comparator.comparingDouble((Integer i) -> -instance.getClusters().get(i).getMeanCriticality()).thenComparingInt(i -> i));
        int[] genes = new int[order.size()];
        for (int i = 0; i < genes.length; i++) {
            genes[i] = order.get(i);
        }
        return ScheduleChromosome.of(genes);
    }

    private int[] shuffled(int n) {
        int[] genes = new int[n];
        for (int i = 0; i < n; i++) {
            genes[i] = i;
        }
        for (int i = n - 1; i > 0; i--) {
            int j = this.random.nextInt(i + 1);
            int swap = genes[i];
            genes[i] = genes[j];
            genes[j] = swap;
        }
        return genes;
    }

    private Set<List<Double>> frontObjectives() {
        Set<List<Double>> objectives = new HashSet<>();
        for (Solution solution : getFirstFront()) {
            List<Double> values = new ArrayList<>();
            for (double value : solution.getObjectives()) {
                values.add(value);
            }
            objectives.add(values);
        }
        return objectives;
    }

    /**
     * Current rank-1 members, in population order
     */
    public List<Solution> getFirstFront() {
        List<Solution> front = new ArrayList<>();
        for (Solution solution : this.population) {
            if (NondominatedSorter.rankOf(solution) == 1) {
                front.add(solution);
            }
        }
        return front;
    }

    public List<Solution> getPopulation() {
        return Collections.unmodifiableList(this.population);
    }

    @Override
    public NondominatedPopulation getResult() {
        NondominatedPopulation result = new NondominatedPopulation();
        result.addAll(getFirstFront());
        return result;
    }

    @Override
    public int getNumberOfEvaluations() {
        return this.evaluations;
    }

    public int getGeneration() {
        return this.generation;
    }

    public boolean isConverged() {
        return this.converged;
    }
}
