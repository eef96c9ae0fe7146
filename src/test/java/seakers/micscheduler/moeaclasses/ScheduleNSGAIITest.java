package seakers.micscheduler.moeaclasses;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.moeaframework.core.Solution;
import org.moeaframework.core.comparator.ParetoDominanceComparator;
import seakers.micscheduler.decoding.SchedulingInstance;
import seakers.micscheduler.model.ScheduleChromosome;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static seakers.micscheduler.TaskFixtures.syntheticInstance;

class ScheduleNSGAIITest {

    private static final int POPULATION = 50;
    private static final int GENERATIONS = 100;

    private static SchedulingInstance instance;

    @BeforeAll
    static void buildInstance() {
        instance = syntheticInstance(20, 17L);
    }

    private static ScheduleNSGAII algorithm(long seed, ExecutorService evaluator) {
        RandomGenerator random = new MersenneTwister(seed);
        return new ScheduleNSGAII(new SchedulingProblem(instance), POPULATION,
                new OrderCrossover(0.9, random), new SwapMutation(Double.NaN, random), random, evaluator, 0);
    }

    private static List<Solution> run(ScheduleNSGAII algorithm) {
        while (algorithm.getGeneration() < GENERATIONS) {
            algorithm.step();
        }
        algorithm.terminate();
        return algorithm.getFirstFront();
    }

    private static List<ScheduleChromosome> chromosomes(List<Solution> solutions) {
        List<ScheduleChromosome> chromosomes = new ArrayList<>();
        for (Solution solution : solutions) {
            chromosomes.add(SchedulingProblem.chromosomeOf(solution));
        }
        return chromosomes;
    }

    @Test
    @DisplayName("the final first front is non-empty, bounded by the population and mutually non-dominated")
    void frontIsNondominated() {
        ScheduleNSGAII algorithm = algorithm(1L, null);
        List<Solution> front = run(algorithm);

        assertFalse(front.isEmpty());
        assertTrue(front.size() <= POPULATION);
        assertEquals(POPULATION, algorithm.getPopulation().size());
        assertEquals(POPULATION * (GENERATIONS + 1), algorithm.getNumberOfEvaluations());

        ParetoDominanceComparator dominance = new ParetoDominanceComparator();
        for (Solution member : front) {
            for (Solution other : algorithm.getPopulation()) {
                assertFalse(dominance.compare(other, member) < 0, "a front member is dominated");
            }
        }
    }

    @Test
    @DisplayName("the same seed reproduces the same front")
    void reproducible() {
        assertEquals(chromosomes(run(algorithm(5L, null))), chromosomes(run(algorithm(5L, null))));
    }

    @Test
    @DisplayName("parallel evaluation gives the same front as serial evaluation")
    void parallelMatchesSerial() {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            assertEquals(chromosomes(run(algorithm(9L, null))), chromosomes(run(algorithm(9L, pool))));
        } finally {
            pool.shutdown();
        }
    }

    @Test
    @DisplayName("the run stops counting as live once the front stalls")
    void stallDetection() {
        RandomGenerator random = new MersenneTwister(2L);
        ScheduleNSGAII algorithm = new ScheduleNSGAII(new SchedulingProblem(instance), 10,
                new OrderCrossover(0.0, random), new SwapMutation(0.0, random), random, null, 3);
        // without variation no new objective vector can appear, so the first front settles
        while (!algorithm.isConverged() && algorithm.getGeneration() < 100) {
            algorithm.step();
        }
        assertTrue(algorithm.isConverged());
        assertTrue(algorithm.getGeneration() >= 3);
    }

    @Test
    @DisplayName("a population below two is rejected")
    void populationTooSmall() {
        RandomGenerator random = new MersenneTwister(2L);
        assertThrows(IllegalArgumentException.class, () -> new ScheduleNSGAII(new SchedulingProblem(instance), 1,
                new OrderCrossover(0.9, random), new SwapMutation(Double.NaN, random), random, null, 0));
    }
}
