package seakers.micscheduler.moeaclasses;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.moeaframework.core.Solution;
import seakers.micscheduler.decoding.DecodedSchedule;
import seakers.micscheduler.decoding.SchedulingInstance;
import seakers.micscheduler.model.ScheduleChromosome;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;
import static seakers.micscheduler.TaskFixtures.syntheticInstance;

class OptimizationResultTest {

    private static ParetoMember member(double cost, double risk, double delay, int... genes) {
        DecodedSchedule schedule = new DecodedSchedule(Collections.emptyList(), cost, risk, delay, 0, 0, Collections.emptyList(), new TreeMap<>());
        return new ParetoMember(ScheduleChromosome.of(genes), schedule, 1, 0.0);
    }

    private static OptimizationResult result(ParetoMember... members) {
        return new OptimizationResult(Arrays.asList(members), 10, 500, false, false, 20L, Collections.emptyList());
    }

    @Test
    @DisplayName("the front is ordered by cost, then risk, then delay, then genes")
    void frontOrder() {
        ParetoMember cheap = member(100, 10, 0, 0, 1, 2);
        ParetoMember safe = member(200, 5, 0, 2, 1, 0);
        ParetoMember middle = member(150, 8, 0, 1, 0, 2);
        ParetoMember twin = member(150, 8, 0, 0, 2, 1);

        List<ParetoMember> front = result(safe, middle, cheap, twin).getFront();

        assertEquals(Arrays.asList(cheap, twin, middle, safe), front);
    }

    @Test
    @DisplayName("the recommendation minimises the weighted normalised objectives")
    void recommended() {
        ParetoMember cheap = member(100, 10, 0, 0, 1, 2);
        ParetoMember safe = member(200, 5, 0, 2, 1, 0);
        ParetoMember middle = member(150, 8, 0, 1, 0, 2);
        OptimizationResult result = result(cheap, safe, middle);

        // defaults: cheap 0.45, safe 0.35, middle 0.175 + 0.27; delay is flat and counts for nothing
        assertSame(safe, result.recommended());
        assertSame(cheap, result.recommended(new ObjectiveWeights(1, 0, 0)));
        assertSame(safe, result.recommended(new ObjectiveWeights(0, 1, 0)));
    }

    @Test
    @DisplayName("an empty front has no recommendation; a single member is its own")
    void degenerateFronts() {
        assertNull(result().recommended());
        ParetoMember only = member(1, 1, 1, 0);
        assertSame(only, result(only).recommended());
        assertThrows(IllegalArgumentException.class, () -> new ObjectiveWeights(0, 0, 0));
    }

    @Test
    @DisplayName("duplicate chromosomes in the final front are reported once")
    void deduplicates() {
        SchedulingInstance instance = syntheticInstance(8, 3L);
        SchedulingProblem problem = new SchedulingProblem(instance);
        List<Solution> front = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            Solution solution = problem.newSolution(ScheduleChromosome.identity(instance.getClusterCount()));
            problem.evaluate(solution);
            solution.setAttribute(NondominatedSorter.RANK_ATTRIBUTE, 0);
            solution.setAttribute(NondominatedSorter.CROWDING_ATTRIBUTE, Double.POSITIVE_INFINITY);
            front.add(solution);
        }

        OptimizationResult result = OptimizationResult.fromFront(front, problem, 0, 3, false, false, 1L, Collections.emptyList());

        assertEquals(1, result.getFront().size());
        ParetoMember member = result.getFront().get(0);
        assertArrayEquals(front.get(0).getObjectives(), member.getObjectives(), 1e-9);
        assertEquals(instance.getTasks().size(), member.getSchedule().getEntries().size());
    }
}
