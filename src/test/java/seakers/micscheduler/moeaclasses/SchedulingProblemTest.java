package seakers.micscheduler.moeaclasses;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.moeaframework.core.Solution;
import seakers.micscheduler.decoding.CostModel;
import seakers.micscheduler.decoding.SchedulingInstance;
import seakers.micscheduler.model.ResourceCapacity;
import seakers.micscheduler.model.ResourceType;
import seakers.micscheduler.model.ScheduleChromosome;
import seakers.micscheduler.model.SystemCategory;
import seakers.micscheduler.model.Task;
import seakers.micscheduler.model.WorkingCalendar;
import seakers.micscheduler.risk.MonthlyRiskTable;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static seakers.micscheduler.TaskFixtures.*;

class SchedulingProblemTest {

    private static SchedulingInstance instance(List<Task> tasks) {
        return new SchedulingInstance(tasks, singletons(tasks), Collections.emptyList(), new HashMap<>(), ResourceCapacity.defaults(),
                WorkingCalendar.continuous(LocalDateTime.of(2024, 3, 1, 0, 0)), 0, 500, CostModel.defaults(), MonthlyRiskTable.hongKongDefault(), false);
    }

    @Test
    @DisplayName("evaluation writes the three objectives and the unplaced-task constraint")
    void evaluate() {
        Task impossible = task(1, SystemCategory.STRUCT, demand(ResourceType.CRANE, 9), 4, 5);
        SchedulingProblem problem = new SchedulingProblem(instance(Arrays.asList(impossible, skilledTask(2, 1, 4, 5))));
        Solution solution = problem.newSolution(ScheduleChromosome.of(1, 0));

        problem.evaluate(solution);

        assertEquals(3, solution.getNumberOfObjectives());
        assertArrayEquals(problem.decode(solution).getObjectives(), solution.getObjectives(), 1e-12);
        assertEquals(1.0, solution.getConstraint(0), 0.0);
        assertEquals(Boolean.FALSE, solution.getAttribute(SchedulingProblem.FEASIBLE_ATTRIBUTE));
        assertEquals(ScheduleChromosome.of(1, 0), SchedulingProblem.chromosomeOf(solution));
    }

    @Test
    @DisplayName("an instance without clusters cannot be optimized")
    void emptyInstance() {
        assertThrows(IllegalArgumentException.class, () -> new SchedulingProblem(instance(Collections.emptyList())));
    }
}
