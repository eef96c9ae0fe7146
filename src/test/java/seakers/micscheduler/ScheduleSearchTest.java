package seakers.micscheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import seakers.micscheduler.clustering.ClusteringResult;
import seakers.micscheduler.clustering.TaskClusterer;
import seakers.micscheduler.decoding.CostModel;
import seakers.micscheduler.decoding.DecodedSchedule;
import seakers.micscheduler.decoding.ScheduledTask;
import seakers.micscheduler.decoding.SchedulingInstance;
import seakers.micscheduler.diagnostics.DiagnosticType;
import seakers.micscheduler.model.ResourceCapacity;
import seakers.micscheduler.model.ResourceType;
import seakers.micscheduler.model.SystemCategory;
import seakers.micscheduler.model.Task;
import seakers.micscheduler.model.WorkingCalendar;
import seakers.micscheduler.moeaclasses.OptimizationResult;
import seakers.micscheduler.moeaclasses.ParetoMember;
import seakers.micscheduler.risk.MonthlyRiskTable;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static seakers.micscheduler.TaskFixtures.demand;
import static seakers.micscheduler.TaskFixtures.syntheticInstance;

class ScheduleSearchTest {

    /**
     * Clock that moves forward a fixed step every time it is read
     */
    private static final class SteppingClock extends Clock {

        private final long stepMillis;
        private long now;

        SteppingClock(long stepMillis) {
            this.stepMillis = stepMillis;
        }

        @Override
        public long millis() {
            long current = this.now;
            this.now += this.stepMillis;
            return current;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis());
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
    }

    private static SchedulerConfig smallConfig() {
        return SchedulerConfig.defaults().setPopulationSize(12).setGenerations(15).setStallGenerations(0);
    }

    @Test
    @DisplayName("a run without budget goes to the generation limit and returns a sorted, deduplicated front")
    void fullRun() {
        SchedulingInstance instance = syntheticInstance(12, 4L);
        OptimizationResult result = new ScheduleSearch(instance, smallConfig(), 8L).call();

        assertEquals(15, result.getGenerations());
        assertEquals(12 * 16, result.getEvaluations());
        assertFalse(result.isBudgetExceeded());
        assertTrue(result.getDiagnostics().isEmpty());
        assertFalse(result.getFront().isEmpty());
        for (int i = 1; i < result.getFront().size(); i++) {
            ParetoMember previous = result.getFront().get(i - 1);
            ParetoMember current = result.getFront().get(i);
            assertTrue(previous.getCost() <= current.getCost());
            assertNotEquals(previous.getChromosome(), current.getChromosome());
        }
        assertNotNull(result.recommended());
    }

    @Test
    @DisplayName("the same seed gives the same front")
    void seeded() {
        SchedulingInstance instance = syntheticInstance(12, 4L);
        OptimizationResult first = new ScheduleSearch(instance, smallConfig(), 21L).call();
        OptimizationResult second = new ScheduleSearch(instance, smallConfig(), 21L).call();

        assertEquals(first.getFront().size(), second.getFront().size());
        for (int i = 0; i < first.getFront().size(); i++) {
            assertEquals(first.getFront().get(i).getChromosome(), second.getFront().get(i).getChromosome());
        }
    }

    @Test
    @DisplayName("running out of budget stops between generations and keeps the best front so far")
    void budgetExceeded() {
        SchedulingInstance instance = syntheticInstance(12, 4L);
        ScheduleSearch search = new ScheduleSearch(instance, smallConfig(), 8L, 3, new SteppingClock(6000L), 10_000L, null);

        OptimizationResult result = search.call();

        assertTrue(result.isBudgetExceeded());
        assertEquals(1, result.getGenerations());
        assertEquals(DiagnosticType.OPTIMIZATION_BUDGET_EXCEEDED, result.getDiagnostics().get(0).getType());
        assertFalse(result.getFront().isEmpty());
        assertEquals(3, search.getRunNumber());
    }

    @Test
    @DisplayName("two skilled tasks whose combined demand exceeds the crew never overlap in any optimized schedule")
    void sharedCrewEndToEnd() {
        Task heavy = new Task(1, SystemCategory.STRUCT, 10, 10, 5, demand(ResourceType.SKILLED, 2), 4, new HashSet<Integer>(), 9);
        Task light = new Task(2, SystemCategory.STRUCT, 12, 10, 5, demand(ResourceType.SKILLED, 1), 3, new HashSet<Integer>(), 3);
        Task wiring = new Task(3, SystemCategory.ELEC, 80, 80, 20, demand(ResourceType.SKILLED, 1), 2, new HashSet<Integer>(), 5);
        Task testing = new Task(4, SystemCategory.ELEC, 80, 82, 20, demand(ResourceType.SKILLED, 1), 2, new HashSet<>(Collections.singletonList(3)), 5);
        Task panels = new Task(5, SystemCategory.ELEC, 82, 80, 20, demand(ResourceType.SKILLED, 1), 2, new HashSet<Integer>(), 5);
        List<Task> tasks = Arrays.asList(heavy, light, wiring, testing, panels);

        ClusteringResult clustering = new TaskClusterer().cluster(tasks, 2, 5L);
        assertEquals(2, clustering.getK());
        assertTrue(clustering.isForced());

        ResourceCapacity crew = ResourceCapacity.defaults().withCapacity(ResourceType.SKILLED, 2, 0);
        SchedulingInstance instance = new SchedulingInstance(tasks, clustering.getClusters(), Collections.emptyList(), new HashMap<>(), crew,
                WorkingCalendar.continuous(LocalDateTime.of(2024, 1, 1, 0, 0)), 0, 200, CostModel.defaults(), MonthlyRiskTable.hongKongDefault(), false);

        OptimizationResult result = new ScheduleSearch(instance, smallConfig(), 13L).call();

        assertFalse(result.getFront().isEmpty());
        for (ParetoMember member : result.getFront()) {
            DecodedSchedule schedule = member.getSchedule();
            assertTrue(schedule.isFeasible());
            ScheduledTask first = schedule.entryFor(1);
            ScheduledTask second = schedule.entryFor(2);
            assertTrue(second.getStart() >= first.getEnd() || second.getEnd() <= first.getStart(),
                    "tasks 1 [" + first.getStart() + "," + first.getEnd() + ") and 2 [" + second.getStart() + "," + second.getEnd() + ") overlap");
            assertTrue(schedule.entryFor(4).getStart() >= schedule.entryFor(3).getEnd());
            for (int[] used : schedule.getUtilization().values()) {
                assertTrue(used[ResourceType.SKILLED.ordinal()] <= 2);
            }
        }
        assertNotNull(result.recommended());
    }
}
