package seakers.micscheduler.moeaclasses;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.moeaframework.core.Solution;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NondominatedSorterTest {

    private static Solution point(double first, double second) {
        Solution solution = new Solution(0, 2);
        solution.setObjectives(new double[]{first, second});
        return solution;
    }

    private static Solution point(double first, double second, double third) {
        Solution solution = new Solution(0, 3);
        solution.setObjectives(new double[]{first, second, third});
        return solution;
    }

    @Test
    @DisplayName("fronts, ranks and crowding distances of a small two-objective pool")
    void ranksAndCrowding() {
        List<Solution> pool = new ArrayList<>(Arrays.asList(
                point(1, 4), point(2, 2), point(4, 1), point(3, 3), point(5, 5)));

        List<List<Integer>> fronts = new NondominatedSorter().sort(pool);

        assertEquals(Arrays.asList(0, 1, 2), fronts.get(0));
        assertEquals(Arrays.asList(3), fronts.get(1));
        assertEquals(Arrays.asList(4), fronts.get(2));

        int[] expectedRanks = {1, 1, 1, 2, 3};
        for (int i = 0; i < pool.size(); i++) {
            assertEquals(expectedRanks[i], NondominatedSorter.rankOf(pool.get(i)));
        }
        assertEquals(Double.POSITIVE_INFINITY, NondominatedSorter.crowdingOf(pool.get(0)));
        assertEquals(Double.POSITIVE_INFINITY, NondominatedSorter.crowdingOf(pool.get(2)));
        assertEquals(2.0, NondominatedSorter.crowdingOf(pool.get(1)), 1e-12);
        assertEquals(Double.POSITIVE_INFINITY, NondominatedSorter.crowdingOf(pool.get(3)));
    }

    @Test
    @DisplayName("identical points share a front")
    void duplicates() {
        List<Solution> pool = new ArrayList<>(Arrays.asList(point(1, 1), point(1, 1), point(2, 2)));
        List<List<Integer>> fronts = new NondominatedSorter().sort(pool);

        assertEquals(Arrays.asList(0, 1), fronts.get(0));
        assertEquals(2, NondominatedSorter.rankOf(pool.get(2)));
    }

    @Test
    @DisplayName("a schedule with fewer unplaced tasks dominates regardless of objectives")
    void constraintsFirst() {
        Solution cheapButIncomplete = new Solution(0, 2, 1);
        cheapButIncomplete.setObjectives(new double[]{0, 0});
        cheapButIncomplete.setConstraint(0, 2);
        Solution complete = new Solution(0, 2, 1);
        complete.setObjectives(new double[]{10, 10});
        complete.setConstraint(0, 0);

        List<Solution> pool = new ArrayList<>(Arrays.asList(cheapButIncomplete, complete));
        new NondominatedSorter().sort(pool);

        assertEquals(1, NondominatedSorter.rankOf(complete));
        assertEquals(2, NondominatedSorter.rankOf(cheapButIncomplete));
    }

    @Test
    @DisplayName("an objective that is flat across a front leaves the other objectives' crowding intact")
    void flatObjective() {
        List<Solution> pool = new ArrayList<>(Arrays.asList(point(1, 3, 5), point(2, 2, 5), point(3, 1, 5)));
        List<List<Integer>> fronts = new NondominatedSorter().sort(pool);

        assertEquals(Arrays.asList(0, 1, 2), fronts.get(0));
        assertEquals(2.0, NondominatedSorter.crowdingOf(pool.get(1)), 1e-12);
        assertEquals(Double.POSITIVE_INFINITY, NondominatedSorter.crowdingOf(pool.get(0)));
    }

    @Test
    @DisplayName("the library's zero-based front number is reported as rank 1")
    void ranksStartAtOne() {
        Solution solution = point(1, 1);
        new NondominatedSorter().sort(new ArrayList<>(Arrays.asList(solution)));

        assertEquals(0, solution.getAttribute(NondominatedSorter.RANK_ATTRIBUTE));
        assertEquals(1, NondominatedSorter.rankOf(solution));
    }
}
