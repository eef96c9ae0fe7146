package seakers.micscheduler.moeaclasses;

import org.moeaframework.core.FastNondominatedSorting;
import org.moeaframework.core.Population;
import org.moeaframework.core.Solution;
import org.moeaframework.core.comparator.ObjectiveComparator;

import java.util.ArrayList;
import java.util.List;

/**
 * Fast non-dominated sorting with crowding distance on top of MOEA Framework's sorter. Dominance is the library's
 * constrained Pareto dominance, so a schedule that places more tasks always beats one that places fewer.
 * The library numbers fronts from 0; {@link #rankOf(Solution)} reports them from 1.
 */
public class NondominatedSorter extends FastNondominatedSorting {

    public NondominatedSorter() {
        super();
    }

    /**
     * Sorts the pool into fronts, tagging each solution with its rank and crowding distance
     *
     * @return indices into {@code pool}, front by front, each front in ascending index order
     */
    public List<List<Integer>> sort(List<Solution> pool) {
        evaluate(new Population(pool));

        List<List<Integer>> fronts = new ArrayList<>();
        for (int i = 0; i < pool.size(); i++) {
            int front = (Integer) pool.get(i).getAttribute(RANK_ATTRIBUTE);
            while (fronts.size() <= front) {
                fronts.add(new ArrayList<>());
            }
            fronts.get(front).add(i);
        }
        return fronts;
    }

    /**
     * Same normalised neighbour gaps as the library, except that an objective that is flat across the front adds
     * nothing instead of turning every interior distance into NaN
     */
    @Override
    public void updateCrowdingDistance(Population front) {
        int size = front.size();
        if (size < 3) {
            for (Solution solution : front) {
                solution.setAttribute(CROWDING_ATTRIBUTE, Double.POSITIVE_INFINITY);
            }
            return;
        }

        for (Solution solution : front) {
            solution.setAttribute(CROWDING_ATTRIBUTE, 0.0);
        }
        int objectives = front.get(0).getNumberOfObjectives();
        for (int m = 0; m < objectives; m++) {
            front.sort(new ObjectiveComparator(m));
            double range = front.get(size - 1).getObjective(m) - front.get(0).getObjective(m);
            front.get(0).setAttribute(CROWDING_ATTRIBUTE, Double.POSITIVE_INFINITY);
            front.get(size - 1).setAttribute(CROWDING_ATTRIBUTE, Double.POSITIVE_INFINITY);
            if (range <= 0.0) {
                continue;
            }
            for (int k = 1; k < size - 1; k++) {
                double gap = front.get(k + 1).getObjective(m) - front.get(k - 1).getObjective(m);
                front.get(k).setAttribute(CROWDING_ATTRIBUTE, crowdingOf(front.get(k)) + gap / range);
            }
        }
    }

    public static int rankOf(Solution solution) {
        return (Integer) solution.getAttribute(RANK_ATTRIBUTE) + 1;
    }

    public static double crowdingOf(Solution solution) {
        return (Double) solution.getAttribute(CROWDING_ATTRIBUTE);
    }
}
