package seakers.micscheduler.moeaclasses;

import org.moeaframework.core.Solution;
import seakers.micscheduler.diagnostics.Diagnostic;
import seakers.micscheduler.model.ScheduleChromosome;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pareto front of one optimization run, deduplicated by chromosome and sorted by (cost, risk, delay, chromosome)
 */
public class OptimizationResult {

    private static final Comparator<ParetoMember> FRONT_ORDER = Comparator
            .comparingDouble(ParetoMember::getCost)
            .thenComparingDouble(ParetoMember::getRisk)
            .thenComparingDouble(ParetoMember::getDelay)
            .thenComparing(ParetoMember::getChromosome, OptimizationResult::compareGenes);

    private final List<ParetoMember> front;
    private final int generations;
    private final int evaluations;
    private final boolean converged;
    private final boolean budgetExceeded;
    private final long elapsedMillis;
    private final List<Diagnostic> diagnostics;

    public OptimizationResult(List<ParetoMember> front, int generations, int evaluations, boolean converged, boolean budgetExceeded, long elapsedMillis, List<Diagnostic> diagnostics) {
        List<ParetoMember> sorted = new ArrayList<>(front);
        sorted.sort(FRONT_ORDER);
        this.front = Collections.unmodifiableList(sorted);
        this.generations = generations;
        this.evaluations = evaluations;
        this.converged = converged;
        this.budgetExceeded = budgetExceeded;
        this.elapsedMillis = elapsedMillis;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    /**
     * Builds the result from the first front of a finished run, decoding each distinct chromosome once more to
     * recover its full schedule
     */
    public static OptimizationResult fromFront(List<Solution> firstFront, SchedulingProblem problem, int generations, int evaluations, boolean converged, boolean budgetExceeded, long elapsedMillis, List<Diagnostic> diagnostics) {
        Map<ScheduleChromosome, ParetoMember> unique = new LinkedHashMap<>();
        for (Solution solution : firstFront) {
            ScheduleChromosome chromosome = SchedulingProblem.chromosomeOf(solution);
            if (!unique.containsKey(chromosome)) {
                unique.put(chromosome, new ParetoMember(chromosome, problem.decode(solution), NondominatedSorter.rankOf(solution), NondominatedSorter.crowdingOf(solution)));
            }
        }
        return new OptimizationResult(new ArrayList<>(unique.values()), generations, evaluations, converged, budgetExceeded, elapsedMillis, diagnostics);
    }

    private static int compareGenes(ScheduleChromosome a, ScheduleChromosome b) {
        int length = Math.min(a.size(), b.size());
        for (int i = 0; i < length; i++) {
            int flag = Integer.compare(a.get(i), b.get(i));
            if (flag != 0) {
                return flag;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    public List<ParetoMember> getFront() {
        return this.front;
    }

    public ParetoMember recommended() {
        return recommended(ObjectiveWeights.defaults());
    }

    /**
     * Member minimising the weighted sum of min-max normalised objectives; objectives that do not vary across the
     * front contribute nothing. Ties go to the earlier member in front order.
     *
     * @return null when the front is empty
     */
    public ParetoMember recommended(ObjectiveWeights weights) {
        if (this.front.isEmpty()) {
            return null;
        }
        double[] w = weights.toArray();
        double[] min = new double[w.length];
        double[] max = new double[w.length];
        for (int m = 0; m < w.length; m++) {
            min[m] = Double.POSITIVE_INFINITY;
            max[m] = Double.NEGATIVE_INFINITY;
        }
        for (ParetoMember member : this.front) {
            double[] objectives = member.getObjectives();
            for (int m = 0; m < w.length; m++) {
                min[m] = Math.min(min[m], objectives[m]);
                max[m] = Math.max(max[m], objectives[m]);
            }
        }

        ParetoMember best = null;
        double bestScore = Double.POSITIVE_INFINITY;
        for (ParetoMember member : this.front) {
            double[] objectives = member.getObjectives();
            double score = 0.0;
            for (int m = 0; m < w.length; m++) {
                double range = max[m] - min[m];
                if (range > 0) {
                    score += w[m] * (objectives[m] - min[m]) / range;
                }
            }
            if (score < bestScore) {
                bestScore = score;
                best = member;
            }
        }
        return best;
    }

    public int getGenerations() {
        return this.generations;
    }

    public int getEvaluations() {
        return this.evaluations;
    }

    public boolean isConverged() {
        return this.converged;
    }

    public boolean isBudgetExceeded() {
        return this.budgetExceeded;
    }

    public long getElapsedMillis() {
        return this.elapsedMillis;
    }

    public List<Diagnostic> getDiagnostics() {
        return this.diagnostics;
    }
}
