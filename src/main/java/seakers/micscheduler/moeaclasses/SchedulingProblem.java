package seakers.micscheduler.moeaclasses;

import org.moeaframework.core.Solution;
import org.moeaframework.core.variable.EncodingUtils;
import org.moeaframework.problem.AbstractProblem;
import seakers.micscheduler.decoding.DecodedSchedule;
import seakers.micscheduler.decoding.ScheduleDecoder;
import seakers.micscheduler.decoding.SchedulingInstance;
import seakers.micscheduler.diagnostics.Diagnostic;
import seakers.micscheduler.diagnostics.DiagnosticType;
import seakers.micscheduler.model.ScheduleChromosome;

public class SchedulingProblem extends AbstractProblem {

    /**
     * Scheduling problem class: one permutation variable over the clusters, objectives cost, risk and delay
     * (all minimised) and one constraint counting the tasks the decoder could not place
     */

    public static final String[] OBJECTIVE_NAMES = {"Cost", "Risk", "Delay"};
    public static final String FEASIBLE_ATTRIBUTE = "feasible";

    private final SchedulingInstance instance;
    private final ScheduleDecoder decoder;

    public SchedulingProblem(SchedulingInstance instance) {
        super(1, OBJECTIVE_NAMES.length, 1);
        if (instance.getClusterCount() == 0) {
            throw new IllegalArgumentException("Nothing to optimize: the instance has no clusters");
        }
        this.instance = instance;
        this.decoder = new ScheduleDecoder();
    }

    @Override
    public void evaluate(Solution solution) {
        DecodedSchedule schedule = decode(solution);
        solution.setObjectives(schedule.getObjectives());

        int unplaced = 0;
        for (Diagnostic diagnostic : schedule.getDiagnostics()) {
            if (diagnostic.getType() == DiagnosticType.SCHEDULE_INFEASIBLE) {
                unplaced++;
            }
        }
        solution.setConstraint(0, unplaced);
        solution.setAttribute(FEASIBLE_ATTRIBUTE, schedule.isFeasible());
    }

    public DecodedSchedule decode(Solution solution) {
        return this.decoder.decode(chromosomeOf(solution), this.instance);
    }

    @Override
    public Solution newSolution() {
        Solution solution = new Solution(getNumberOfVariables(), getNumberOfObjectives(), getNumberOfConstraints());
        solution.setVariable(0, EncodingUtils.newPermutation(this.instance.getClusterCount()));
        return solution;
    }

    public Solution newSolution(ScheduleChromosome chromosome) {
        Solution solution = newSolution();
        EncodingUtils.setPermutation(solution.getVariable(0), chromosome.toArray());
        return solution;
    }

    public static ScheduleChromosome chromosomeOf(Solution solution) {
        return ScheduleChromosome.of(EncodingUtils.getPermutation(solution.getVariable(0)));
    }

    public SchedulingInstance getInstance() {
        return this.instance;
    }
}
