package seakers.micscheduler.rollinghorizon;

import seakers.micscheduler.clustering.ClusteringResult;
import seakers.micscheduler.decoding.DecodedSchedule;
import seakers.micscheduler.diagnostics.Diagnostic;
import seakers.micscheduler.moeaclasses.OptimizationResult;
import seakers.micscheduler.moeaclasses.ParetoMember;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one controller operation. Clustering, optimization and the adopted schedule are null when there was
 * nothing left to schedule.
 */
public class ReplanResult {

    private final RollingWindow window;
    private final ClusteringResult clustering;
    private final OptimizationResult optimization;
    private final ParetoMember adopted;
    private final List<Integer> committedIds;
    private final List<Diagnostic> diagnostics;

    public ReplanResult(RollingWindow window, ClusteringResult clustering, OptimizationResult optimization, ParetoMember adopted, List<Integer> committedIds, List<Diagnostic> diagnostics) {
        this.window = window;
        this.clustering = clustering;
        this.optimization = optimization;
        this.adopted = adopted;
        this.committedIds = Collections.unmodifiableList(new ArrayList<>(committedIds));
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public RollingWindow getWindow() {
        return this.window;
    }

    public ClusteringResult getClustering() {
        return this.clustering;
    }

    public OptimizationResult getOptimization() {
        return this.optimization;
    }

    public ParetoMember getAdopted() {
        return this.adopted;
    }

    public DecodedSchedule getSchedule() {
        return this.adopted == null ? null : this.adopted.getSchedule();
    }

    /**
     * Ids moved to SCHEDULED by this operation
     */
    public List<Integer> getCommittedIds() {
        return this.committedIds;
    }

    public List<Diagnostic> getDiagnostics() {
        return this.diagnostics;
    }

    public boolean isConverged() {
        return this.optimization == null || this.optimization.isConverged();
    }
}
