package seakers.micscheduler.diagnostics;

import seakers.micscheduler.model.ResourceType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A non-fatal condition reported back to the caller. Always names the tasks or clusters involved.
 */
public class Diagnostic {

    private final DiagnosticType type;
    private final List<Integer> taskIds;
    private final List<Integer> clusterIds;
    private final ResourceType blockingResource;
    private final Integer blockingPredecessor;
    private final String message;

    public Diagnostic(DiagnosticType type, List<Integer> taskIds, List<Integer> clusterIds, ResourceType blockingResource, Integer blockingPredecessor, String message) {
        this.type = type;
        this.taskIds = Collections.unmodifiableList(new ArrayList<>(taskIds));
        this.clusterIds = Collections.unmodifiableList(new ArrayList<>(clusterIds));
        this.blockingResource = blockingResource;
        this.blockingPredecessor = blockingPredecessor;
        this.message = message;
    }

    public static Diagnostic infeasibleResource(int taskId, ResourceType resource, String message) {
        return new Diagnostic(DiagnosticType.SCHEDULE_INFEASIBLE, Collections.singletonList(taskId), Collections.emptyList(), resource, null, message);
    }

    public static Diagnostic infeasiblePredecessor(int taskId, int predecessorId, String message) {
        return new Diagnostic(DiagnosticType.SCHEDULE_INFEASIBLE, Collections.singletonList(taskId), Collections.emptyList(), null, predecessorId, message);
    }

    public static Diagnostic clusteringQuality(List<Integer> clusterIds, String message) {
        return new Diagnostic(DiagnosticType.CLUSTERING_QUALITY_WARNING, Collections.emptyList(), clusterIds, null, null, message);
    }

    public static Diagnostic budgetExceeded(List<Integer> taskIds, String message) {
        return new Diagnostic(DiagnosticType.OPTIMIZATION_BUDGET_EXCEEDED, taskIds, Collections.emptyList(), null, null, message);
    }

    public static Diagnostic capacityMismatch(int taskId, ResourceType resource, String message) {
        return new Diagnostic(DiagnosticType.RESOURCE_CAPACITY_MISMATCH, Collections.singletonList(taskId), Collections.emptyList(), resource, null, message);
    }

    public DiagnosticType getType() {
        return this.type;
    }

    public List<Integer> getTaskIds() {
        return this.taskIds;
    }

    public List<Integer> getClusterIds() {
        return this.clusterIds;
    }

    public ResourceType getBlockingResource() {
        return this.blockingResource;
    }

    public Integer getBlockingPredecessor() {
        return this.blockingPredecessor;
    }

    public String getMessage() {
        return this.message;
    }

    @Override
    public String toString() {
        return this.type + " tasks=" + this.taskIds + " clusters=" + this.clusterIds + ": " + this.message;
    }
}
