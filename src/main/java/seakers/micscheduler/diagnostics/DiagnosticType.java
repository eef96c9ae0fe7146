package seakers.micscheduler.diagnostics;

public enum DiagnosticType {
    SCHEDULE_INFEASIBLE,
    CLUSTERING_QUALITY_WARNING,
    OPTIMIZATION_BUDGET_EXCEEDED,
    RESOURCE_CAPACITY_MISMATCH
}
