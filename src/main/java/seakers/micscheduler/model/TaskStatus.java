package seakers.micscheduler.model;

public enum TaskStatus {
    PENDING,
    SCHEDULED,
    IN_PROGRESS,
    PREEMPTED,
    COMPLETED,
    SPLIT_REMAINDER;

    /**
     * Tasks the optimizer may still reorder
     */
    public boolean isSchedulable() {
        return this == PENDING || this == SPLIT_REMAINDER;
    }

    /**
     * Committed tasks that are immutable inputs to a decode
     */
    public boolean isFrozen() {
        return this == SCHEDULED || this == IN_PROGRESS;
    }
}
