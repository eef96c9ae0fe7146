package seakers.micscheduler.clustering;

import org.apache.commons.math3.ml.clustering.Clusterable;

/**
 * A task embedded in the weighted feature space the K-means stage works on
 */
public class TaskPoint implements Clusterable {

    private final int index;
    private final int taskId;
    private final double[] features;

    public TaskPoint(int index, int taskId, double[] features) {
        this.index = index;
        this.taskId = taskId;
        this.features = features;
    }

    /**
     * Position of the task in the similarity matrix
     */
    public int getIndex() {
        return this.index;
    }

    public int getTaskId() {
        return this.taskId;
    }

    @Override
    public double[] getPoint() {
        return this.features;
    }
}
