package seakers.micscheduler.clustering;

import org.apache.commons.math3.ml.distance.EuclideanDistance;
import seakers.micscheduler.model.SystemCategory;
import seakers.micscheduler.model.Task;

import java.util.List;

/**
 * Composite pairwise similarity of a task set.
 *
 * sim(i,j) = ws (1 - spatial_n) + wsys [same system] + wr (1 - resource_n) + wc (1 - |Ci - Cj| / 10), divided by the weight total,
 * where spatial_n and resource_n are Euclidean distances min-max normalised over all pairs of the set.
 */
public class TaskSimilarity {

    private final List<Task> tasks;
    private final SimilarityWeights weights;
    private final double[][] similarity;
    private final double maxSpatialDistance;
    private final double maxResourceDistance;

    public TaskSimilarity(List<Task> tasks, SimilarityWeights weights) {
        this.tasks = tasks;
        this.weights = weights;
        int n = tasks.size();

        EuclideanDistance euclidean = new EuclideanDistance();
        double[][] spatial = new double[n][n];
        double[][] resource = new double[n][n];
        double minSpatial = Double.POSITIVE_INFINITY;
        double maxSpatial = 0.0;
        double minResource = Double.POSITIVE_INFINITY;
        double maxResource = 0.0;
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                spatial[i][j] = euclidean.compute(tasks.get(i).getCoordinates(), tasks.get(j).getCoordinates());
                spatial[j][i] = spatial[i][j];
                resource[i][j] = euclidean.compute(toDouble(tasks.get(i).getDemand()), toDouble(tasks.get(j).getDemand()));
                resource[j][i] = resource[i][j];
                minSpatial = Math.min(minSpatial, spatial[i][j]);
                maxSpatial = Math.max(maxSpatial, spatial[i][j]);
                minResource = Math.min(minResource, resource[i][j]);
                maxResource = Math.max(maxResource, resource[i][j]);
            }
        }
        this.maxSpatialDistance = maxSpatial;
        this.maxResourceDistance = maxResource;

        this.similarity = new double[n][n];
        for (int i = 0; i < n; i++) {
            this.similarity[i][i] = 1.0;
            for (int j = i + 1; j < n; j++) {
                double spatialSimilarity = 1.0 - normalise(spatial[i][j], minSpatial, maxSpatial);
                double systemSimilarity = tasks.get(i).getSystem() == tasks.get(j).getSystem() ? 1.0 : 0.0;
                double resourceSimilarity = 1.0 - normalise(resource[i][j], minResource, maxResource);
                double criticalitySimilarity = 1.0 - Math.abs(tasks.get(i).getCriticality() - tasks.get(j).getCriticality()) / 10.0;

                double value = (weights.getSpatial() * spatialSimilarity
                        + weights.getSystem() * systemSimilarity
                        + weights.getResource() * resourceSimilarity
                        + weights.getCriticality() * criticalitySimilarity) / weights.total();
                this.similarity[i][j] = value;
                this.similarity[j][i] = value;
            }
        }
    }

    private static double normalise(double value, double min, double max) {
        if (max - min <= 0.0) {
            return 0.0;
        }
        return (value - min) / (max - min);
    }

    private static double[] toDouble(int[] values) {
        double[] converted = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            converted[i] = values[i];
        }
        return converted;
    }

    public double similarity(int i, int j) {
        return this.similarity[i][j];
    }

    public double distance(int i, int j) {
        return 1.0 - this.similarity[i][j];
    }

    public int size() {
        return this.tasks.size();
    }

    /**
     * Feature vector for K-means: each block is scaled so that its squared Euclidean contribution tracks the
     * corresponding weighted similarity term (spatial and resource blocks by the largest pairwise distance,
     * a one-hot system block, and criticality on the 0-1 scale)
     */
    public double[] features(int i) {
        Task task = this.tasks.get(i);
        double total = this.weights.total();
        double spatialFactor = Math.sqrt(this.weights.getSpatial() / total) / (this.maxSpatialDistance > 0 ? this.maxSpatialDistance : 1.0);
        double systemFactor = Math.sqrt(this.weights.getSystem() / total / 2.0);
        double resourceFactor = Math.sqrt(this.weights.getResource() / total) / (this.maxResourceDistance > 0 ? this.maxResourceDistance : 1.0);
        double criticalityFactor = Math.sqrt(this.weights.getCriticality() / total);

        int[] demand = task.getDemand();
        double[] features = new double[3 + SystemCategory.values().length + demand.length + 1];
        int position = 0;
        double[] coordinates = task.getCoordinates();
        for (double coordinate : coordinates) {
            features[position++] = coordinate * spatialFactor;
        }
        for (SystemCategory category : SystemCategory.values()) {
            features[position++] = category == task.getSystem() ? systemFactor : 0.0;
        }
        for (int units : demand) {
            features[position++] = units * resourceFactor;
        }
        features[position] = task.getCriticality() / 10.0 * criticalityFactor;
        return features;
    }
}
