package seakers.micscheduler.clustering;

import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.MersenneTwister;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import seakers.micscheduler.diagnostics.Diagnostic;
import seakers.micscheduler.model.Cluster;
import seakers.micscheduler.model.ResourceType;
import seakers.micscheduler.model.SystemCategory;
import seakers.micscheduler.model.Task;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups tasks into execution batches: K-means++ over the weighted feature space for every K in range,
 * elbow selection on the SSE curve, then a silhouette check on the composite similarity with bounded retries.
 */
public class TaskClusterer {

    private static final Logger log = LoggerFactory.getLogger(TaskClusterer.class);

    public static final double DEFAULT_SILHOUETTE_THRESHOLD = 0.5;
    private static final int MAX_LLOYD_ITERATIONS = 100;

    private final SimilarityWeights weights;
    private final int minK;
    private final int maxK;
    private final double silhouetteThreshold;
    private final int retries;

    public TaskClusterer(SimilarityWeights weights, int minK, int maxK, double silhouetteThreshold, int retries) {
        if (minK < 1 || maxK < minK) {
            throw new IllegalArgumentException("Invalid cluster range [" + minK + "," + maxK + "]");
        }
        this.weights = weights;
        this.minK = minK;
        this.maxK = maxK;
        this.silhouetteThreshold = silhouetteThreshold;
        this.retries = retries;
    }

    public TaskClusterer() {
        this(SimilarityWeights.defaults(), 2, 10, DEFAULT_SILHOUETTE_THRESHOLD, 2);
    }

    /**
     * Clusters with K chosen by the elbow rule and the silhouette retries
     */
    public ClusteringResult cluster(Collection<Task> tasks, long seed) {
        return run(tasks, 0, seed);
    }

    /**
     * Clusters with a caller-chosen K; no elbow selection and no retries
     */
    public ClusteringResult cluster(Collection<Task> tasks, int forcedK, long seed) {
        if (forcedK < 1) {
            throw new IllegalArgumentException("Forced K must be positive: " + forcedK);
        }
        return run(tasks, forcedK, seed);
    }

    private ClusteringResult run(Collection<Task> input, int forcedK, long seed) {
        List<Task> tasks = new ArrayList<>(input);
        tasks.sort(Comparator.comparingInt(Task::getId));
        int n = tasks.size();
        if (n == 0) {
            return ClusteringResult.empty();
        }

        TaskSimilarity similarity = new TaskSimilarity(tasks, this.weights);
        List<TaskPoint> points = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            points.add(new TaskPoint(i, tasks.get(i).getId(), similarity.features(i)));
        }

        Map<Integer, Double> sseByK = new LinkedHashMap<>();
        Map<Integer, Double> silhouetteByK = new LinkedHashMap<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        if (forcedK > 0 || n <= 2) {
            int k = forcedK > 0 ? Math.min(forcedK, n) : n;
            int[] labels = labelsFor(points, k, seed, sseByK);
            if (labels == null) {
                labels = labelsBySystem(tasks);
            }
            double silhouette = silhouette(labels, similarity);
            silhouetteByK.put(k, silhouette);
            List<Cluster> clusters = buildClusters(tasks, labels, similarity);
            if (k >= 2 && k < n && silhouette < this.silhouetteThreshold) {
                diagnostics.add(qualityWarning(clusters, silhouette, k));
            }
            return new ClusteringResult(clusters, silhouette, sseByK, silhouetteByK, forcedK > 0, diagnostics);
        }

        int lowK = Math.max(2, this.minK);
        int highK = Math.min(this.maxK, n - 1);
        if (highK < lowK) {
            lowK = highK;
        }

        Map<Integer, int[]> labelsByK = new LinkedHashMap<>();
        for (int k = lowK; k <= highK; k++) {
            int[] labels = labelsFor(points, k, seed, sseByK);
            if (labels != null) {
                labelsByK.put(k, labels);
            }
        }
        if (labelsByK.isEmpty()) {
            // every K failed to converge; one cluster per system is always well-defined
            int[] labels = labelsBySystem(tasks);
            List<Cluster> clusters = buildClusters(tasks, labels, similarity);
            double silhouette = silhouette(labels, similarity);
            diagnostics.add(qualityWarning(clusters, silhouette, clusters.size()));
            return new ClusteringResult(clusters, silhouette, sseByK, silhouetteByK, false, diagnostics);
        }

        int elbowK = elbow(sseByK, labelsByK);
        int bestK = elbowK;
        double bestSilhouette = silhouette(labelsByK.get(elbowK), similarity);
        silhouetteByK.put(elbowK, bestSilhouette);
        log.debug("Elbow selected K={} (silhouette {})", elbowK, bestSilhouette);

        int attempts = 0;
        int offset = 1;
        while (bestSilhouette < this.silhouetteThreshold && attempts < this.retries && offset <= highK - lowK) {
            for (int candidate : new int[]{elbowK - offset, elbowK + offset}) {
                if (attempts >= this.retries || !labelsByK.containsKey(candidate)) {
                    continue;
                }
                attempts++;
                double candidateSilhouette = silhouette(labelsByK.get(candidate), similarity);
                silhouetteByK.put(candidate, candidateSilhouette);
                log.debug("Retry K={} gave silhouette {}", candidate, candidateSilhouette);
                if (candidateSilhouette > bestSilhouette) {
                    bestSilhouette = candidateSilhouette;
                    bestK = candidate;
                }
            }
            offset++;
        }

        List<Cluster> clusters = buildClusters(tasks, labelsByK.get(bestK), similarity);
        if (bestSilhouette < this.silhouetteThreshold) {
            diagnostics.add(qualityWarning(clusters, bestSilhouette, bestK));
        }
        return new ClusteringResult(clusters, bestSilhouette, sseByK, silhouetteByK, false, diagnostics);
    }

    private Diagnostic qualityWarning(List<Cluster> clusters, double silhouette, int k) {
        List<Integer> clusterIds = new ArrayList<>();
        for (Cluster cluster : clusters) {
            clusterIds.add(cluster.getId());
        }
        String message = String.format("Silhouette %.3f below %.2f with K=%d; proceeding with the best clustering found", silhouette, this.silhouetteThreshold, k);
        log.warn(message);
        return Diagnostic.clusteringQuality(clusterIds, message);
    }

    /**
     * Runs K-means++ for one K and records its SSE. Returns null when the clusterer cannot converge for this K.
     */
    private int[] labelsFor(List<TaskPoint> points, int k, long seed, Map<Integer, Double> sseByK) {
        int[] labels = new int[points.size()];
        if (k >= points.size()) {
            for (int i = 0; i < labels.length; i++) {
                labels[i] = i;
            }
            sseByK.put(k, 0.0);
            return labels;
        }
        if (k == 1) {
            sseByK.put(k, sse(points, labels, 1));
            return labels;
        }

        KMeansPlusPlusClusterer<TaskPoint> clusterer = new KMeansPlusPlusClusterer<>(k, MAX_LLOYD_ITERATIONS, new EuclideanDistance(), new MersenneTwister(seed * 1_000_003L + k));
        List<CentroidCluster<TaskPoint>> result;
        try {
            result = clusterer.cluster(points);
        } catch (MathIllegalStateException e) {
            log.warn("K-means did not converge for K={}: {}", k, e.getMessage());
            return null;
        }
        int label = 0;
        double sse = 0.0;
        EuclideanDistance euclidean = new EuclideanDistance();
        for (CentroidCluster<TaskPoint> cluster : result) {
            if (cluster.getPoints().isEmpty()) {
                continue;
            }
            for (TaskPoint point : cluster.getPoints()) {
                labels[point.getIndex()] = label;
                double distance = euclidean.compute(point.getPoint(), cluster.getCenter().getPoint());
                sse += distance * distance;
            }
            label++;
        }
        sseByK.put(k, sse);
        return labels;
    }

    private static double sse(List<TaskPoint> points, int[] labels, int k) {
        int dimension = points.get(0).getPoint().length;
        double[][] centroids = new double[k][dimension];
        int[] counts = new int[k];
        for (TaskPoint point : points) {
            int label = labels[point.getIndex()];
            counts[label]++;
            for (int d = 0; d < dimension; d++) {
                centroids[label][d] += point.getPoint()[d];
            }
        }
        for (int c = 0; c < k; c++) {
            for (int d = 0; d < dimension; d++) {
                centroids[c][d] /= Math.max(1, counts[c]);
            }
        }
        double sse = 0.0;
        for (TaskPoint point : points) {
            double[] centroid = centroids[labels[point.getIndex()]];
            for (int d = 0; d < dimension; d++) {
                double gap = point.getPoint()[d] - centroid[d];
                sse += gap * gap;
            }
        }
        return sse;
    }

    private static int[] labelsBySystem(List<Task> tasks) {
        int[] labels = new int[tasks.size()];
        for (int i = 0; i < tasks.size(); i++) {
            labels[i] = tasks.get(i).getSystem().ordinal();
        }
        return labels;
    }

    /**
     * K with the largest second difference SSE[k-1] - 2 SSE[k] + SSE[k+1]; the smallest K when fewer than three were tried
     */
    static int elbow(Map<Integer, Double> sseByK, Map<Integer, int[]> usable) {
        List<Integer> ks = new ArrayList<>();
        for (Integer k : sseByK.keySet()) {
            if (usable.containsKey(k)) {
                ks.add(k);
            }
        }
        if (ks.size() < 3) {
            return ks.get(0);
        }
        int best = ks.get(1);
        double bestCurvature = Double.NEGATIVE_INFINITY;
        for (int i = 1; i < ks.size() - 1; i++) {
            double curvature = sseByK.get(ks.get(i - 1)) - 2.0 * sseByK.get(ks.get(i)) + sseByK.get(ks.get(i + 1));
            if (curvature > bestCurvature) {
                bestCurvature = curvature;
                best = ks.get(i);
            }
        }
        return best;
    }

    /**
     * Mean silhouette over all tasks using 1 - composite similarity as distance. Singleton clusters score 0.
     */
    static double silhouette(int[] labels, TaskSimilarity similarity) {
        double[] perTask = silhouetteSamples(labels, similarity);
        if (perTask.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : perTask) {
            sum += value;
        }
        return sum / perTask.length;
    }

    static double[] silhouetteSamples(int[] labels, TaskSimilarity similarity) {
        int n = labels.length;
        int k = 0;
        for (int label : labels) {
            k = Math.max(k, label + 1);
        }
        double[] samples = new double[n];
        if (k < 2) {
            return samples;
        }
        int[] sizes = new int[k];
        for (int label : labels) {
            sizes[label]++;
        }
        for (int i = 0; i < n; i++) {
            if (sizes[labels[i]] <= 1) {
                samples[i] = 0.0;
                continue;
            }
            double[] totals = new double[k];
            for (int j = 0; j < n; j++) {
                if (i != j) {
                    totals[labels[j]] += similarity.distance(i, j);
                }
            }
            double a = totals[labels[i]] / (sizes[labels[i]] - 1);
            double b = Double.POSITIVE_INFINITY;
            for (int c = 0; c < k; c++) {
                if (c != labels[i] && sizes[c] > 0) {
                    b = Math.min(b, totals[c] / sizes[c]);
                }
            }
            double scale = Math.max(a, b);
            samples[i] = scale > 0 ? (b - a) / scale : 0.0;
        }
        return samples;
    }

    private static List<Cluster> buildClusters(List<Task> tasks, int[] labels, TaskSimilarity similarity) {
        Map<Integer, List<Integer>> membersByLabel = new LinkedHashMap<>();
        for (int i = 0; i < tasks.size(); i++) {
            membersByLabel.computeIfAbsent(labels[i], key -> new ArrayList<>()).add(i);
        }
        List<List<Integer>> groups = new ArrayList<>(membersByLabel.values());
        // indices follow ascending task id, so the first index is the smallest member id
        groups.sort(Comparator.comparingInt(group -> tasks.get(group.get(0)).getId()));

        double[] samples = silhouetteSamples(labels, similarity);
        List<Cluster> clusters = new ArrayList<>();
        for (int clusterId = 0; clusterId < groups.size(); clusterId++) {
            List<Integer> group = groups.get(clusterId);
            List<Task> members = new ArrayList<>();
            double[] spatial = new double[3];
            double[] demand = new double[ResourceType.COUNT];
            int[] systemCounts = new int[SystemCategory.values().length];
            double criticality = 0.0;
            double silhouette = 0.0;
            for (int index : group) {
                Task task = tasks.get(index);
                members.add(task);
                double[] coordinates = task.getCoordinates();
                for (int d = 0; d < 3; d++) {
                    spatial[d] += coordinates[d] / group.size();
                }
                int[] taskDemand = task.getDemand();
                for (int r = 0; r < demand.length; r++) {
                    demand[r] += (double) taskDemand[r] / group.size();
                }
                systemCounts[task.getSystem().ordinal()]++;
                criticality += (double) task.getCriticality() / group.size();
                silhouette += samples[index] / group.size();
            }
            int dominant = 0;
            for (int s = 1; s < systemCounts.length; s++) {
                if (systemCounts[s] > systemCounts[dominant]) {
                    dominant = s;
                }
            }
            members.sort(Comparator.comparingInt(Task::getCriticality).thenComparingInt(Task::getId));
            List<Integer> memberIds = new ArrayList<>();
            for (Task member : members) {
                memberIds.add(member.getId());
            }
            clusters.add(new Cluster(clusterId, memberIds, spatial, SystemCategory.values()[dominant], demand, criticality, silhouette));
        }
        return clusters;
    }
}
