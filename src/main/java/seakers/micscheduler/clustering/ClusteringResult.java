package seakers.micscheduler.clustering;

import seakers.micscheduler.diagnostics.Diagnostic;
import seakers.micscheduler.model.Cluster;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Clusters of one run together with the quality report that selected them
 */
public class ClusteringResult {

    private final List<Cluster> clusters;
    private final double silhouette;
    private final Map<Integer, Double> sseByK;
    private final Map<Integer, Double> silhouetteByK;
    private final boolean forced;
    private final List<Diagnostic> diagnostics;
    private final Map<Integer, Integer> clusterOfTask;

    public ClusteringResult(List<Cluster> clusters, double silhouette, Map<Integer, Double> sseByK, Map<Integer, Double> silhouetteByK, boolean forced, List<Diagnostic> diagnostics) {
        this.clusters = Collections.unmodifiableList(new ArrayList<>(clusters));
        this.silhouette = silhouette;
        this.sseByK = Collections.unmodifiableMap(new LinkedHashMap<>(sseByK));
        this.silhouetteByK = Collections.unmodifiableMap(new LinkedHashMap<>(silhouetteByK));
        this.forced = forced;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));

        Map<Integer, Integer> membership = new HashMap<>();
        for (Cluster cluster : clusters) {
            for (int taskId : cluster.getMemberIds()) {
                membership.put(taskId, cluster.getId());
            }
        }
        this.clusterOfTask = Collections.unmodifiableMap(membership);
    }

    public static ClusteringResult empty() {
        return new ClusteringResult(Collections.emptyList(), 0.0, Collections.emptyMap(), Collections.emptyMap(), false, Collections.emptyList());
    }

    public List<Cluster> getClusters() {
        return this.clusters;
    }

    public int getK() {
        return this.clusters.size();
    }

    public double getSilhouette() {
        return this.silhouette;
    }

    /**
     * Sum of squared errors of every K tried during the elbow sweep
     */
    public Map<Integer, Double> getSseByK() {
        return this.sseByK;
    }

    /**
     * Silhouette of every K whose quality was assessed
     */
    public Map<Integer, Double> getSilhouetteByK() {
        return this.silhouetteByK;
    }

    public boolean isForced() {
        return this.forced;
    }

    public List<Diagnostic> getDiagnostics() {
        return this.diagnostics;
    }

    public boolean hasQualityWarning() {
        return !this.diagnostics.isEmpty();
    }

    public Integer clusterOf(int taskId) {
        return this.clusterOfTask.get(taskId);
    }
}
