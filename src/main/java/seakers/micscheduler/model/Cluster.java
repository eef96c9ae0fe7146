package seakers.micscheduler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One execution batch of a clustering run. Instances are immutable; the next run produces new ones.
 */
public class Cluster {

    private final int id;
    private final List<Integer> memberIds;
    private final double[] spatialCentroid;
    private final SystemCategory dominantSystem;
    private final double[] meanDemand;
    private final double meanCriticality;
    private final double silhouette;

    public Cluster(int id, List<Integer> memberIds, double[] spatialCentroid, SystemCategory dominantSystem, double[] meanDemand, double meanCriticality, double silhouette) {
        this.id = id;
        this.memberIds = Collections.unmodifiableList(new ArrayList<>(memberIds));
        this.spatialCentroid = spatialCentroid.clone();
        this.dominantSystem = dominantSystem;
        this.meanDemand = meanDemand.clone();
        this.meanCriticality = meanCriticality;
        this.silhouette = silhouette;
    }

    public int getId() {
        return this.id;
    }

    /**
     * Members in intra-cluster execution order (ascending criticality, then ascending id)
     */
    public List<Integer> getMemberIds() {
        return this.memberIds;
    }

    public int size() {
        return this.memberIds.size();
    }

    public double[] getSpatialCentroid() {
        return this.spatialCentroid.clone();
    }

    public SystemCategory getDominantSystem() {
        return this.dominantSystem;
    }

    public double[] getMeanDemand() {
        return this.meanDemand.clone();
    }

    public double getMeanCriticality() {
        return this.meanCriticality;
    }

    public double getSilhouette() {
        return this.silhouette;
    }

    @Override
    public String toString() {
        return "Cluster{" + "id=" + this.id + ", members=" + this.memberIds + ", system=" + this.dominantSystem
                + ", meanCriticality=" + this.meanCriticality + '}';
    }
}
