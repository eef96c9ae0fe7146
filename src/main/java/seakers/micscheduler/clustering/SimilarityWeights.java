package seakers.micscheduler.clustering;

/**
 * Weights of the four similarity components; they need not sum to one but must not all be zero
 */
public class SimilarityWeights {

    public static final double DEFAULT_SPATIAL = 0.35;
    public static final double DEFAULT_SYSTEM = 0.25;
    public static final double DEFAULT_RESOURCE = 0.15;
    public static final double DEFAULT_CRITICALITY = 0.25;

    private final double spatial;
    private final double system;
    private final double resource;
    private final double criticality;

    public SimilarityWeights(double spatial, double system, double resource, double criticality) {
        if (spatial < 0 || system < 0 || resource < 0 || criticality < 0) {
            throw new IllegalArgumentException("Similarity weights must be non-negative");
        }
        if (spatial + system + resource + criticality <= 0) {
            throw new IllegalArgumentException("At least one similarity weight must be positive");
        }
        this.spatial = spatial;
        this.system = system;
        this.resource = resource;
        this.criticality = criticality;
    }

    public static SimilarityWeights defaults() {
        return new SimilarityWeights(DEFAULT_SPATIAL, DEFAULT_SYSTEM, DEFAULT_RESOURCE, DEFAULT_CRITICALITY);
    }

    public double getSpatial() {
        return this.spatial;
    }

    public double getSystem() {
        return this.system;
    }

    public double getResource() {
        return this.resource;
    }

    public double getCriticality() {
        return this.criticality;
    }

    public double total() {
        return this.spatial + this.system + this.resource + this.criticality;
    }
}
