package seakers.micscheduler;

import seakers.micscheduler.clustering.SimilarityWeights;
import seakers.micscheduler.clustering.TaskClusterer;
import seakers.micscheduler.decoding.CostModel;
import seakers.micscheduler.model.ProjectBounds;
import seakers.micscheduler.model.ResourceType;
import seakers.micscheduler.moeaclasses.ObjectiveWeights;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Engine settings. Every field has a working default; {@link #load(String)} overrides them from a properties file
 * on the classpath.
 */
public class SchedulerConfig {

    // Clustering
    private int minClusters = 2;
    private int maxClusters = 10;
    private int forcedClusters = 0;
    private SimilarityWeights similarityWeights = SimilarityWeights.defaults();
    private double silhouetteThreshold = TaskClusterer.DEFAULT_SILHOUETTE_THRESHOLD;
    private int clusteringRetries = 2;

    // Optimizer
    private int populationSize = 50;
    private int generations = 100;
    private double crossoverProbability = 0.9;
    private double mutationProbability = Double.NaN;
    private int stallGenerations = 25;
    private int evaluationThreads = 1;
    private ObjectiveWeights objectiveWeights = ObjectiveWeights.defaults();
    private long seed = 42L;

    // Rolling horizon
    private int commitWindowHours = 24;
    private int lookaheadHours = 8760;
    private long reoptimizationBudgetMillis = 10_000L;
    private int preemptionCriticalityMargin = 3;
    private int emergencyResponseHours = 8;

    // Decoding
    private boolean overflowAllowed = false;
    private CostModel costModel = CostModel.defaults();
    private ProjectBounds bounds = ProjectBounds.unbounded();

    public static SchedulerConfig defaults() {
        return new SchedulerConfig();
    }

    public static SchedulerConfig load(String resource) throws IOException {
        Properties properties = new Properties();
        try (InputStream stream = SchedulerConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (stream == null) {
                throw new IOException("Configuration resource not found on classpath: " + resource);
            }
            properties.load(stream);
        }
        return fromProperties(properties);
    }

    public static SchedulerConfig fromProperties(Properties properties) {
        SchedulerConfig config = new SchedulerConfig();

        config.minClusters = intValue(properties, "clustering.kMin", config.minClusters);
        config.maxClusters = intValue(properties, "clustering.kMax", config.maxClusters);
        config.forcedClusters = intValue(properties, "clustering.forcedK", config.forcedClusters);
        config.silhouetteThreshold = doubleValue(properties, "clustering.silhouetteThreshold", config.silhouetteThreshold);
        config.clusteringRetries = intValue(properties, "clustering.retries", config.clusteringRetries);
        config.similarityWeights = new SimilarityWeights(
                doubleValue(properties, "similarity.spatial", SimilarityWeights.DEFAULT_SPATIAL),
                doubleValue(properties, "similarity.system", SimilarityWeights.DEFAULT_SYSTEM),
                doubleValue(properties, "similarity.resource", SimilarityWeights.DEFAULT_RESOURCE),
                doubleValue(properties, "similarity.criticality", SimilarityWeights.DEFAULT_CRITICALITY));

        config.populationSize = intValue(properties, "optimizer.populationSize", config.populationSize);
        config.generations = intValue(properties, "optimizer.generations", config.generations);
        config.crossoverProbability = doubleValue(properties, "optimizer.crossoverProbability", config.crossoverProbability);
        config.mutationProbability = doubleValue(properties, "optimizer.mutationProbability", config.mutationProbability);
        config.stallGenerations = intValue(properties, "optimizer.stallGenerations", config.stallGenerations);
        config.evaluationThreads = intValue(properties, "optimizer.evaluationThreads", config.evaluationThreads);
        config.seed = Long.parseLong(properties.getProperty("optimizer.seed", Long.toString(config.seed)).trim());
        config.objectiveWeights = new ObjectiveWeights(
                doubleValue(properties, "objective.cost", ObjectiveWeights.DEFAULT_COST),
                doubleValue(properties, "objective.risk", ObjectiveWeights.DEFAULT_RISK),
                doubleValue(properties, "objective.delay", ObjectiveWeights.DEFAULT_DELAY));

        config.commitWindowHours = intValue(properties, "horizon.commitWindowHours", config.commitWindowHours);
        config.lookaheadHours = intValue(properties, "horizon.lookaheadHours", config.lookaheadHours);
        config.reoptimizationBudgetMillis = Long.parseLong(properties.getProperty("horizon.budgetMillis", Long.toString(config.reoptimizationBudgetMillis)).trim());
        config.preemptionCriticalityMargin = intValue(properties, "horizon.preemptionCriticalityMargin", config.preemptionCriticalityMargin);
        config.emergencyResponseHours = intValue(properties, "horizon.emergencyResponseHours", config.emergencyResponseHours);

        config.overflowAllowed = Boolean.parseBoolean(properties.getProperty("decoding.overflowAllowed", Boolean.toString(config.overflowAllowed)).trim());
        double[] rates = new double[ResourceType.COUNT];
        for (ResourceType type : ResourceType.values()) {
            rates[type.ordinal()] = doubleValue(properties, "cost.rate." + type.name().toLowerCase(), type.getDefaultDailyRate());
        }
        config.costModel = new CostModel(rates,
                doubleValue(properties, "cost.setup", CostModel.DEFAULT_SETUP_COST),
                doubleValue(properties, "cost.overflowPenalty", CostModel.DEFAULT_OVERFLOW_PENALTY),
                doubleValue(properties, "cost.emergencyMultiplier", CostModel.DEFAULT_EMERGENCY_MULTIPLIER));

        return config;
    }

    private static int intValue(Properties properties, String key, int fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not an integer: " + value, e);
        }
    }

    private static double doubleValue(Properties properties, String key, double fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not a number: " + value, e);
        }
    }

    public TaskClusterer newClusterer() {
        return new TaskClusterer(this.similarityWeights, this.minClusters, this.maxClusters, this.silhouetteThreshold, this.clusteringRetries);
    }

    public int getMinClusters() {
        return this.minClusters;
    }

    public SchedulerConfig setMinClusters(int minClusters) {
        this.minClusters = minClusters;
        return this;
    }

    public int getMaxClusters() {
        return this.maxClusters;
    }

    public SchedulerConfig setMaxClusters(int maxClusters) {
        this.maxClusters = maxClusters;
        return this;
    }

    /**
     * @return the caller-fixed cluster count, or 0 when K is chosen by the elbow rule
     */
    public int getForcedClusters() {
        return this.forcedClusters;
    }

    public SchedulerConfig setForcedClusters(int forcedClusters) {
        this.forcedClusters = forcedClusters;
        return this;
    }

    public SimilarityWeights getSimilarityWeights() {
        return this.similarityWeights;
    }

    public SchedulerConfig setSimilarityWeights(SimilarityWeights similarityWeights) {
        this.similarityWeights = similarityWeights;
        return this;
    }

    public double getSilhouetteThreshold() {
        return this.silhouetteThreshold;
    }

    public SchedulerConfig setSilhouetteThreshold(double silhouetteThreshold) {
        this.silhouetteThreshold = silhouetteThreshold;
        return this;
    }

    public int getClusteringRetries() {
        return this.clusteringRetries;
    }

    public SchedulerConfig setClusteringRetries(int clusteringRetries) {
        this.clusteringRetries = clusteringRetries;
        return this;
    }

    public int getPopulationSize() {
        return this.populationSize;
    }

    public SchedulerConfig setPopulationSize(int populationSize) {
        this.populationSize = populationSize;
        return this;
    }

    public int getGenerations() {
        return this.generations;
    }

    public SchedulerConfig setGenerations(int generations) {
        this.generations = generations;
        return this;
    }

    public double getCrossoverProbability() {
        return this.crossoverProbability;
    }

    public SchedulerConfig setCrossoverProbability(double crossoverProbability) {
        this.crossoverProbability = crossoverProbability;
        return this;
    }

    /**
     * @return per-position swap probability, NaN for 1/n
     */
    public double getMutationProbability() {
        return this.mutationProbability;
    }

    public SchedulerConfig setMutationProbability(double mutationProbability) {
        this.mutationProbability = mutationProbability;
        return this;
    }

    public int getStallGenerations() {
        return this.stallGenerations;
    }

    public SchedulerConfig setStallGenerations(int stallGenerations) {
        this.stallGenerations = stallGenerations;
        return this;
    }

    public int getEvaluationThreads() {
        return this.evaluationThreads;
    }

    public SchedulerConfig setEvaluationThreads(int evaluationThreads) {
        this.evaluationThreads = evaluationThreads;
        return this;
    }

    public ObjectiveWeights getObjectiveWeights() {
        return this.objectiveWeights;
    }

    public SchedulerConfig setObjectiveWeights(ObjectiveWeights objectiveWeights) {
        this.objectiveWeights = objectiveWeights;
        return this;
    }

    public long getSeed() {
        return this.seed;
    }

    public SchedulerConfig setSeed(long seed) {
        this.seed = seed;
        return this;
    }

    public int getCommitWindowHours() {
        return this.commitWindowHours;
    }

    public SchedulerConfig setCommitWindowHours(int commitWindowHours) {
        this.commitWindowHours = commitWindowHours;
        return this;
    }

    public int getLookaheadHours() {
        return this.lookaheadHours;
    }

    public SchedulerConfig setLookaheadHours(int lookaheadHours) {
        this.lookaheadHours = lookaheadHours;
        return this;
    }

    public long getReoptimizationBudgetMillis() {
        return this.reoptimizationBudgetMillis;
    }

    public SchedulerConfig setReoptimizationBudgetMillis(long reoptimizationBudgetMillis) {
        this.reoptimizationBudgetMillis = reoptimizationBudgetMillis;
        return this;
    }

    public int getPreemptionCriticalityMargin() {
        return this.preemptionCriticalityMargin;
    }

    public SchedulerConfig setPreemptionCriticalityMargin(int preemptionCriticalityMargin) {
        this.preemptionCriticalityMargin = preemptionCriticalityMargin;
        return this;
    }

    public int getEmergencyResponseHours() {
        return this.emergencyResponseHours;
    }

    public SchedulerConfig setEmergencyResponseHours(int emergencyResponseHours) {
        this.emergencyResponseHours = emergencyResponseHours;
        return this;
    }

    public boolean isOverflowAllowed() {
        return this.overflowAllowed;
    }

    public SchedulerConfig setOverflowAllowed(boolean overflowAllowed) {
        this.overflowAllowed = overflowAllowed;
        return this;
    }

    public CostModel getCostModel() {
        return this.costModel;
    }

    public SchedulerConfig setCostModel(CostModel costModel) {
        this.costModel = costModel;
        return this;
    }

    public ProjectBounds getBounds() {
        return this.bounds;
    }

    public SchedulerConfig setBounds(ProjectBounds bounds) {
        this.bounds = bounds;
        return this;
    }
}
