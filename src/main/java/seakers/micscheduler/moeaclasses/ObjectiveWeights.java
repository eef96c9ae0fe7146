package seakers.micscheduler.moeaclasses;

/**
 * Preference weights used to pick one recommended schedule from the Pareto front
 */
public class ObjectiveWeights {

    public static final double DEFAULT_COST = 0.35;
    public static final double DEFAULT_RISK = 0.45;
    public static final double DEFAULT_DELAY = 0.20;

    private final double cost;
    private final double risk;
    private final double delay;

    public ObjectiveWeights(double cost, double risk, double delay) {
        if (cost < 0 || risk < 0 || delay < 0 || cost + risk + delay <= 0) {
            throw new IllegalArgumentException("Objective weights must be non-negative and not all zero");
        }
        this.cost = cost;
        this.risk = risk;
        this.delay = delay;
    }

    public static ObjectiveWeights defaults() {
        return new ObjectiveWeights(DEFAULT_COST, DEFAULT_RISK, DEFAULT_DELAY);
    }

    public double[] toArray() {
        return new double[]{this.cost, this.risk, this.delay};
    }

    public double getCost() {
        return this.cost;
    }

    public double getRisk() {
        return this.risk;
    }

    public double getDelay() {
        return this.delay;
    }
}
