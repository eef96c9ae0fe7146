package seakers.micscheduler.decoding;

import seakers.micscheduler.model.ResourceType;

/**
 * Unit prices used by the cost objective
 */
public class CostModel {

    public static final double DEFAULT_SETUP_COST = 1000.0;
    public static final double DEFAULT_OVERFLOW_PENALTY = 2000.0;
    public static final double DEFAULT_EMERGENCY_MULTIPLIER = 1.2;

    private final double[] dailyRates;
    private final double setupCost;
    private final double overflowPenalty;
    private final double emergencyMultiplier;

    /**
     * @param dailyRates price of one unit of each resource type for one working day
     * @param setupCost mobilisation cost paid every time execution switches to another cluster
     * @param overflowPenalty charge per unit-hour of demand above capacity (only incurred when overflow is permitted)
     * @param emergencyMultiplier direct-cost surcharge for urgent tasks
     */
    public CostModel(double[] dailyRates, double setupCost, double overflowPenalty, double emergencyMultiplier) {
        if (dailyRates.length != ResourceType.COUNT) {
            throw new IllegalArgumentException("Need one daily rate per resource type");
        }
        this.dailyRates = dailyRates.clone();
        this.setupCost = setupCost;
        this.overflowPenalty = overflowPenalty;
        this.emergencyMultiplier = emergencyMultiplier;
    }

    public static CostModel defaults() {
        double[] rates = new double[ResourceType.COUNT];
        for (ResourceType type : ResourceType.values()) {
            rates[type.ordinal()] = type.getDefaultDailyRate();
        }
        return new CostModel(rates, DEFAULT_SETUP_COST, DEFAULT_OVERFLOW_PENALTY, DEFAULT_EMERGENCY_MULTIPLIER);
    }

    public double directCost(int[] units, int durationHours, int hoursPerDay, boolean urgent) {
        double cost = 0.0;
        for (int r = 0; r < units.length; r++) {
            cost += this.dailyRates[r] / hoursPerDay * units[r] * durationHours;
        }
        return urgent ? cost * this.emergencyMultiplier : cost;
    }

    public double getDailyRate(ResourceType type) {
        return this.dailyRates[type.ordinal()];
    }

    public double getSetupCost() {
        return this.setupCost;
    }

    public double getOverflowPenalty() {
        return this.overflowPenalty;
    }

    public double getEmergencyMultiplier() {
        return this.emergencyMultiplier;
    }
}
