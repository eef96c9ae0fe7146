package seakers.micscheduler.risk;

import seakers.micscheduler.model.SystemCategory;

import java.time.Month;
import java.util.EnumMap;
import java.util.Map;

/**
 * Month-by-system risk multipliers. The default table follows Hong Kong typhoon seasonality:
 * multiplier = 1 + typhoonLevel(month) x exposure(system), so exposed trades are penalised most in July-September.
 */
public class MonthlyRiskTable implements EnvironmentalRiskProvider {

    private static final double[] TYPHOON_PROBABILITY = {0.01, 0.01, 0.02, 0.05, 0.15, 0.30, 0.50, 0.60, 0.40, 0.20, 0.05, 0.01};
    private static final int[] TYPHOON_LEVEL = {0, 0, 0, 1, 2, 3, 4, 5, 3, 2, 1, 0};

    private final Map<Month, Map<SystemCategory, Double>> multipliers;

    public MonthlyRiskTable(Map<Month, Map<SystemCategory, Double>> multipliers) {
        this.multipliers = new EnumMap<>(Month.class);
        for (Map.Entry<Month, Map<SystemCategory, Double>> entry : multipliers.entrySet()) {
            this.multipliers.put(entry.getKey(), new EnumMap<>(entry.getValue()));
        }
    }

    public static MonthlyRiskTable hongKongDefault() {
        Map<Month, Map<SystemCategory, Double>> table = new EnumMap<>(Month.class);
        for (Month month : Month.values()) {
            Map<SystemCategory, Double> row = new EnumMap<>(SystemCategory.class);
            for (SystemCategory system : SystemCategory.values()) {
                row.put(system, 1.0 + TYPHOON_LEVEL[month.ordinal()] * exposure(system));
            }
            table.put(month, row);
        }
        return new MonthlyRiskTable(table);
    }

    /**
     * Share of a system's work carried out exposed to the weather
     */
    public static double exposure(SystemCategory system) {
        switch (system) {
            case STRUCT:
            case FACADE:
                return 1.0;
            case HVAC:
                return 0.6;
            case ELEC:
                return 0.4;
            case PLUMB:
                return 0.3;
            default:
                return 1.0;
        }
    }

    public static double typhoonProbability(Month month) {
        return TYPHOON_PROBABILITY[month.ordinal()];
    }

    @Override
    public double riskMultiplier(Month month, SystemCategory system) {
        Map<SystemCategory, Double> row = this.multipliers.get(month);
        if (row == null) {
            return 1.0;
        }
        Double multiplier = row.get(system);
        return multiplier == null ? 1.0 : multiplier;
    }
}
