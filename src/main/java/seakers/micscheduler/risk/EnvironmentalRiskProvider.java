package seakers.micscheduler.risk;

import seakers.micscheduler.model.SystemCategory;

import java.time.Month;

/**
 * Boundary to the environmental-risk lookup: the factor by which working on a system in a given month scales task risk
 */
public interface EnvironmentalRiskProvider {

    double riskMultiplier(Month month, SystemCategory system);
}
