package seakers.micscheduler.model;

import java.util.Collection;

/**
 * Converts Risk Priority Numbers (severity x occurrence x detection) into the 1-10 criticality scale
 */
public final class CriticalityScale {

    public static final int MIN = 1;
    public static final int MAX = 10;
    public static final int FALLBACK = 5;

    private CriticalityScale() {
    }

    public static int fromRpn(int severity, int occurrence, int detection) {
        if (severity < 0 || occurrence < 0 || detection < 0) {
            throw new IllegalArgumentException("RPN factors must be non-negative: S=" + severity + ", O=" + occurrence + ", D=" + detection);
        }
        return clamp((severity * occurrence * detection) / 100);
    }

    /**
     * Default for tasks whose RPN triple is missing: the rounded mean of the known criticalities,
     * or {@link #FALLBACK} if none are known
     */
    public static int projectDefault(Collection<Integer> knownCriticalities) {
        if (knownCriticalities == null || knownCriticalities.isEmpty()) {
            return FALLBACK;
        }
        double sum = 0.0;
        for (int criticality : knownCriticalities) {
            sum += criticality;
        }
        return clamp((int) Math.round(sum / knownCriticalities.size()));
    }

    public static int clamp(int criticality) {
        return Math.max(MIN, Math.min(MAX, criticality));
    }
}
