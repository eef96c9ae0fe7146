package seakers.micscheduler.model;

import java.util.Locale;

public enum SystemCategory {
    STRUCT("Struct"),
    ELEC("Elec"),
    PLUMB("Plumb"),
    HVAC("HVAC"),
    FACADE("Facade");

    private final String label;

    SystemCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return this.label;
    }

    /**
     * Resolves a system label as written in the task template ("Struct", "Elec", ...) or an enum name
     */
    public static SystemCategory fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("System label is missing");
        }
        String trimmed = label.trim();
        for (SystemCategory category : values()) {
            if (category.label.equalsIgnoreCase(trimmed) || category.name().equalsIgnoreCase(trimmed)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown system category: " + label.toUpperCase(Locale.ROOT));
    }
}
