package seakers.micscheduler.model;

public enum ResourceType {
    SKILLED("Skilled Labor", 10, 1200.0),
    SEMI_SKILLED("Semi-skilled Labor", 15, 800.0),
    UNSKILLED("Unskilled Labor", 30, 500.0),
    CRANE("Crane", 2, 3000.0),
    TESTING("Testing Equipment", 5, 1500.0),
    SPECIALIZED("Specialized Tools", 5, 1000.0);

    /**
     * Number of resource dimensions in every demand and capacity vector
     */
    public static final int COUNT = values().length;

    private final String label;
    private final int defaultCapacity;
    private final double defaultDailyRate;

    ResourceType(String label, int defaultCapacity, double defaultDailyRate) {
        this.label = label;
        this.defaultCapacity = defaultCapacity;
        this.defaultDailyRate = defaultDailyRate;
    }

    public String getLabel() {
        return this.label;
    }

    public int getDefaultCapacity() {
        return this.defaultCapacity;
    }

    public double getDefaultDailyRate() {
        return this.defaultDailyRate;
    }
}
