package testlab.master.model;

/**
 * Job priority tiers. Higher {@link #weight()} is scheduled first.
 */
public enum JobPriority {
    HIGH(100),
    MEDIUM(50),
    LOW(0);

    private final int weight;

    JobPriority(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    public static JobPriority fromWeight(int weight) {
        for (JobPriority p : values()) {
            if (p.weight == weight) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown priority weight: " + weight);
    }

    /** Parse case-insensitively, defaulting to MEDIUM for null/blank. */
    public static JobPriority parse(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        return valueOf(value.trim().toUpperCase());
    }
}
