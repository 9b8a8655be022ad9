package com.eainde.breakdown.job;

/**
 * Queue priority. Higher weight is dequeued first.
 */
public enum JobPriority {
    LOW(1),
    NORMAL(2),
    HIGH(3),
    URGENT(4),
    CRITICAL(5);

    private final int weight;

    JobPriority(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    /**
     * @throws IllegalArgumentException outside 1..5
     */
    public static JobPriority fromWeight(int weight) {
        for (JobPriority priority : values()) {
            if (priority.weight == weight) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Priority weight must be between 1 and 5, got " + weight);
    }
}
