package io.vectorvault.backup;

/**
 * Which archives survive a cleanup: the {@code retentionCount} newest, plus everything
 * younger than {@code retentionDays}. Only archives matching neither rule are deleted.
 */
public record RetentionPolicy(int retentionCount, int retentionDays) {

    public RetentionPolicy {
        if (retentionCount < 0) throw new IllegalArgumentException("retentionCount must be >= 0");
        if (retentionDays < 0) throw new IllegalArgumentException("retentionDays must be >= 0");
    }

    public static RetentionPolicy defaultPolicy() {
        return new RetentionPolicy(10, 30);
    }
}
