package io.vectorvault.version;

import java.util.List;

/**
 * Outcome of comparing the persisted schema version with the running one.
 */
public record CompatibilityReport(
    boolean compatible,
    boolean migrationNeeded,
    String persistedVersion,
    String runningVersion,
    List<String> issues,

    /** Mutations are allowed despite {@code compatible == false} because an operator said so */
    boolean overridden
) {
    public CompatibilityReport {
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public boolean allowsMutation() {
        return compatible || overridden;
    }
}
