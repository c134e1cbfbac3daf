package io.vectorvault.consistency;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Result of a consistency check.
 */
public record ConsistencyReport(
    ConsistencyStatus status,

    List<ConsistencyIssue> issues,

    Instant generatedAt,

    /** Why the scan failed; only set when status is ERROR */
    String error
) {
    public ConsistencyReport {
        Objects.requireNonNull(status, "status cannot be null");
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public static ConsistencyReport of(List<ConsistencyIssue> issues, Instant now) {
        ConsistencyStatus status = issues.isEmpty() ? ConsistencyStatus.CONSISTENT : ConsistencyStatus.INCONSISTENT;
        return new ConsistencyReport(status, issues, now, null);
    }

    public static ConsistencyReport failed(String error, Instant now) {
        return new ConsistencyReport(ConsistencyStatus.ERROR, List.of(), now, error);
    }

    public boolean isConsistent() {
        return status == ConsistencyStatus.CONSISTENT;
    }

    public List<ConsistencyIssue> issuesFor(String collectionId) {
        return issues.stream()
            .filter(i -> i.collectionId().equals(collectionId))
            .collect(Collectors.toList());
    }

    public <T extends ConsistencyIssue> List<T> issuesOfType(Class<T> type) {
        return issues.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}
