package io.vectorvault.recovery;

import java.util.List;

/**
 * Outcome of a recovery run. Records that succeeded stay written even when others failed.
 */
public record RecoveryResult(List<String> succeeded, List<Failure> failed, List<String> cancelled) {

    public RecoveryResult {
        succeeded = List.copyOf(succeeded);
        failed = List.copyOf(failed);
        cancelled = List.copyOf(cancelled);
    }

    public boolean isComplete() {
        return failed.isEmpty() && cancelled.isEmpty();
    }

    public record Failure(String collectionId, String reason) {}
}
