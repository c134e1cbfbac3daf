package io.vectorvault;

import java.util.List;

/**
 * Exception thrown when the post-operation verification finds the catalog and the
 * physical store disagreeing. Raising it triggers a rollback.
 */
public class IntegrityException extends VaultException {

    private final List<String> problems;

    public IntegrityException(String collectionId, List<String> problems) {
        super(String.format("Integrity check failed for '%s': %s", collectionId, problems), collectionId);
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }

    @Override
    public String code() {
        return "INTEGRITY";
    }
}
