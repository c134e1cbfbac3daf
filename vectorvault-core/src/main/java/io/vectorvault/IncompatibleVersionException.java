package io.vectorvault;

/**
 * Exception thrown when a mutating operation is attempted against a data root whose
 * persisted schema version is not compatible with the running version.
 */
public class IncompatibleVersionException extends VaultException {

    private final String persistedVersion;
    private final String runningVersion;

    public IncompatibleVersionException(String persistedVersion, String runningVersion) {
        super(String.format(
            "Persisted schema version '%s' is not compatible with running version '%s'; migrate or override first",
            persistedVersion, runningVersion
        ), null);
        this.persistedVersion = persistedVersion;
        this.runningVersion = runningVersion;
    }

    public String getPersistedVersion() {
        return persistedVersion;
    }

    public String getRunningVersion() {
        return runningVersion;
    }

    @Override
    public String code() {
        return "INCOMPATIBLE_VERSION";
    }
}
