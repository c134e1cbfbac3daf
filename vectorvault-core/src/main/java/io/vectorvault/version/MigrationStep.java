package io.vectorvault.version;

/**
 * Upgrades a data root from one schema version to the next.
 */
@FunctionalInterface
public interface MigrationStep {

    void apply();
}
