package io.vectorvault.version;

import io.vectorvault.Fixtures;
import io.vectorvault.IncompatibleVersionException;
import io.vectorvault.Json;
import io.vectorvault.StorageUnavailableException;
import io.vectorvault.catalog.CollectionRecord;
import io.vectorvault.catalog.JsonCatalogStore;
import io.vectorvault.catalog.OllamaEmbedding;
import io.vectorvault.config.ConfigContext;
import io.vectorvault.config.VaultConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SchemaVersion parsing and SchemaVersionChecker compatibility rules.
 */
class SchemaVersionCheckerTest {

    @TempDir
    Path tempDir;

    private Path dataRoot;
    private JsonCatalogStore catalog;

    @BeforeEach
    void setUp() throws IOException {
        dataRoot = Files.createDirectories(tempDir.resolve("data"));
        catalog = JsonCatalogStore.inDataRoot(dataRoot, "1.1.0");
    }

    // ==================== SchemaVersion ====================

    @Test
    void testParse() {
        assertEquals(new SchemaVersion(1, 2, 3), SchemaVersion.parse("1.2.3"));
        assertEquals(new SchemaVersion(2, 0, 0), SchemaVersion.parse(" 2.0 "));
        assertThrows(IllegalArgumentException.class, () -> SchemaVersion.parse("v1"));
        assertThrows(IllegalArgumentException.class, () -> SchemaVersion.parse(null));
    }

    @Test
    void testOrdering() {
        assertTrue(SchemaVersion.parse("1.10.0").compareTo(SchemaVersion.parse("1.9.9")) > 0);
        assertTrue(SchemaVersion.parse("2.0.0").compareTo(SchemaVersion.parse("1.99.0")) > 0);
        assertEquals(0, SchemaVersion.parse("1.1").compareTo(SchemaVersion.parse("1.1.0")));
    }

    // ==================== Checker ====================

    @Test
    void testFreshDataRootIsStamped() {
        SchemaVersionChecker checker = checker(false);

        CompatibilityReport report = checker.check();

        assertTrue(report.compatible());
        assertFalse(report.migrationNeeded());
        assertEquals(SchemaVersion.CURRENT.toString(), report.persistedVersion());
        assertTrue(Files.exists(dataRoot.resolve(SchemaVersionChecker.FILE_NAME)));
    }

    @Test
    void testMissingDataRootIsNotStamped() {
        Path missing = tempDir.resolve("unmounted");
        SchemaVersionChecker checker = new SchemaVersionChecker(missing,
            JsonCatalogStore.inDataRoot(missing, "1.1.0"), SchemaVersion.CURRENT, context(false));

        assertThrows(StorageUnavailableException.class, checker::check);
        assertFalse(Files.exists(missing));
    }

    @Test
    void testOlderMinorNeedsMigrationButAllowsWrites() throws IOException {
        persist("1.0.0");
        SchemaVersionChecker checker = checker(false);

        CompatibilityReport report = checker.check();

        assertTrue(report.compatible());
        assertTrue(report.migrationNeeded());
        assertEquals(1, report.issues().size());
        assertDoesNotThrow(checker::requireMutable);
    }

    @Test
    void testNewerVersionBlocksWrites() throws IOException {
        persist("1.5.0");
        SchemaVersionChecker checker = checker(false);

        CompatibilityReport report = checker.check();

        assertFalse(report.compatible());
        assertFalse(report.migrationNeeded());
        IncompatibleVersionException e = assertThrows(IncompatibleVersionException.class, checker::requireMutable);
        assertEquals("1.5.0", e.getPersistedVersion());
        assertEquals(SchemaVersion.CURRENT.toString(), e.getRunningVersion());
    }

    @Test
    void testMajorChangeIsIncompatible() throws IOException {
        persist("0.9.0");

        CompatibilityReport report = checker(false).check();

        assertFalse(report.compatible());
        assertTrue(report.migrationNeeded());
    }

    @Test
    void testUnreadableVersionIsIncompatible() throws IOException {
        persist("not-a-version");

        CompatibilityReport report = checker(false).check();

        assertFalse(report.compatible());
        assertFalse(report.allowsMutation());
    }

    @Test
    void testOperatorOverride() throws IOException {
        persist("2.0.0");
        SchemaVersionChecker checker = checker(true);

        CompatibilityReport report = checker.check();

        assertFalse(report.compatible());
        assertTrue(report.overridden());
        assertDoesNotThrow(checker::requireMutable);
    }

    @Test
    void testFallsBackToCatalogVersion() {
        JsonCatalogStore legacy = JsonCatalogStore.inDataRoot(dataRoot, "1.0.0");
        legacy.put(CollectionRecord.create("c1", "docs", OllamaEmbedding.of("m", 8), Instant.now()));
        SchemaVersionChecker checker = new SchemaVersionChecker(dataRoot, legacy, SchemaVersion.CURRENT, context(false));

        assertEquals("1.0.0", checker.persistedVersion());
        assertTrue(checker.check().migrationNeeded());
        assertFalse(Files.exists(dataRoot.resolve(SchemaVersionChecker.FILE_NAME)));
    }

    private void persist(String version) throws IOException {
        Json.mapper().writeValue(dataRoot.resolve(SchemaVersionChecker.FILE_NAME).toFile(),
            new VersionInfo(version, SchemaVersionChecker.ENGINE_VERSION, List.of()));
    }

    private SchemaVersionChecker checker(boolean allowIncompatible) {
        return new SchemaVersionChecker(dataRoot, catalog, SchemaVersion.CURRENT, context(allowIncompatible));
    }

    private ConfigContext context(boolean allowIncompatible) {
        VaultConfig base = Fixtures.config(tempDir);
        return ConfigContext.of(VaultConfig.builder()
            .dataRoot(base.dataRoot())
            .backupRoot(base.backupRoot())
            .allowIncompatibleSchema(allowIncompatible)
            .build());
    }
}
