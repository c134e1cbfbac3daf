package io.vectorvault.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.vectorvault.Json;
import io.vectorvault.ReadRetry;
import io.vectorvault.VaultException;
import io.vectorvault.VectorVault;
import io.vectorvault.backup.BackupArchive;
import io.vectorvault.backup.RetentionPolicy;
import io.vectorvault.catalog.CollectionRecord;
import io.vectorvault.catalog.DashScopeEmbedding;
import io.vectorvault.catalog.EmbeddingDescriptor;
import io.vectorvault.catalog.OllamaEmbedding;
import io.vectorvault.config.ConfigContext;
import io.vectorvault.config.VaultConfig;
import io.vectorvault.consistency.ConsistencyReport;
import io.vectorvault.recovery.ProposedCollectionRecord;
import io.vectorvault.recovery.RecoveryCandidate;
import io.vectorvault.recovery.RecoveryResult;
import io.vectorvault.txn.OperationResult;
import io.vectorvault.version.CompatibilityReport;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for Vector Vault. Every command prints JSON.
 *
 * <p>Exit codes: 0 success, 1 failure, 3 check found issues.</p>
 */
@Command(
    name = "vault",
    mixinStandardHelpOptions = true,
    version = "vectorvault 1.0.0",
    description = "Keep a vector collection catalog and its on-disk collections consistent",
    subcommands = {
        VaultCli.InitCommand.class,
        VaultCli.ListCommand.class,
        VaultCli.CheckCommand.class,
        VaultCli.CreateCommand.class,
        VaultCli.DeleteCommand.class,
        VaultCli.RenameCommand.class,
        VaultCli.BackupCommand.class,
        VaultCli.RecoverCommand.class,
        VaultCli.VersionCommand.class
    }
)
public class VaultCli implements Callable<Integer> {

    static final int OK = 0;
    static final int FAILED = 1;
    static final int ISSUES_FOUND = 3;

    @Spec
    CommandSpec spec;

    @Option(names = {"-d", "--data-root"}, description = "Data root (overrides configuration)")
    Path dataRoot;

    @Option(names = {"-c", "--config"}, description = "Properties file with vectorvault.* settings")
    Path configFile;

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    /**
     * Builds the command line with JSON error reporting installed.
     */
    static CommandLine newCommandLine() {
        CommandLine cmd = new CommandLine(new VaultCli());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            Map<String, Object> error = new LinkedHashMap<>();
            if (ex instanceof VaultException) {
                VaultException ve = (VaultException) ex;
                error.put("code", ve.code());
                error.put("message", ve.getMessage());
                error.put("collectionId", ve.getCollectionId());
                error.put("phase", ve.getPhase());
                error.put("rollbackOutcome", ve.getRollbackOutcome());
            } else {
                error.put("code", ex.getClass().getSimpleName());
                error.put("message", ex.getMessage());
            }
            commandLine.getErr().println(toJson(Map.of("error", error)));
            return FAILED;
        });
        return cmd;
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return OK;
    }

    ConfigContext configContext() {
        return new ConfigContext(() -> {
            VaultConfig.Builder builder = VaultConfig.resolve(configFile);
            if (dataRoot != null) {
                builder.dataRoot(dataRoot);
            }
            return builder.build();
        });
    }

    VectorVault openVault() {
        return VectorVault.open(configContext());
    }

    void print(Object value) {
        PrintWriter out = spec.commandLine().getOut();
        out.println(toJson(value));
        out.flush();
    }

    int printResult(OperationResult result) {
        print(result);
        return result.success() ? OK : FAILED;
    }

    private static String toJson(Object value) {
        try {
            return Json.mapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render output", e);
        }
    }

    // ==================== Collections ====================

    /**
     * Create the data and backup roots.
     */
    @Command(name = "init", description = "Create the data and backup roots")
    static class InitCommand implements Callable<Integer> {

        @ParentCommand
        VaultCli root;

        @Override
        public Integer call() {
            VectorVault vault = VectorVault.initialize(root.configContext());
            root.print(vault.compatibility());
            return OK;
        }
    }

    @Command(name = "list", description = "List catalog records")
    static class ListCommand implements Callable<Integer> {

        @ParentCommand
        VaultCli root;

        @Override
        public Integer call() {
            root.print(root.openVault().list());
            return OK;
        }
    }

    /**
     * Compare the catalog with the physical collections.
     */
    @Command(name = "check", description = "Report drift between catalog and physical collections")
    static class CheckCommand implements Callable<Integer> {

        @ParentCommand
        VaultCli root;

        @Option(names = "--full", description = "Also sample vector dimensions")
        boolean full;

        @Override
        public Integer call() {
            VectorVault vault = root.openVault();
            ConsistencyReport report = vault.check(full);
            root.print(report);
            return switch (report.status()) {
                case CONSISTENT -> OK;
                case INCONSISTENT -> ISSUES_FOUND;
                case ERROR -> FAILED;
            };
        }
    }

    @Command(name = "create", description = "Create an empty collection")
    static class CreateCommand implements Callable<Integer> {

        @ParentCommand
        VaultCli root;

        @Parameters(index = "0", description = "Display name")
        String displayName;

        @Option(names = {"-p", "--provider"}, description = "Embedding provider: ollama, dashscope", defaultValue = "ollama")
        String provider;

        @Option(names = {"-m", "--model"}, description = "Embedding model name", required = true)
        String model;

        @Option(names = {"--dimension"}, description = "Vector dimension", required = true)
        int dimension;

        @Option(names = {"--base-url"}, description = "Ollama base URL")
        String baseUrl;

        @Option(names = {"--region"}, description = "DashScope region")
        String region;

        @Override
        public Integer call() {
            return root.printResult(root.openVault().create(displayName, descriptor()));
        }

        private EmbeddingDescriptor descriptor() {
            return switch (provider.toLowerCase()) {
                case "ollama" -> new OllamaEmbedding(model, dimension,
                    baseUrl != null ? baseUrl : OllamaEmbedding.DEFAULT_BASE_URL);
                case "dashscope", "qwen" -> new DashScopeEmbedding(model, dimension,
                    region != null ? region : DashScopeEmbedding.DEFAULT_REGION);
                default -> throw new ParameterException(root.spec.commandLine(),
                    "Unknown provider: " + provider + ". Use: ollama, dashscope");
            };
        }
    }

    @Command(name = "delete", description = "Delete a collection (checkpointed, rolled back on failure)")
    static class DeleteCommand implements Callable<Integer> {

        @ParentCommand
        VaultCli root;

        @Parameters(index = "0", description = "Collection id or display name")
        String collection;

        @Override
        public Integer call() {
            VectorVault vault = root.openVault();
            String id = vault.catalog().contains(collection) || vault.vectorStore().exists(collection)
                ? collection
                : vault.resolve(collection).collectionId();
            return root.printResult(vault.delete(id));
        }
    }

    @Command(name = "rename", description = "Rename a collection; it is copied under a new id")
    static class RenameCommand implements Callable<Integer> {

        @ParentCommand
        VaultCli root;

        @Parameters(index = "0", description = "Collection id or display name")
        String collection;

        @Parameters(index = "1", description = "New display name")
        String newName;

        @Override
        public Integer call() {
            VectorVault vault = root.openVault();
            CollectionRecord record = vault.resolve(collection);
            return root.printResult(vault.rename(record.collectionId(), newName));
        }
    }

    // ==================== Backups ====================

    @Command(
        name = "backup",
        description = "Create, list, restore and clean up backup archives",
        subcommands = {
            BackupCommand.Create.class,
            BackupCommand.ListArchives.class,
            BackupCommand.Restore.class,
            BackupCommand.Cleanup.class
        }
    )
    static class BackupCommand implements Callable<Integer> {

        @ParentCommand
        VaultCli root;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            spec.commandLine().usage(spec.commandLine().getOut());
            return OK;
        }

        @Command(name = "create", description = "Archive the given collections, or everything with --full")
        static class Create implements Callable<Integer> {

            @ParentCommand
            BackupCommand parent;

            @Option(names = "--full", description = "Archive every collection")
            boolean full;

            @Option(names = {"-l", "--label"}, description = "Free-text label stored in the manifest")
            String label;

            @Parameters(arity = "0..*", description = "Collection ids")
            List<String> ids = List.of();

            @Override
            public Integer call() {
                VectorVault vault = parent.root.openVault();
                if (!full && ids.isEmpty()) {
                    throw new ParameterException(parent.root.spec.commandLine(), "Give collection ids or --full");
                }
                BackupArchive archive = full ? vault.fullBackup(label) : vault.backups().checkpoint(ids, label);
                parent.root.print(archive);
                return OK;
            }
        }

        @Command(name = "list", description = "List archives, newest first")
        static class ListArchives implements Callable<Integer> {

            @ParentCommand
            BackupCommand parent;

            @Override
            public Integer call() {
                VectorVault vault = parent.root.openVault();
                parent.root.print(ReadRetry.once(vault::listBackups));
                return OK;
            }
        }

        @Command(name = "restore", description = "Put the archived collections back exactly as archived")
        static class Restore implements Callable<Integer> {

            @ParentCommand
            BackupCommand parent;

            @Parameters(index = "0", description = "Archive id")
            String backupId;

            @Override
            public Integer call() {
                VectorVault vault = parent.root.openVault();
                vault.restore(backupId);
                parent.root.print(Map.of("restored", backupId));
                return OK;
            }
        }

        @Command(name = "cleanup", description = "Apply the retention policy")
        static class Cleanup implements Callable<Integer> {

            @ParentCommand
            BackupCommand parent;

            @Option(names = "--count", description = "Keep at least this many newest archives")
            Integer count;

            @Option(names = "--days", description = "Keep every archive younger than this many days")
            Integer days;

            @Override
            public Integer call() {
                VectorVault vault = parent.root.openVault();
                VaultConfig cfg = vault.config().current();
                RetentionPolicy policy = new RetentionPolicy(
                    count != null ? count : cfg.retentionCount(),
                    days != null ? days : cfg.retentionDays());
                parent.root.print(Map.of("deleted", vault.cleanupBackups(policy)));
                return OK;
            }
        }
    }

    // ==================== Recovery ====================

    @Command(
        name = "recover",
        description = "Rebuild catalog records for orphaned collection directories",
        subcommands = {
            RecoverCommand.Scan.class,
            RecoverCommand.Plan.class,
            RecoverCommand.Execute.class,
            RecoverCommand.Prune.class
        }
    )
    static class RecoverCommand implements Callable<Integer> {

        @ParentCommand
        VaultCli root;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            spec.commandLine().usage(spec.commandLine().getOut());
            return OK;
        }

        @Command(name = "scan", description = "List orphaned directories and whether they can be recovered")
        static class Scan implements Callable<Integer> {

            @ParentCommand
            RecoverCommand parent;

            @Override
            public Integer call() {
                VectorVault vault = parent.root.openVault();
                parent.root.print(ReadRetry.once(vault::scanRecovery));
                return OK;
            }
        }

        @Command(name = "plan", description = "Show the records recovery would write")
        static class Plan implements Callable<Integer> {

            @ParentCommand
            RecoverCommand parent;

            @Override
            public Integer call() {
                VectorVault vault = parent.root.openVault();
                List<RecoveryCandidate> candidates = ReadRetry.once(vault::scanRecovery);
                parent.root.print(vault.planRecovery(candidates));
                return OK;
            }
        }

        @Command(name = "execute", description = "Write the planned records")
        static class Execute implements Callable<Integer> {

            @ParentCommand
            RecoverCommand parent;

            @Override
            public Integer call() {
                VectorVault vault = parent.root.openVault();
                List<ProposedCollectionRecord> plan = vault.planRecovery(vault.scanRecovery());
                RecoveryResult result = vault.executeRecovery(plan, () -> Thread.currentThread().isInterrupted());
                parent.root.print(result);
                return result.failed().isEmpty() ? OK : FAILED;
            }
        }

        @Command(name = "prune", description = "Remove catalog records whose directory is gone (needs allowOrphanedCatalogCleanup)")
        static class Prune implements Callable<Integer> {

            @ParentCommand
            RecoverCommand parent;

            @Override
            public Integer call() {
                VectorVault vault = parent.root.openVault();
                parent.root.print(Map.of("removed", vault.pruneOrphanedCatalogEntries()));
                return OK;
            }
        }
    }

    // ==================== Version ====================

    @Command(name = "version", description = "Show schema compatibility, or migrate with --migrate")
    static class VersionCommand implements Callable<Integer> {

        @ParentCommand
        VaultCli root;

        @Option(names = "--migrate", description = "Migrate the data root to the running schema")
        boolean migrate;

        @Override
        public Integer call() {
            VectorVault vault = root.openVault();
            if (migrate) {
                root.print(vault.migrate());
                return OK;
            }
            CompatibilityReport report = vault.compatibility();
            root.print(report);
            return report.compatible() ? OK : FAILED;
        }
    }
}
