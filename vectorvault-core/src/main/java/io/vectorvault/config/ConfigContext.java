package io.vectorvault.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Holds the configuration a vault runs with and knows how to load it again.
 *
 * <p>Passed explicitly to whatever needs it. Policy values (retention, cleanup flags, the
 * schema override) are read through {@link #current()} at call time, so a {@link #reload()}
 * applies to the next operation. The data and backup roots are fixed for the lifetime of
 * a context.</p>
 */
public class ConfigContext {

    private static final Logger log = LoggerFactory.getLogger(ConfigContext.class);

    private final Supplier<VaultConfig> source;
    private final AtomicReference<VaultConfig> current;

    public ConfigContext(Supplier<VaultConfig> source) {
        this.source = source;
        this.current = new AtomicReference<>(Objects.requireNonNull(source.get(), "source returned null"));
    }

    /**
     * A context that always reloads to the same value.
     */
    public static ConfigContext of(VaultConfig config) {
        return new ConfigContext(() -> config);
    }

    /**
     * A context backed by a properties file plus system properties and environment.
     */
    public static ConfigContext fromFile(Path propertiesFile) {
        return new ConfigContext(() -> VaultConfig.resolve(propertiesFile).build());
    }

    public VaultConfig current() {
        return current.get();
    }

    /**
     * Loads the configuration again from its source.
     *
     * @throws IllegalStateException if the reloaded configuration moves the data or backup root
     */
    public VaultConfig reload() {
        VaultConfig previous = current.get();
        VaultConfig next = source.get();
        if (!previous.dataRoot().equals(next.dataRoot()) || !previous.backupRoot().equals(next.backupRoot())) {
            throw new IllegalStateException("dataRoot and backupRoot cannot change on reload; open a new vault instead");
        }
        current.set(next);
        if (!previous.equals(next)) {
            log.info("Configuration reloaded: {}", next);
        }
        return next;
    }
}
