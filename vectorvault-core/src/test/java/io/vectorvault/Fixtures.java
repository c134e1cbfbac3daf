package io.vectorvault;

import io.vectorvault.config.ConfigContext;
import io.vectorvault.config.VaultConfig;
import io.vectorvault.engine.VectorItem;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Shared builders for vault tests.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static VaultConfig config(Path tempDir) {
        return VaultConfig.builder()
            .dataRoot(tempDir.resolve("data"))
            .backupRoot(tempDir.resolve("backups"))
            .build();
    }

    public static VectorVault vault(Path tempDir, MutableClock clock) {
        return VectorVault.initialize(ConfigContext.of(config(tempDir)), clock);
    }

    public static float[] randomVector(Random random, int dimension) {
        float[] v = new float[dimension];
        for (int i = 0; i < dimension; i++) {
            v[i] = random.nextFloat() * 2 - 1;
        }
        return v;
    }

    public static List<VectorItem> items(Random random, int count, int dimension) {
        List<VectorItem> items = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            items.add(new VectorItem("item-" + i, randomVector(random, dimension),
                "document " + i, Map.of("n", Integer.toString(i))));
        }
        return items;
    }
}
