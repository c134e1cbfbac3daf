package io.vectorvault.store;

import io.vectorvault.catalog.CollectionIds;
import io.vectorvault.engine.HnswCollection;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Rules for recognizing physical collection directories under the data root.
 */
public final class PhysicalLayout {

    static final List<String> ENGINE_FILES = List.of(
        HnswCollection.HEADER_FILE,
        HnswCollection.VECTORS_FILE,
        HnswCollection.ITEMS_FILE,
        HnswCollection.GRAPH_FILE
    );

    /** Suffix of a directory renamed out of sight before its recursive delete */
    public static final String DROPPING_SUFFIX = ".dropping";

    /** Suffix of an archived directory staged next to the one it replaces */
    public static final String RESTORING_SUFFIX = ".restoring";

    private PhysicalLayout() {
    }

    /**
     * A directory belongs to the vector engine if it is named like a collection id and holds
     * at least one engine file. Complete or not, such a directory is a physical collection.
     */
    public static boolean isCollectionDirectory(Path dir) {
        String name = dir.getFileName().toString();
        if (!Files.isDirectory(dir) || name.startsWith(".") || !CollectionIds.isValid(name)) {
            return false;
        }
        return ENGINE_FILES.stream().anyMatch(f -> Files.exists(dir.resolve(f)));
    }

    /**
     * A directory is intact when both the header and the vector file are present.
     */
    public static boolean isComplete(Path dir) {
        return Files.isRegularFile(dir.resolve(HnswCollection.HEADER_FILE))
            && Files.isRegularFile(dir.resolve(HnswCollection.VECTORS_FILE));
    }

    /**
     * Whether {@code dir} is a hidden directory left by an interrupted drop or restore.
     */
    public static boolean isLeftover(Path dir) {
        String name = dir.getFileName().toString();
        if (!name.startsWith(".") || !Files.isDirectory(dir)) {
            return false;
        }
        for (String suffix : List.of(DROPPING_SUFFIX, RESTORING_SUFFIX)) {
            if (name.endsWith(suffix)) {
                return CollectionIds.isValid(name.substring(1, name.length() - suffix.length()));
            }
        }
        return false;
    }
}
