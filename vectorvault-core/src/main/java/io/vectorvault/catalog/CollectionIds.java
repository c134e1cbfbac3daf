package io.vectorvault.catalog;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Collection id rules. Ids name directories on disk, so they are restricted to a
 * filesystem-safe alphabet; display names carry everything else.
 */
public final class CollectionIds {

    private static final Pattern VALID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

    private CollectionIds() {
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    public static boolean isValid(String id) {
        return id != null && VALID.matcher(id).matches();
    }

    public static String requireValid(String id) {
        if (!isValid(id)) {
            throw new IllegalArgumentException("Invalid collection id: '" + id + "'");
        }
        return id;
    }
}
