package io.vectorvault.version;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A {@code major.minor.patch} schema version.
 */
public record SchemaVersion(int major, int minor, int patch) implements Comparable<SchemaVersion> {

    /** Schema version written by this build */
    public static final SchemaVersion CURRENT = new SchemaVersion(1, 1, 0);

    private static final Pattern FORMAT = Pattern.compile("(\\d+)\\.(\\d+)(?:\\.(\\d+))?");

    public SchemaVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Version parts must be >= 0");
        }
    }

    /**
     * @throws IllegalArgumentException if {@code text} is not {@code major.minor[.patch]}
     */
    public static SchemaVersion parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Version cannot be null");
        }
        Matcher m = FORMAT.matcher(text.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid schema version: '" + text + "'");
        }
        int patch = m.group(3) != null ? Integer.parseInt(m.group(3)) : 0;
        return new SchemaVersion(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), patch);
    }

    @Override
    public int compareTo(SchemaVersion other) {
        int c = Integer.compare(major, other.major);
        if (c != 0) return c;
        c = Integer.compare(minor, other.minor);
        if (c != 0) return c;
        return Integer.compare(patch, other.patch);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
