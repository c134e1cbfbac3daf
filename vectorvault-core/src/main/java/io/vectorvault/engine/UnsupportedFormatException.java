package io.vectorvault.engine;

import java.nio.file.Path;

/**
 * Thrown when a collection header was written in a format version this build cannot read.
 */
public class UnsupportedFormatException extends RuntimeException {

    private final Path headerFile;
    private final int foundVersion;
    private final int supportedVersion;

    public UnsupportedFormatException(Path headerFile, int foundVersion, int supportedVersion) {
        super(String.format("%s has collection format version %d; this build reads version %d",
            headerFile, foundVersion, supportedVersion));
        this.headerFile = headerFile;
        this.foundVersion = foundVersion;
        this.supportedVersion = supportedVersion;
    }

    public Path getHeaderFile() {
        return headerFile;
    }

    public int getFoundVersion() {
        return foundVersion;
    }

    public int getSupportedVersion() {
        return supportedVersion;
    }
}
