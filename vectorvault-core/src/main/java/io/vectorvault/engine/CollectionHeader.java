package io.vectorvault.engine;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Fixed-layout header of a physical collection ({@code header.bin}).
 *
 * <p>The header is small and self-describing so the dimension and item count of a
 * collection can be read without loading its vectors or graph.</p>
 */
public record CollectionHeader(
    int formatVersion,
    int dimension,
    int itemCount,
    long modelHash,
    String modelId
) {
    private static final byte[] MAGIC = "VVCH".getBytes(StandardCharsets.US_ASCII);
    public static final short FORMAT_VERSION = 1;

    public static CollectionHeader of(String modelId, int dimension, int itemCount) {
        return new CollectionHeader(FORMAT_VERSION, dimension, itemCount, modelId.hashCode(), modelId);
    }

    public void write(Path file) throws IOException {
        try (OutputStream os = Files.newOutputStream(file)) {
            DataOutputStream dos = new DataOutputStream(new BufferedOutputStream(os));
            dos.write(MAGIC);
            dos.writeShort(formatVersion);
            dos.writeInt(dimension);
            dos.writeInt(itemCount);
            dos.writeLong(modelHash);
            dos.writeUTF(modelId);
            dos.flush();
        }
    }

    public static CollectionHeader read(Path file) throws IOException {
        try (InputStream is = Files.newInputStream(file)) {
            DataInputStream dis = new DataInputStream(new BufferedInputStream(is));

            byte[] magic = new byte[MAGIC.length];
            dis.readFully(magic);
            if (!Arrays.equals(magic, MAGIC)) {
                throw new IOException("Invalid collection header: bad magic number in " + file);
            }

            short version = dis.readShort();
            if (version != FORMAT_VERSION) {
                throw new UnsupportedFormatException(file, version, FORMAT_VERSION);
            }

            int dimension = dis.readInt();
            int itemCount = dis.readInt();
            long modelHash = dis.readLong();
            String modelId = dis.readUTF();

            if (dimension <= 0 || itemCount < 0) {
                throw new IOException(String.format(
                    "Corrupt collection header in %s: dimension=%d, itemCount=%d", file, dimension, itemCount));
            }
            return new CollectionHeader(version, dimension, itemCount, modelHash, modelId);
        }
    }
}
