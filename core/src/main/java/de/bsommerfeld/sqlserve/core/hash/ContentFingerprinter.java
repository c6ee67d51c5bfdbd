package de.bsommerfeld.sqlserve.core.hash;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 over a file's full content, read in fixed-size blocks so memory use
 * does not grow with the file. The digest depends only on the bytes, not on
 * the block size.
 */
public final class ContentFingerprinter {

    private static final String ALGORITHM = "SHA-256";

    private final int blockSize;

    public ContentFingerprinter(int blockSize) {
        if (blockSize <= 0)
            throw new IllegalArgumentException("blockSize must be positive: " + blockSize);
        this.blockSize = blockSize;
    }

    /**
     * Returns the lowercase hex digest of {@code file}.
     *
     * @throws IOException if the file cannot be read
     */
    public String fingerprint(Path file) throws IOException {
        MessageDigest digest = newDigest();
        try (InputStream in = Files.newInputStream(file)) {
            byte[] block = new byte[blockSize];
            int read;
            while ((read = in.readNBytes(block, 0, blockSize)) > 0) {
                digest.update(block, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // every JVM ships SHA-256
            throw new AssertionError(ALGORITHM + " not available", e);
        }
    }
}
