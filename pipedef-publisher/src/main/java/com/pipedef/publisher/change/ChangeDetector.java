package com.pipedef.publisher.change;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * Fingerprints target files before and after a publish. Byte-level only: output that is equivalent but
 * formatted differently counts as a change.
 */
public final class ChangeDetector {

    private static final String ALGORITHM = "SHA-256";
    private static final int BUFFER_SIZE = 8192;

    /**
     * Fingerprint of the file at {@code path}; {@link ContentFingerprint#absent()} when there is no file.
     *
     * @throws UncheckedIOException when an existing file cannot be read
     */
    public ContentFingerprint fingerprint(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            return ContentFingerprint.absent();
        }
        MessageDigest digest = newDigest();
        try (InputStream in = Files.newInputStream(path)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int n;
            while ((n = in.read(buffer)) != -1) {
                digest.update(buffer, 0, n);
            }
        } catch (NoSuchFileException e) {
            // deleted between the existence check and the read
            return ContentFingerprint.absent();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
        return ContentFingerprint.of(digest.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
