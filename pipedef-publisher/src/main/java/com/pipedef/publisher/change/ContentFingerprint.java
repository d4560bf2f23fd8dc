package com.pipedef.publisher.change;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Digest of a file's bytes, or {@link #absent()} when the file does not exist. Absent always means the
 * definition has never been published to that path.
 */
public final class ContentFingerprint {

    private static final ContentFingerprint ABSENT = new ContentFingerprint(null);

    private final byte[] digest;

    private ContentFingerprint(byte[] digest) {
        this.digest = digest;
    }

    public static ContentFingerprint absent() {
        return ABSENT;
    }

    public static ContentFingerprint of(byte[] digest) {
        Objects.requireNonNull(digest, "digest");
        return new ContentFingerprint(digest.clone());
    }

    public boolean isAbsent() {
        return digest == null;
    }

    /** Lower-case hex digest, or {@code "absent"}. */
    public String toHex() {
        return digest == null ? "absent" : HexFormat.of().formatHex(digest);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContentFingerprint)) return false;
        return Arrays.equals(digest, ((ContentFingerprint) o).digest);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(digest);
    }

    @Override
    public String toString() {
        return "ContentFingerprint{" + toHex() + "}";
    }
}
