package org.dandiarchive.archive.util;

import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A SHA-256 content digest (32 bytes).
 * Immutable value object that can be used as a map key.
 *
 * <p>The canonical text form is 64 lowercase hex characters, which is what
 * asset blobs and upload validations store.
 */
public record Sha256Digest(byte[] bytes) {
    private static final int DIGEST_LENGTH = 32;
    private static final Pattern HEX_PATTERN = Pattern.compile("^[0-9a-f]{64}$");
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public Sha256Digest {
        Objects.requireNonNull(bytes, "digest bytes cannot be null");
        if (bytes.length != DIGEST_LENGTH) {
            throw new IllegalArgumentException(
                "SHA-256 digest must be 32 bytes, got: " + bytes.length
            );
        }
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Returns true if {@code hex} is a well-formed lowercase SHA-256 hex string.
     */
    public static boolean isValidHex(String hex) {
        return hex != null && HEX_PATTERN.matcher(hex).matches();
    }

    /**
     * Parses a 64-character lowercase hex string.
     */
    public static Sha256Digest fromHex(String hex) {
        Objects.requireNonNull(hex, "hex string cannot be null");
        if (!isValidHex(hex)) {
            throw new IllegalArgumentException(
                "SHA-256 hex string must be 64 lowercase hex characters, got: " + hex
            );
        }
        return new Sha256Digest(HEX_FORMAT.parseHex(hex));
    }

    /**
     * Digests a byte array.
     */
    public static Sha256Digest of(byte[] data) {
        MessageDigest md = newMessageDigest();
        md.update(data);
        return new Sha256Digest(md.digest());
    }

    /**
     * Digests a stream until EOF. The stream is not closed.
     */
    public static Sha256Digest of(InputStream in) throws IOException {
        MessageDigest md = newMessageDigest();
        byte[] buf = new byte[8192];
        int n;
        while ((n = in.read(buf)) != -1) {
            md.update(buf, 0, n);
        }
        return new Sha256Digest(md.digest());
    }

    public String toHex() {
        return HEX_FORMAT.formatHex(bytes);
    }

    private static MessageDigest newMessageDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Sha256Digest other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
