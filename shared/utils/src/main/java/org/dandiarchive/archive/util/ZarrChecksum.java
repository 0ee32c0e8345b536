package org.dandiarchive.archive.util;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Aggregate checksum of a zarr archive's file tree.
 *
 * <p>String format: {@code {md5hex32}-{fileCount}--{totalSize}}, e.g.
 * {@code 4313ab36412db2981c3ed391b38604d6-5--1516}.
 */
public record ZarrChecksum(String md5, long fileCount, long totalSize) {

    private static final Pattern MD5_PATTERN = Pattern.compile("^[0-9a-f]{32}$");

    public ZarrChecksum {
        Objects.requireNonNull(md5, "md5 cannot be null");
        if (!MD5_PATTERN.matcher(md5).matches()) {
            throw new IllegalArgumentException("md5 must be 32 lowercase hex characters, got: " + md5);
        }
        if (fileCount < 0) {
            throw new IllegalArgumentException("fileCount must be >= 0, got: " + fileCount);
        }
        if (totalSize < 0) {
            throw new IllegalArgumentException("totalSize must be >= 0, got: " + totalSize);
        }
    }

    /**
     * Parses the string form back into a ZarrChecksum.
     *
     * @param value format: {@code {md5}-{count}--{size}}
     * @throws IllegalArgumentException if the format is invalid
     */
    public static ZarrChecksum parse(String value) {
        Objects.requireNonNull(value, "value cannot be null");

        int sizeSep = value.indexOf("--");
        if (sizeSep < 0) {
            throw new IllegalArgumentException("Invalid zarr checksum (no '--' separator): " + value);
        }
        String head = value.substring(0, sizeSep);
        String sizePart = value.substring(sizeSep + 2);

        int countSep = head.indexOf('-');
        if (countSep < 0) {
            throw new IllegalArgumentException("Invalid zarr checksum (no '-' separator): " + value);
        }

        try {
            return new ZarrChecksum(
                    head.substring(0, countSep),
                    Long.parseLong(head.substring(countSep + 1)),
                    Long.parseLong(sizePart));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid zarr checksum (bad number): " + value, e);
        }
    }

    @Override
    public String toString() {
        return md5 + "-" + fileCount + "--" + totalSize;
    }
}
