package org.dandiarchive.archive.util;

import java.util.regex.Pattern;

/**
 * S3 entity tags as reported for single-part ({@code md5}) and multipart
 * ({@code md5-partCount}) uploads.
 */
public final class Etag {

    private static final Pattern ETAG_PATTERN = Pattern.compile("^[0-9a-f]{32}(-[1-9][0-9]*)?$");

    private Etag() {
    }

    public static boolean isValid(String etag) {
        return etag != null && ETAG_PATTERN.matcher(etag).matches();
    }

    public static String requireValid(String etag) {
        if (!isValid(etag)) {
            throw new IllegalArgumentException("Invalid etag: " + etag);
        }
        return etag;
    }
}
