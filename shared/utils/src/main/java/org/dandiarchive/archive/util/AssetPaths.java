package org.dandiarchive.archive.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Path rules for asset paths and path-index prefixes.
 *
 * <p>Asset paths are forward-slash separated, relative, and may not contain
 * empty segments, {@code .} or {@code ..} segments, or control characters.
 * Directory prefixes are either the empty string (root) or end with {@code /}.
 */
public final class AssetPaths {

    public static final char SEPARATOR = '/';

    private AssetPaths() {
    }

    /**
     * Returns true if {@code path} is a safe asset path.
     */
    public static boolean isValid(String path) {
        if (path == null || path.isEmpty()) {
            return false;
        }
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c < 0x20 || c == 0x7f) {
                return false;
            }
        }
        for (String segment : path.split("/", -1)) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns true if {@code prefix} names a directory: root ({@code ""}) or a
     * valid path followed by a single trailing separator.
     */
    public static boolean isDirectoryPrefix(String prefix) {
        if (prefix == null) {
            return false;
        }
        if (prefix.isEmpty()) {
            return true;
        }
        return prefix.charAt(prefix.length() - 1) == SEPARATOR
                && isValid(prefix.substring(0, prefix.length() - 1));
    }

    /**
     * Directory prefixes that contain {@code path}, outermost first.
     * {@code "a/b/c.nwb"} yields {@code ["a/", "a/b/"]}; root is not included.
     */
    public static List<String> ancestors(String path) {
        List<String> result = new ArrayList<>();
        int idx = path.indexOf(SEPARATOR);
        while (idx >= 0) {
            result.add(path.substring(0, idx + 1));
            idx = path.indexOf(SEPARATOR, idx + 1);
        }
        return result;
    }

    /**
     * The directory prefix directly containing {@code nodePath}. Works for both
     * leaves ({@code "a/b.nwb"} → {@code "a/"}) and directories
     * ({@code "a/b/"} → {@code "a/"}). Top-level nodes return {@code ""}.
     */
    public static String parentOf(String nodePath) {
        String trimmed = nodePath.endsWith("/")
                ? nodePath.substring(0, nodePath.length() - 1)
                : nodePath;
        int idx = trimmed.lastIndexOf(SEPARATOR);
        return idx < 0 ? "" : trimmed.substring(0, idx + 1);
    }

    /**
     * The node's name relative to its parent; directories keep their trailing separator.
     */
    public static String nameOf(String nodePath) {
        return nodePath.substring(parentOf(nodePath).length());
    }

    /**
     * Last segment of an asset path, used as a download filename.
     */
    public static String basename(String path) {
        return path.substring(path.lastIndexOf(SEPARATOR) + 1);
    }
}
