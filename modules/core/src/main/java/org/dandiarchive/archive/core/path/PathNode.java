package org.dandiarchive.archive.core.path;

import java.util.UUID;

/**
 * One child in a path listing.
 *
 * @param path      full path; directories end with {@code /}
 * @param name      path relative to the listed prefix
 * @param leaf      true for an asset, false for a directory
 * @param fileCount number of assets at or below this node
 * @param totalSize total size in bytes of those assets
 * @param assetId   external asset id for leaves, null for directories
 */
public record PathNode(String path, String name, boolean leaf, long fileCount, long totalSize, UUID assetId) {}
