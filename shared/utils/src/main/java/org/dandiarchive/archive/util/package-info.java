/**
 * Shared utilities for all archive modules.
 *
 * <p>Contains the digest value types ({@link org.dandiarchive.archive.util.Sha256Digest},
 * {@link org.dandiarchive.archive.util.ZarrChecksum}) and the asset path rules
 * ({@link org.dandiarchive.archive.util.AssetPaths}).
 * No framework dependencies.
 */
package org.dandiarchive.archive.util;
