package org.dandiarchive.archive.core.asset;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * An asset's stored metadata merged with the fields derived from its record and
 * content. {@code contentReady} is false while the blob digest or zarr checksum
 * is still being computed; the document then lacks those fields.
 */
public record ComposedMetadata(ObjectNode document, boolean contentReady) {}
