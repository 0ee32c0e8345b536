package org.dandiarchive.archive.core.path;

import java.util.List;

/**
 * A page of {@link PathNode}s ordered by name. {@code page} is 1-based.
 */
public record PathPage(List<PathNode> items, int page, int pageSize, long total) {

    public PathPage {
        items = List.copyOf(items);
    }

    public boolean hasNext() {
        return (long) page * pageSize < total;
    }
}
