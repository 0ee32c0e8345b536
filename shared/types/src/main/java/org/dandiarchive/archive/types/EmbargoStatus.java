package org.dandiarchive.archive.types;

public enum EmbargoStatus {
    OPEN,
    EMBARGOED,
    UNEMBARGOING
}
