package org.dandiarchive.archive.types;

/**
 * Metadata validation lifecycle shared by assets and versions.
 * {@code PENDING} is re-entered whenever content or metadata changes.
 */
public enum ValidationStatus {
    PENDING(0, "Pending"),
    VALID(1, "Valid"),
    INVALID(2, "Invalid");

    private final int id;
    private final String label;

    ValidationStatus(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static ValidationStatus fromId(int id) {
        for (ValidationStatus s : values()) {
            if (s.id == id) return s;
        }
        throw new IllegalArgumentException("Unknown ValidationStatus id: " + id);
    }
}
