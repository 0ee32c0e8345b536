package org.dandiarchive.archive.core.error;

/**
 * Base class for domain failures raised synchronously at the mutation boundary.
 */
public abstract class ArchiveException extends RuntimeException {

    private final ErrorKind kind;

    protected ArchiveException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ArchiveException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
