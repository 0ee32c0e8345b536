package org.dandiarchive.archive.core.error;

public class InvalidPathException extends ArchiveException {

    private final String path;

    public InvalidPathException(String path) {
        super(ErrorKind.INVALID_REQUEST, "Invalid asset path: '" + path + "'");
        this.path = path;
    }

    public InvalidPathException(String path, String reason) {
        super(ErrorKind.INVALID_REQUEST, reason);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
