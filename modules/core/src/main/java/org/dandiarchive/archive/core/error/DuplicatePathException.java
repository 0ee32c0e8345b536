package org.dandiarchive.archive.core.error;

public class DuplicatePathException extends ArchiveException {

    private final String path;

    public DuplicatePathException(String path) {
        super(ErrorKind.CONFLICT, "An asset with path '" + path + "' already exists in this version");
        this.path = path;
    }

    public DuplicatePathException(String path, Throwable cause) {
        super(ErrorKind.CONFLICT, "An asset with path '" + path + "' already exists in this version", cause);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
