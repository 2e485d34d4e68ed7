package uk.gegc.yearguess.shared.exception;

/**
 * Raised by create-only writes when an object already exists under the requested key.
 */
public class ArchiveObjectExistsException extends ArchiveStorageException {

    private final String key;

    public ArchiveObjectExistsException(String key, Throwable cause) {
        super(String.format("Archive object %s already exists", key), cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
