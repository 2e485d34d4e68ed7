package uk.gegc.yearguess.shared.exception;

/**
 * Exception thrown when a write to the cold archive fails.
 * Callers must treat the batch as not persisted; the next archival sweep retries it.
 */
public class ArchiveStorageException extends RuntimeException {

    public ArchiveStorageException(String message) {
        super(message);
    }

    public ArchiveStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
