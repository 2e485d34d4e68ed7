package uk.gegc.yearguess.features.archive.application;

/**
 * Durable, create-only object storage for archive batches.
 */
public interface ArchiveObjectStore {

    /**
     * Write a new object. Never overwrites.
     *
     * @throws uk.gegc.yearguess.shared.exception.ArchiveObjectExistsException an object already exists at the key
     * @throws uk.gegc.yearguess.shared.exception.ArchiveStorageException      the write was not confirmed
     */
    void put(String bucket, String key, byte[] body, String contentType);
}
