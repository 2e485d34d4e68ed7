package uk.gegc.yearguess.features.archive.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import uk.gegc.yearguess.features.archive.application.ArchiveObjectStore;
import uk.gegc.yearguess.shared.exception.ArchiveObjectExistsException;
import uk.gegc.yearguess.shared.exception.ArchiveStorageException;

@Component
@RequiredArgsConstructor
@Slf4j
public class S3ArchiveObjectStore implements ArchiveObjectStore {

    private static final int PRECONDITION_FAILED = 412;
    private static final int CONFLICT = 409;

    private final S3Client s3Client;

    @Override
    public void put(String bucket, String key, byte[] body, String contentType) {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType)
                .contentLength((long) body.length)
                .ifNoneMatch("*")
                .build();
        try {
            s3Client.putObject(request, RequestBody.fromBytes(body));
        } catch (S3Exception e) {
            if (e.statusCode() == PRECONDITION_FAILED || e.statusCode() == CONFLICT) {
                throw new ArchiveObjectExistsException(key, e);
            }
            log.error("S3 rejected archive object {}/{} with status {}", bucket, key, e.statusCode());
            throw new ArchiveStorageException("Failed to write archive object %s/%s".formatted(bucket, key), e);
        } catch (SdkException e) {
            log.error("Failed to reach S3 for archive object {}/{}", bucket, key);
            throw new ArchiveStorageException("Failed to write archive object %s/%s".formatted(bucket, key), e);
        }
    }
}
