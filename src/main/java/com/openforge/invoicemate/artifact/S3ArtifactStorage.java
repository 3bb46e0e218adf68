package com.openforge.invoicemate.artifact;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.net.URL;
import java.time.Duration;

/**
 * {@link ArtifactStorage} on a private S3 (or S3-compatible) bucket. Objects
 * are never public; readers get a presigned GET for one key.
 */
@Slf4j
public class S3ArtifactStorage implements ArtifactStorage {

    private final S3Client    s3Client;
    private final S3Presigner presigner;
    private final String      bucket;

    public S3ArtifactStorage(S3Client s3Client, S3Presigner presigner, String bucket) {
        this.s3Client  = s3Client;
        this.presigner = presigner;
        this.bucket    = bucket;
    }

    @Override
    public void put(String key, byte[] content, String contentType) {
        try {
            s3Client.putObject(PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .contentType(contentType)
                            .contentLength((long) content.length)
                            .build(),
                    RequestBody.fromBytes(content));
            log.debug("[Issuer] Stored s3://{}/{} ({} bytes)", bucket, key, content.length);
        } catch (SdkException e) {
            throw new StorageException("Upload of %s to bucket %s failed: %s".formatted(key, bucket, e.getMessage()), e);
        }
    }

    @Override
    public URL presignGet(String key, Duration validity) {
        try {
            GetObjectPresignRequest request = GetObjectPresignRequest.builder()
                    .signatureDuration(validity)
                    .getObjectRequest(GetObjectRequest.builder().bucket(bucket).key(key).build())
                    .build();
            return presigner.presignGetObject(request).url();
        } catch (SdkException e) {
            throw new StorageException("Signing a link for %s failed: %s".formatted(key, e.getMessage()), e);
        }
    }
}
