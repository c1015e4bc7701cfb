package io.salesops.core.storage;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CommonPrefix;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

/** Amazon S3 (or an S3-compatible store). Listings return full keys and {@code /}-terminated prefixes. */
public final class S3ObjectStorage implements ObjectStorage {
    private static final String DELIMITER = "/";

    private final S3Client s3;

    public S3ObjectStorage(S3Client s3) {
        this.s3 = Objects.requireNonNull(s3, "s3 must not be null");
    }

    @Override
    public List<StoredObject> list(String bucket, String prefix) throws IOException {
        String effectivePrefix = prefix == null || prefix.isEmpty() || prefix.endsWith(DELIMITER)
            ? (prefix == null ? "" : prefix)
            : prefix + DELIMITER;
        List<StoredObject> objects = new ArrayList<>();
        String continuation = null;
        try {
            do {
                ListObjectsV2Request.Builder request = ListObjectsV2Request.builder()
                    .bucket(bucket)
                    .delimiter(DELIMITER);
                if (!effectivePrefix.isEmpty()) {
                    request.prefix(effectivePrefix);
                }
                if (continuation != null) {
                    request.continuationToken(continuation);
                }
                ListObjectsV2Response response = s3.listObjectsV2(request.build());
                for (CommonPrefix common : response.commonPrefixes()) {
                    objects.add(StoredObject.folder(common.prefix()));
                }
                for (S3Object object : response.contents()) {
                    if (object.key().equals(effectivePrefix)) {
                        continue;
                    }
                    long size = object.size() == null ? 0L : object.size();
                    objects.add(StoredObject.file(object.key(), size, object.lastModified()));
                }
                continuation = Boolean.TRUE.equals(response.isTruncated()) ? response.nextContinuationToken() : null;
            } while (continuation != null);
        } catch (SdkException e) {
            throw new IOException("Failed to list s3://" + bucket + "/" + effectivePrefix, e);
        }
        return objects;
    }

    @Override
    public byte[] download(String bucket, String key) throws IOException {
        try {
            return s3.getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(key).build()).asByteArray();
        } catch (SdkException e) {
            throw new IOException("Failed to download s3://" + bucket + "/" + key, e);
        }
    }

    @Override
    public void upload(String bucket, String key, byte[] content, String contentType) throws IOException {
        PutObjectRequest request = PutObjectRequest.builder()
            .bucket(bucket)
            .key(key)
            .contentType(contentType)
            .contentLength((long) content.length)
            .build();
        try {
            s3.putObject(request, RequestBody.fromBytes(content));
        } catch (SdkException e) {
            throw new IOException("Failed to upload s3://" + bucket + "/" + key, e);
        }
    }

    @Override
    public void remove(String bucket, String key) throws IOException {
        try {
            s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
        } catch (SdkException e) {
            throw new IOException("Failed to delete s3://" + bucket + "/" + key, e);
        }
    }
}
