package com.singularity.trading.store;

import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.nio.charset.StandardCharsets;

/**
 * Documents stored as S3 objects. The object's ETag is the version token and conditional
 * writes use S3's {@code If-Match} / {@code If-None-Match} preconditions.
 */
public class S3DocumentStore implements DocumentStore {

    private static final int PRECONDITION_FAILED = 412;
    private static final int CONDITIONAL_REQUEST_CONFLICT = 409;

    private final S3Client s3Client;
    private final String bucketName;

    /**
     * @param s3Client   The S3 client, expected to carry an API call timeout.
     * @param bucketName The bucket holding the documents.
     */
    public S3DocumentStore(S3Client s3Client, String bucketName) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
    }

    @Override
    public VersionedDocument read(String key) {
        try {
            ResponseBytes<GetObjectResponse> object = s3Client.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(bucketName)
                    .key(key)
                    .build());
            return VersionedDocument.of(object.asUtf8String(), object.response().eTag());
        } catch (NoSuchKeyException e) {
            return VersionedDocument.absent();
        } catch (SdkException e) {
            throw new StoreUnavailableException("Could not read s3://" + bucketName + "/" + key, e);
        }
    }

    @Override
    public WriteResult writeIfVersion(String key, String body, String expectedVersionToken) {
        PutObjectRequest.Builder request = baseRequest(key);
        if (expectedVersionToken != null) {
            request.ifMatch(expectedVersionToken);
        } else {
            request.ifNoneMatch("*");
        }
        return put(key, request.build(), body);
    }

    @Override
    public WriteResult writeUnconditionally(String key, String body) {
        return put(key, baseRequest(key).build(), body);
    }

    private PutObjectRequest.Builder baseRequest(String key) {
        return PutObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .contentType("application/json");
    }

    private WriteResult put(String key, PutObjectRequest request, String body) {
        try {
            PutObjectResponse response = s3Client.putObject(request,
                    RequestBody.fromString(body, StandardCharsets.UTF_8));
            return WriteResult.committed(response.eTag());
        } catch (S3Exception e) {
            int status = e.statusCode();
            if (status == PRECONDITION_FAILED || status == CONDITIONAL_REQUEST_CONFLICT) {
                return WriteResult.conflict();
            }
            if (status >= 500) {
                return WriteResult.unknown(e);
            }
            throw new StoreUnavailableException("S3 rejected write to s3://" + bucketName + "/" + key, e);
        } catch (SdkClientException e) {
            // Timeouts and broken connections: the object may already have been replaced.
            return WriteResult.unknown(e);
        }
    }
}
