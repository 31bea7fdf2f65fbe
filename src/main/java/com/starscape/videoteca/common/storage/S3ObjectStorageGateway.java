package com.starscape.videoteca.common.storage;

import com.starscape.videoteca.common.config.StorageProperties;
import com.starscape.videoteca.common.exception.NotFoundException;
import com.starscape.videoteca.common.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.awscore.AwsRequestOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

import java.io.InputStream;
import java.time.Duration;

/**
 * S3 backed storage gateway. Works against AWS S3 and S3 compatible stores (MinIO, LocalStack).
 */
@Service
public class S3ObjectStorageGateway implements ObjectStorageGateway {
    
    private static final Logger log = LoggerFactory.getLogger(S3ObjectStorageGateway.class);
    
    private final S3Client s3Client;
    private final S3Presigner s3Presigner;
    private final String bucket;
    private final Duration uploadTimeout;
    
    public S3ObjectStorageGateway(
            S3Client s3Client,
            S3Presigner s3Presigner,
            StorageProperties storageProperties) {
        this.s3Client = s3Client;
        this.s3Presigner = s3Presigner;
        this.bucket = storageProperties.getBucket();
        this.uploadTimeout = storageProperties.getUploadTimeout();
    }
    
    @Override
    public StoredObject put(String key, InputStream content, long contentLength, String contentType) {
        PutObjectRequest putRequest = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType)
                .contentLength(contentLength)
                // Large payloads get the long deadline, every other call keeps the client default
                .overrideConfiguration(AwsRequestOverrideConfiguration.builder()
                        .apiCallTimeout(uploadTimeout)
                        .build())
                .build();
        
        try {
            PutObjectResponse response = s3Client.putObject(
                    putRequest, RequestBody.fromInputStream(content, contentLength));
            log.info("Stored object: bucket={}, key={}, bytes={}", bucket, key, contentLength);
            return new StoredObject(bucket, key, response.eTag(), contentLength);
        } catch (SdkException e) {
            throw new StorageException("Failed to upload object " + key + ": " + e.getMessage(), e);
        }
    }
    
    @Override
    public SignedUrl signedUrl(String key, Duration ttl) {
        ensureExists(key);
        
        GetObjectRequest getRequest = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        
        GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
                .signatureDuration(ttl)
                .getObjectRequest(getRequest)
                .build();
        
        try {
            PresignedGetObjectRequest presigned = s3Presigner.presignGetObject(presignRequest);
            return new SignedUrl(presigned.url().toString(), presigned.expiration());
        } catch (SdkException e) {
            throw new StorageException("Failed to sign URL for object " + key + ": " + e.getMessage(), e);
        }
    }
    
    @Override
    public void delete(String key) {
        DeleteObjectRequest deleteRequest = DeleteObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        
        try {
            s3Client.deleteObject(deleteRequest);
            log.info("Deleted object: bucket={}, key={}", bucket, key);
        } catch (NoSuchKeyException e) {
            log.debug("Object does not exist (already deleted?): bucket={}, key={}", bucket, key);
        } catch (SdkException e) {
            throw new StorageException("Failed to delete object " + key + ": " + e.getMessage(), e);
        }
    }
    
    private void ensureExists(String key) {
        HeadObjectRequest headRequest = HeadObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        try {
            s3Client.headObject(headRequest);
        } catch (NoSuchKeyException e) {
            throw new NotFoundException("Object not found: " + key);
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                throw new NotFoundException("Object not found: " + key);
            }
            throw new StorageException("Failed to look up object " + key + ": " + e.getMessage(), e);
        } catch (SdkException e) {
            throw new StorageException("Failed to look up object " + key + ": " + e.getMessage(), e);
        }
    }
}
