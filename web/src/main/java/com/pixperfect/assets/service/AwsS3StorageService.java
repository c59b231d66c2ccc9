package com.pixperfect.assets.service;

import com.pixperfect.assets.common.exception.StorageUnavailableException;
import com.pixperfect.assets.common.util.StorageUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.*;

@Slf4j
@Service
@RequiredArgsConstructor
@Profile("s3")
public class AwsS3StorageService implements StorageService {

    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";
    private static final int HTTP_CONFLICT = 409;
    private static final int HTTP_PRECONDITION_FAILED = 412;

    private final S3Client s3Client;

    @Value("${aws.s3.bucket}")
    private String bucketName;

    @Override
    public String put(byte[] data, String suggestedName, String contentType) {
        String key = StorageUtil.generateKey(suggestedName);

        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .contentType(contentType == null ? DEFAULT_CONTENT_TYPE : contentType)
                .contentLength((long) data.length)
                .ifNoneMatch("*")
                .build();

        try {
            PutObjectResponse response = s3Client.putObject(request, RequestBody.fromBytes(data));
            log.info("s3.put ok bucket={} key={} size={} eTag={}", bucketName, key, data.length, response.eTag());
            return key;
        } catch (S3Exception e) {
            if (e.statusCode() == HTTP_PRECONDITION_FAILED || e.statusCode() == HTTP_CONFLICT) {
                throw new StorageUnavailableException("Refusing to overwrite existing blob: " + key, e);
            }
            throw new StorageUnavailableException("Failed to upload to S3: " + key, e);
        } catch (SdkException e) {
            throw new StorageUnavailableException("Failed to upload to S3: " + key, e);
        }
    }

    @Override
    public String resolve(String key) {
        GetUrlRequest request = GetUrlRequest.builder()
                .bucket(bucketName)
                .key(key)
                .build();
        return s3Client.utilities().getUrl(request).toExternalForm();
    }

    @Override
    public byte[] read(String key) {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .build();
        try {
            return s3Client.getObjectAsBytes(request).asByteArray();
        } catch (SdkException e) {
            throw new StorageUnavailableException("Failed to read from S3: " + key, e);
        }
    }

    @Override
    public BlobDeletion delete(String key) {
        try {
            // S3 deletes are silent for missing keys, so probe first to report absence
            s3Client.headObject(HeadObjectRequest.builder()
                    .bucket(bucketName)
                    .key(key)
                    .build());
        } catch (NoSuchKeyException e) {
            log.info("s3.delete key already absent bucket={} key={}", bucketName, key);
            return BlobDeletion.ALREADY_ABSENT;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                log.info("s3.delete key already absent bucket={} key={}", bucketName, key);
                return BlobDeletion.ALREADY_ABSENT;
            }
            log.error("s3.delete head failed bucket={} key={}", bucketName, key, e);
            return BlobDeletion.FAILED;
        } catch (SdkException e) {
            log.error("s3.delete head failed bucket={} key={}", bucketName, key, e);
            return BlobDeletion.FAILED;
        }

        try {
            s3Client.deleteObject(DeleteObjectRequest.builder()
                    .bucket(bucketName)
                    .key(key)
                    .build());
            log.info("s3.delete ok bucket={} key={}", bucketName, key);
            return BlobDeletion.DELETED;
        } catch (SdkException e) {
            log.error("s3.delete failed bucket={} key={}", bucketName, key, e);
            return BlobDeletion.FAILED;
        }
    }

    @Override
    public String getStorageType() {
        return "s3";
    }
}
