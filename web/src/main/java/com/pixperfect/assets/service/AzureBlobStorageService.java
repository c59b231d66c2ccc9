package com.pixperfect.assets.service;

import com.azure.core.http.rest.Response;
import com.azure.core.util.BinaryData;
import com.azure.core.util.Context;
import com.azure.storage.blob.BlobClient;
import com.azure.storage.blob.BlobServiceClient;
import com.azure.storage.blob.models.BlobErrorCode;
import com.azure.storage.blob.models.BlobHttpHeaders;
import com.azure.storage.blob.models.BlobRequestConditions;
import com.azure.storage.blob.models.BlobStorageException;
import com.azure.storage.blob.models.DeleteSnapshotsOptionType;
import com.azure.storage.blob.options.BlobParallelUploadOptions;
import com.pixperfect.assets.common.exception.StorageUnavailableException;
import com.pixperfect.assets.common.util.StorageUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Slf4j
@Service
@RequiredArgsConstructor
@Profile("azure")
public class AzureBlobStorageService implements StorageService {

    private final BlobServiceClient blobServiceClient;

    @Value("${azure.storage.container}")
    private String containerName;

    @Value("${assets.storage.call-timeout:10s}")
    private Duration callTimeout;

    @Override
    public String put(byte[] data, String suggestedName, String contentType) {
        String key = StorageUtil.generateKey(suggestedName);

        BlobParallelUploadOptions options = new BlobParallelUploadOptions(BinaryData.fromBytes(data))
                .setHeaders(new BlobHttpHeaders().setContentType(contentType))
                // fail instead of overwriting if the key is somehow taken
                .setRequestConditions(new BlobRequestConditions().setIfNoneMatch("*"));
        try {
            blobClient(key).uploadWithResponse(options, callTimeout, Context.NONE);
        } catch (RuntimeException e) {
            throw new StorageUnavailableException("Failed to upload blob: " + key, e);
        }
        log.info("azure.put ok container={} key={} size={}", containerName, key, data.length);
        return key;
    }

    @Override
    public String resolve(String key) {
        return blobClient(key).getBlobUrl();
    }

    @Override
    public byte[] read(String key) {
        try {
            return blobClient(key).downloadContent().toBytes();
        } catch (RuntimeException e) {
            throw new StorageUnavailableException("Failed to read blob: " + key, e);
        }
    }

    @Override
    public BlobDeletion delete(String key) {
        try {
            Response<Boolean> response = blobClient(key)
                    .deleteIfExistsWithResponse(DeleteSnapshotsOptionType.INCLUDE, null, callTimeout, Context.NONE);
            if (Boolean.TRUE.equals(response.getValue())) {
                log.info("azure.delete ok container={} key={}", containerName, key);
                return BlobDeletion.DELETED;
            }
            log.info("azure.delete key already absent container={} key={}", containerName, key);
            return BlobDeletion.ALREADY_ABSENT;
        } catch (BlobStorageException e) {
            if (BlobErrorCode.BLOB_NOT_FOUND.equals(e.getErrorCode())) {
                return BlobDeletion.ALREADY_ABSENT;
            }
            log.error("azure.delete failed container={} key={}", containerName, key, e);
            return BlobDeletion.FAILED;
        } catch (RuntimeException e) {
            log.error("azure.delete failed container={} key={}", containerName, key, e);
            return BlobDeletion.FAILED;
        }
    }

    @Override
    public String getStorageType() {
        return "azure";
    }

    private BlobClient blobClient(String key) {
        return blobServiceClient.getBlobContainerClient(containerName).getBlobClient(key);
    }
}
