package com.pixperfect.assets.service;

/**
 * Interface for blob storage that can be implemented by different storage providers
 * (local file system, AWS S3, Azure Blob Storage). Implementations must be safe to
 * call from concurrent requests.
 */
public interface StorageService {

    /**
     * Stores the bytes under a newly generated key. Never overwrites an existing blob.
     *
     * @param data          raw bytes to store
     * @param suggestedName original file name, used only as a readable key suffix
     * @param contentType   MIME type, may be {@code null}
     * @return the generated storage key
     */
    String put(byte[] data, String suggestedName, String contentType);

    /**
     * Address a viewer can fetch the blob from without going through this service.
     */
    String resolve(String key);

    byte[] read(String key);

    /**
     * Removes the blob. Absent keys are reported, not thrown; failures are logged
     * by the implementation and reported as {@link BlobDeletion#FAILED}.
     */
    BlobDeletion delete(String key);

    String getStorageType();
}
