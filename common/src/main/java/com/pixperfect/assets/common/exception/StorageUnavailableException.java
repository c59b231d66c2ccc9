package com.pixperfect.assets.common.exception;

/**
 * The blob store or the metadata store failed or did not answer in time.
 */
public class StorageUnavailableException extends AssetException {

    public static final String REASON = "storage_unavailable";

    public StorageUnavailableException(String message) {
        super(REASON, message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(REASON, message, cause);
    }
}
