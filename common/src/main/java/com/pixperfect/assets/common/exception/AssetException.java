package com.pixperfect.assets.common.exception;

/**
 * Base type for failures that are reported to the caller. The reason is a
 * short machine-stable string. Only invalid-parameter messages reach the caller,
 * the others are logged.
 */
public abstract class AssetException extends RuntimeException {

    private final String reason;

    protected AssetException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    protected AssetException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
