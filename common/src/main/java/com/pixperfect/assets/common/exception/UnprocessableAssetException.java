package com.pixperfect.assets.common.exception;

public class UnprocessableAssetException extends AssetException {

    public static final String REASON = "unprocessable_asset";

    public UnprocessableAssetException(String message) {
        super(REASON, message);
    }

    public UnprocessableAssetException(String message, Throwable cause) {
        super(REASON, message, cause);
    }
}
