package com.pixperfect.assets.common.exception;

public class InvalidParameterException extends AssetException {

    public static final String REASON = "invalid_parameter";

    public InvalidParameterException(String message) {
        super(REASON, message);
    }

    public InvalidParameterException(String message, Throwable cause) {
        super(REASON, message, cause);
    }
}
