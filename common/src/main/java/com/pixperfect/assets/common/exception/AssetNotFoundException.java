package com.pixperfect.assets.common.exception;

/**
 * Raised both when an asset does not exist and when it belongs to another
 * owner. Callers must not be able to tell the two apart.
 */
public class AssetNotFoundException extends AssetException {

    public static final String REASON = "not_found";

    public AssetNotFoundException(Long id) {
        super(REASON, "Asset not found: " + id);
    }
}
