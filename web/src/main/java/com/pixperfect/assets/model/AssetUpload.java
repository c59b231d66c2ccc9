package com.pixperfect.assets.model;

import lombok.Builder;
import lombok.Value;

/**
 * Incoming bytes and overlay fields for create and replace. Every field is optional
 * at this level; the lifecycle service decides what each operation requires.
 */
@Value
@Builder
public class AssetUpload {
    byte[] content;
    String filename;
    String contentType;
    String overlayProps;
    String textOverlay;

    public boolean hasContent() {
        return content != null && content.length > 0;
    }
}
