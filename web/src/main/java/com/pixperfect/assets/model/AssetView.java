package com.pixperfect.assets.model;

import com.pixperfect.assets.common.model.ImageAsset;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssetView {
    private Long id;
    private Long ownerId;
    private String storageKey;
    private String address;
    private String overlayProps;
    private String textOverlay;
    private Instant createdAt;

    public static AssetView of(ImageAsset asset, String address) {
        return AssetView.builder()
                .id(asset.getId())
                .ownerId(asset.getOwnerId())
                .storageKey(asset.getStorageKey())
                .address(address)
                .overlayProps(asset.getOverlayProps())
                .textOverlay(asset.getTextOverlay())
                .createdAt(asset.getCreatedAt())
                .build();
    }
}
