package com.pixperfect.assets.service;

import com.pixperfect.assets.common.model.ImageAsset;
import com.pixperfect.assets.common.repository.ImageAssetRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Owner-scoped access to asset rows. A row owned by someone else behaves
 * exactly like a row that does not exist.
 */
@Service
@RequiredArgsConstructor
public class AssetMetadataStore {

    private final ImageAssetRepository imageAssetRepository;

    public ImageAsset insert(Long ownerId, String storageKey, String overlayProps, String textOverlay) {
        return imageAssetRepository.save(new ImageAsset(ownerId, storageKey, overlayProps, textOverlay));
    }

    public Optional<ImageAsset> get(Long id, Long ownerId) {
        return imageAssetRepository.findByIdAndOwnerId(id, ownerId);
    }

    public List<ImageAsset> listByOwner(Long ownerId) {
        return imageAssetRepository.findAllByOwnerIdOrderByIdAsc(ownerId);
    }

    /**
     * @return {@code false} when no row with this id belongs to the owner
     */
    public boolean update(Long id, Long ownerId, String storageKey, String overlayProps, String textOverlay) {
        return imageAssetRepository.updateOwned(id, ownerId, storageKey, overlayProps, textOverlay) > 0;
    }

    public boolean delete(Long id, Long ownerId) {
        return imageAssetRepository.deleteOwned(id, ownerId) > 0;
    }
}
