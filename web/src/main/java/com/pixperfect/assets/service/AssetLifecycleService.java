package com.pixperfect.assets.service;

import com.pixperfect.assets.common.exception.AssetException;
import com.pixperfect.assets.common.exception.AssetNotFoundException;
import com.pixperfect.assets.common.exception.InvalidParameterException;
import com.pixperfect.assets.common.model.ImageAsset;
import com.pixperfect.assets.common.model.OverlayDefaults;
import com.pixperfect.assets.common.transform.ImageTransformer;
import com.pixperfect.assets.common.transform.TransformOperation;
import com.pixperfect.assets.common.util.StorageUtil;
import com.pixperfect.assets.model.AssetUpload;
import com.pixperfect.assets.model.AssetView;
import com.pixperfect.assets.model.StoredContent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Keeps asset rows and their blobs in step.
 *
 * <p>Writes always go blob first, row second. A blob is only removed once no row
 * points at it any more, and that removal is best effort: a failure is logged and
 * the request still succeeds. Blobs left behind by a failed row write are not
 * reclaimed.
 *
 * <p>Requests are not serialised per asset. Two concurrent replaces of the same
 * asset both succeed; the row ends up pointing at one of the new blobs and the
 * other one is orphaned.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AssetLifecycleService {

    private final StorageService storageService;
    private final AssetMetadataStore metadataStore;
    private final ImageTransformer imageTransformer;
    private final StorageCallGuard storageCallGuard;

    public AssetView create(Long ownerId, AssetUpload upload) {
        requireContent(upload);
        return store(ownerId, upload.getContent(), upload.getFilename(), upload.getContentType(),
                upload.getOverlayProps(), upload.getTextOverlay());
    }

    /**
     * Transforms the uploaded image and stores the result as a new asset. Caller
     * overlay fields are ignored: the new geometry gets the default overlay.
     */
    public AssetView createTransformed(Long ownerId, AssetUpload upload, TransformOperation operation) {
        requireContent(upload);
        log.info("Applying {} for owner {}", operation, ownerId);
        byte[] transformed = imageTransformer.apply(operation, upload.getContent());
        String sourceName = StorageUtil.sanitizeFilename(upload.getFilename());
        String name = StorageUtil.withExtension(operation.getName() + "-" + sourceName,
                "." + ImageTransformer.OUTPUT_FORMAT);
        return store(ownerId, transformed, name, ImageTransformer.OUTPUT_CONTENT_TYPE,
                OverlayDefaults.OVERLAY_PROPS, OverlayDefaults.TEXT_OVERLAY);
    }

    /**
     * Points an existing asset at new bytes and/or new overlay fields. Overlay fields
     * left {@code null} keep their stored value; without new bytes the blob is kept.
     */
    public void replace(Long ownerId, Long id, AssetUpload upload) {
        ImageAsset existing = findOwned(ownerId, id);
        String previousKey = existing.getStorageKey();

        String newKey = previousKey;
        if (upload.hasContent()) {
            newKey = storageCallGuard.call("blob.put",
                    () -> storageService.put(upload.getContent(), upload.getFilename(), upload.getContentType()));
        }

        String overlayProps = upload.getOverlayProps() != null ? upload.getOverlayProps() : existing.getOverlayProps();
        String textOverlay = upload.getTextOverlay() != null ? upload.getTextOverlay() : existing.getTextOverlay();

        String key = newKey;
        boolean updated;
        try {
            updated = storageCallGuard.call("metadata.update",
                    () -> metadataStore.update(id, ownerId, key, overlayProps, textOverlay));
        } catch (AssetException e) {
            if (!key.equals(previousKey)) {
                log.warn("Row update for asset {} failed, blob {} is orphaned", id, key);
            }
            throw e;
        }
        if (!updated) {
            // deleted by a concurrent request between lookup and update
            if (!key.equals(previousKey)) {
                log.warn("Asset {} vanished during replace, blob {} is orphaned", id, key);
            }
            throw new AssetNotFoundException(id);
        }
        log.info("Asset replaced: id={}, owner={}, storageKey={}", id, ownerId, key);

        if (!key.equals(previousKey)) {
            deleteBlobQuietly(previousKey);
        }
    }

    public void delete(Long ownerId, Long id) {
        ImageAsset existing = findOwned(ownerId, id);

        deleteBlobQuietly(existing.getStorageKey());

        boolean deleted = storageCallGuard.call("metadata.delete", () -> metadataStore.delete(id, ownerId));
        if (!deleted) {
            throw new AssetNotFoundException(id);
        }
        log.info("Asset deleted: id={}, owner={}", id, ownerId);
    }

    public AssetView get(Long ownerId, Long id) {
        ImageAsset asset = findOwned(ownerId, id);
        return AssetView.of(asset, storageService.resolve(asset.getStorageKey()));
    }

    public List<AssetView> list(Long ownerId) {
        List<ImageAsset> assets = storageCallGuard.call("metadata.list", () -> metadataStore.listByOwner(ownerId));
        log.debug("Fetched {} assets for owner {}", assets.size(), ownerId);
        return assets.stream()
                .map(asset -> AssetView.of(asset, storageService.resolve(asset.getStorageKey())))
                .collect(Collectors.toList());
    }

    public StoredContent readContent(Long ownerId, Long id) {
        ImageAsset asset = findOwned(ownerId, id);
        byte[] data = storageCallGuard.call("blob.read", () -> storageService.read(asset.getStorageKey()));
        return new StoredContent(asset.getStorageKey(), data);
    }

    private AssetView store(Long ownerId, byte[] content, String filename, String contentType,
                            String overlayProps, String textOverlay) {
        String key = storageCallGuard.call("blob.put", () -> storageService.put(content, filename, contentType));

        ImageAsset saved;
        try {
            saved = storageCallGuard.call("metadata.insert",
                    () -> metadataStore.insert(ownerId, key, overlayProps, textOverlay));
        } catch (AssetException e) {
            log.warn("Row insert failed after storing blob {}, blob is orphaned", key);
            throw e;
        }
        log.info("Asset created: id={}, owner={}, storageKey={}, backend={}",
                saved.getId(), ownerId, key, storageService.getStorageType());
        return AssetView.of(saved, storageService.resolve(key));
    }

    private ImageAsset findOwned(Long ownerId, Long id) {
        return storageCallGuard.call("metadata.get", () -> metadataStore.get(id, ownerId))
                .orElseThrow(() -> new AssetNotFoundException(id));
    }

    private void deleteBlobQuietly(String key) {
        try {
            BlobDeletion outcome = storageCallGuard.call("blob.delete", () -> storageService.delete(key));
            if (outcome == BlobDeletion.FAILED) {
                log.warn("Best-effort delete of blob {} failed, blob left behind", key);
            } else {
                log.debug("Blob {} cleanup: {}", key, outcome);
            }
        } catch (AssetException e) {
            log.warn("Best-effort delete of blob {} failed, blob left behind", key, e);
        }
    }

    private static void requireContent(AssetUpload upload) {
        if (upload == null || !upload.hasContent()) {
            throw new InvalidParameterException("No image file provided");
        }
    }
}
