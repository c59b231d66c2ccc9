package com.pixperfect.assets.controller;

import com.pixperfect.assets.common.exception.InvalidParameterException;
import com.pixperfect.assets.common.transform.Mirror;
import com.pixperfect.assets.common.transform.Rotation;
import com.pixperfect.assets.common.util.StorageUtil;
import com.pixperfect.assets.model.AssetCreatedResponse;
import com.pixperfect.assets.model.AssetUpload;
import com.pixperfect.assets.model.AssetView;
import com.pixperfect.assets.model.MessageResponse;
import com.pixperfect.assets.model.StoredContent;
import com.pixperfect.assets.service.AssetLifecycleService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

/**
 * Image endpoints. All of them act on behalf of the owner resolved from the bearer token.
 *
 * <p>{@code POST /flip} takes {@code direction=horizontal} to turn the image upside down
 * and {@code direction=vertical} to swap left and right.
 */
@RestController
@RequiredArgsConstructor
public class ImageController {

    private final AssetLifecycleService assetLifecycleService;

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public AssetCreatedResponse uploadImage(@AuthenticationPrincipal Long ownerId,
                                            @RequestParam(value = "image", required = false) MultipartFile image,
                                            @RequestParam(value = "overlayProps", required = false) String overlayProps,
                                            @RequestParam(value = "textOverlay", required = false) String textOverlay) {
        AssetView asset = assetLifecycleService.create(ownerId, toUpload(requireFile(image), overlayProps, textOverlay));
        return created(asset, "Image uploaded successfully");
    }

    @PostMapping(value = "/rotate", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public AssetCreatedResponse rotateImage(@AuthenticationPrincipal Long ownerId,
                                            @RequestParam(value = "image", required = false) MultipartFile image,
                                            @RequestParam(value = "degrees", required = false) String degrees) {
        MultipartFile file = requireFile(image);
        Rotation rotation = Rotation.parse(degrees);
        AssetView asset = assetLifecycleService.createTransformed(ownerId, toUpload(file, null, null), rotation);
        return created(asset, "Image rotated successfully");
    }

    @PostMapping(value = "/flip", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public AssetCreatedResponse flipImage(@AuthenticationPrincipal Long ownerId,
                                          @RequestParam(value = "image", required = false) MultipartFile image,
                                          @RequestParam(value = "direction", required = false) String direction) {
        MultipartFile file = requireFile(image);
        Mirror mirror = Mirror.parse(direction);
        AssetView asset = assetLifecycleService.createTransformed(ownerId, toUpload(file, null, null), mirror);
        return created(asset, "Image flipped successfully");
    }

    @PutMapping(value = "/image", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public MessageResponse updateImage(@AuthenticationPrincipal Long ownerId,
                                       @RequestParam(value = "id", required = false) String id,
                                       @RequestParam(value = "image", required = false) MultipartFile image,
                                       @RequestParam(value = "overlayProps", required = false) String overlayProps,
                                       @RequestParam(value = "textOverlay", required = false) String textOverlay) {
        Long assetId = parseId(id);
        MultipartFile file = image == null || image.isEmpty() ? null : image;
        assetLifecycleService.replace(ownerId, assetId, toUpload(file, overlayProps, textOverlay));
        return new MessageResponse("Image updated successfully");
    }

    @GetMapping("/images")
    public List<AssetView> listImages(@AuthenticationPrincipal Long ownerId) {
        return assetLifecycleService.list(ownerId);
    }

    @GetMapping("/image/{id}")
    public AssetView getImage(@AuthenticationPrincipal Long ownerId, @PathVariable Long id) {
        return assetLifecycleService.get(ownerId, id);
    }

    @GetMapping("/image/{id}/content")
    public ResponseEntity<ByteArrayResource> viewImage(@AuthenticationPrincipal Long ownerId, @PathVariable Long id) {
        StoredContent content = assetLifecycleService.readContent(ownerId, id);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaTypeFactory.getMediaType(content.getStorageKey())
                .orElse(MediaType.APPLICATION_OCTET_STREAM));
        headers.setContentLength(content.getData().length);

        return ResponseEntity.ok()
                .headers(headers)
                .body(new ByteArrayResource(content.getData()));
    }

    @DeleteMapping("/image/{id}")
    public MessageResponse deleteImage(@AuthenticationPrincipal Long ownerId, @PathVariable Long id) {
        assetLifecycleService.delete(ownerId, id);
        return new MessageResponse("Image deleted successfully");
    }

    private static AssetCreatedResponse created(AssetView asset, String message) {
        return new AssetCreatedResponse(asset.getId(), asset.getStorageKey(), asset.getAddress(), message);
    }

    private static MultipartFile requireFile(MultipartFile image) {
        if (image == null || image.isEmpty()) {
            throw new InvalidParameterException("No image file provided");
        }
        return image;
    }

    private static Long parseId(String id) {
        if (id == null || id.isBlank()) {
            throw new InvalidParameterException("Image id is required");
        }
        try {
            return Long.valueOf(id.trim());
        } catch (NumberFormatException e) {
            throw new InvalidParameterException("Image id must be numeric", e);
        }
    }

    private static AssetUpload toUpload(MultipartFile file, String overlayProps, String textOverlay) {
        AssetUpload.AssetUploadBuilder builder = AssetUpload.builder()
                .overlayProps(overlayProps)
                .textOverlay(textOverlay);
        if (file == null) {
            return builder.build();
        }
        try {
            return builder
                    .content(file.getBytes())
                    .filename(StorageUtil.sanitizeFilename(file.getOriginalFilename()))
                    .contentType(file.getContentType())
                    .build();
        } catch (IOException e) {
            throw new InvalidParameterException("Could not read uploaded file", e);
        }
    }
}
