package com.pixperfect.assets.service;

/**
 * Outcome of {@link StorageService#delete(String)}.
 */
public enum BlobDeletion {
    DELETED,
    ALREADY_ABSENT,
    FAILED
}
