package com.pixperfect.assets.common.util;

import java.util.UUID;

public final class StorageUtil {

    private static final int MAX_NAME_LENGTH = 100;

    private StorageUtil() {
    }

    /**
     * Builds a fresh storage key for a blob. The random prefix keeps keys unique
     * when the same name is uploaded concurrently; the name suffix keeps them readable.
     */
    public static String generateKey(String suggestedName) {
        return UUID.randomUUID() + "-" + sanitizeFilename(suggestedName);
    }

    public static String sanitizeFilename(String filename) {
        if (filename == null || filename.isBlank()) {
            return "image";
        }
        String name = extractFilename(filename.replace('\\', '/'));
        String cleaned = name.replaceAll("[^A-Za-z0-9._-]", "_");
        while (cleaned.startsWith(".")) {
            cleaned = cleaned.substring(1);
        }
        if (cleaned.isEmpty()) {
            return "image";
        }
        return cleaned.length() > MAX_NAME_LENGTH ? cleaned.substring(cleaned.length() - MAX_NAME_LENGTH) : cleaned;
    }

    public static String extractFilename(String key) {
        int lastSlashIndex = key.lastIndexOf('/');
        return lastSlashIndex >= 0 ? key.substring(lastSlashIndex + 1) : key;
    }

    public static String getExtension(String filename) {
        int dotIndex = filename.lastIndexOf('.');
        return dotIndex > 0 ? filename.substring(dotIndex) : "";
    }

    /**
     * Swaps the extension of a name, e.g. {@code photo.jpg -> photo.png}.
     */
    public static String withExtension(String filename, String extension) {
        String name = sanitizeFilename(filename);
        String current = getExtension(name);
        String base = current.isEmpty() ? name : name.substring(0, name.length() - current.length());
        return base + extension;
    }
}
