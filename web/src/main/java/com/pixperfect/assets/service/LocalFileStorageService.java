package com.pixperfect.assets.service;

import com.pixperfect.assets.common.exception.StorageUnavailableException;
import com.pixperfect.assets.common.util.StorageUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.*;

@Service
@Profile("!s3 & !azure") // default backend when no remote store is selected
public class LocalFileStorageService implements StorageService {

    private static final Logger logger = LoggerFactory.getLogger(LocalFileStorageService.class);

    public static final String UPLOADS_PATH = "/uploads/";

    private final Path rootLocation;
    private final String publicBaseUrl;

    @Autowired
    public LocalFileStorageService(@Value("${assets.storage.directory:storage}") String storageDirectory,
                                   @Value("${assets.storage.public-base-url:}") String publicBaseUrl) {
        this(Paths.get(storageDirectory), publicBaseUrl);
    }

    public LocalFileStorageService(Path storageDirectory, String publicBaseUrl) {
        this.rootLocation = storageDirectory.toAbsolutePath().normalize();
        this.publicBaseUrl = stripTrailingSlash(publicBaseUrl);
        try {
            Files.createDirectories(rootLocation);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create local storage directory: " + rootLocation, e);
        }
        logger.info("Local storage directory: {}", rootLocation);
    }

    public Path getRootLocation() {
        return rootLocation;
    }

    @Override
    public String put(byte[] data, String suggestedName, String contentType) {
        String key = StorageUtil.generateKey(suggestedName);
        Path targetLocation = resolvePath(key);
        try {
            Files.write(targetLocation, data, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (FileAlreadyExistsException e) {
            throw new StorageUnavailableException("Refusing to overwrite existing blob: " + key, e);
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to store file: " + key, e);
        }
        logger.info("Stored file: {} ({} bytes)", targetLocation, data.length);
        return key;
    }

    @Override
    public String resolve(String key) {
        return publicBaseUrl + UPLOADS_PATH + key;
    }

    @Override
    public byte[] read(String key) {
        Path file = resolvePath(key);
        try {
            return Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw new StorageUnavailableException("File not found: " + key, e);
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to read file: " + key, e);
        }
    }

    @Override
    public BlobDeletion delete(String key) {
        Path file;
        try {
            file = resolvePath(key);
        } catch (StorageUnavailableException e) {
            logger.error("Refusing to delete key outside storage root: {}", key);
            return BlobDeletion.FAILED;
        }
        try {
            if (Files.deleteIfExists(file)) {
                logger.info("Deleted file: {}", file);
                return BlobDeletion.DELETED;
            }
            logger.info("File already absent: {}", file);
            return BlobDeletion.ALREADY_ABSENT;
        } catch (IOException e) {
            logger.error("Failed to delete file: {}", file, e);
            return BlobDeletion.FAILED;
        }
    }

    @Override
    public String getStorageType() {
        return "local";
    }

    private Path resolvePath(String key) {
        Path resolved = rootLocation.resolve(key).normalize();
        if (!resolved.startsWith(rootLocation) || resolved.equals(rootLocation)) {
            throw new StorageUnavailableException("Cannot access file outside storage directory: " + key);
        }
        return resolved;
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
