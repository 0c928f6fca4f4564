package dev.postrelay.storage;

import dev.postrelay.config.StorageProperties;
import dev.postrelay.exception.StorageFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Media storage on the local file system. References are file names inside the media directory;
 * any directory part of a reference is ignored.
 */
@Slf4j
@Component
public class FileSystemMediaStorage implements MediaStorage {

    private final Path root;

    public FileSystemMediaStorage(StorageProperties properties) {
        this.root = Paths.get(properties.getMediaDir()).toAbsolutePath().normalize();
        log.info("Media storage directory: {}", root);
    }

    @Override
    public String put(String fileName, InputStream content) {
        Path target = resolve(fileName);
        try {
            Files.createDirectories(root);
            Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
            return target.getFileName().toString();
        } catch (IOException e) {
            throw new StorageFailureException("Failed to store artifact " + fileName, e);
        }
    }

    @Override
    public InputStream open(String ref) {
        try {
            return Files.newInputStream(resolve(ref));
        } catch (IOException e) {
            throw new StorageFailureException("Failed to open artifact " + ref, e);
        }
    }

    @Override
    public boolean exists(String ref) {
        return ref != null && !ref.isBlank() && Files.isRegularFile(resolve(ref));
    }

    @Override
    public long size(String ref) {
        if (!exists(ref)) {
            return 0L;
        }
        try {
            return Files.size(resolve(ref));
        } catch (IOException e) {
            log.debug("Could not read size of {}: {}", ref, e.getMessage());
            return 0L;
        }
    }

    @Override
    public boolean delete(String ref) {
        if (ref == null || ref.isBlank()) {
            return false;
        }
        try {
            return Files.deleteIfExists(resolve(ref));
        } catch (IOException e) {
            throw new StorageFailureException("Failed to delete artifact " + ref, e);
        }
    }

    private Path resolve(String ref) {
        Path fileName = Paths.get(ref).getFileName();
        if (fileName == null) {
            throw new IllegalArgumentException("Invalid media reference: " + ref);
        }
        return root.resolve(fileName.toString());
    }
}
