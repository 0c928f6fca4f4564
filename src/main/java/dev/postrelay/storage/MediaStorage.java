package dev.postrelay.storage;

import java.io.InputStream;

/**
 * Opaque store of generated media artifacts, addressed by reference.
 */
public interface MediaStorage {

    /**
     * Store an artifact and return its reference.
     */
    String put(String fileName, InputStream content);

    /**
     * Open an artifact for reading.
     */
    InputStream open(String ref);

    boolean exists(String ref);

    /**
     * Size in bytes, or 0 when the artifact is missing.
     */
    long size(String ref);

    /**
     * Delete an artifact.
     *
     * @return true if a file was removed, false if it was already missing
     */
    boolean delete(String ref);
}
