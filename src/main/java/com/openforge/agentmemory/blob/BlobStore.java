package com.openforge.agentmemory.blob;

import com.openforge.agentmemory.exception.ValidationException;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Read access to source documents kept in named buckets.
 */
public interface BlobStore {

    /**
     * @return the object's text, or empty when {@code key} does not exist in {@code bucket}
     * @throws com.openforge.agentmemory.exception.UpstreamException when the store cannot be read
     */
    Optional<String> read(String bucket, String key);

    /**
     * Rejects keys that are absolute or climb out of their bucket.
     *
     * @throws ValidationException for such keys
     */
    static void checkKey(String key) {
        Path normalized;
        try {
            normalized = Path.of(key).normalize();
        } catch (InvalidPathException e) {
            throw new ValidationException("Invalid file key: " + key);
        }
        if (normalized.isAbsolute()
                || normalized.toString().isEmpty()
                || normalized.startsWith("..")) {
            throw new ValidationException("Invalid file key: " + key);
        }
    }
}
