package com.openforge.agentmemory.blob;

import com.openforge.agentmemory.exception.UpstreamException;
import com.openforge.agentmemory.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * {@link BlobStore} over a local directory: {@code <root>/<bucket>/<key>}.
 * Keys may contain sub-paths ({@code memory/2026-10-18.md}) but never leave their bucket.
 */
@Slf4j
@Component
public class FileSystemBlobStore implements BlobStore {

    private final Path root;

    public FileSystemBlobStore(BlobStoreProperties props) {
        this.root = Path.of(props.root()).toAbsolutePath().normalize();
    }

    @Override
    public Optional<String> read(String bucket, String key) {
        Path bucketDir = root.resolve(bucket).normalize();
        Path object    = bucketDir.resolve(key).normalize();
        if (!bucketDir.startsWith(root) || !object.startsWith(bucketDir) || object.equals(bucketDir)) {
            throw new ValidationException("Invalid file key: " + key);
        }
        if (!Files.isRegularFile(object)) {
            log.debug("[Blob] {}/{} not found", bucket, key);
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(object, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UpstreamException("Failed to read %s/%s: %s".formatted(bucket, key, e.getMessage()), e);
        }
    }
}
