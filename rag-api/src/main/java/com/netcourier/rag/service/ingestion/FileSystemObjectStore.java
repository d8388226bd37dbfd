package com.netcourier.rag.service.ingestion;

import com.netcourier.rag.config.RagProperties;
import com.netcourier.rag.service.PipelineException;
import com.netcourier.rag.service.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

@Component
public class FileSystemObjectStore implements ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemObjectStore.class);

    private final Path root;

    @Autowired
    public FileSystemObjectStore(RagProperties properties) {
        this(Paths.get(properties.storage().root()));
    }

    public FileSystemObjectStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public StoredObject fetch(String bucket, String key) {
        Path path = resolve(bucket, key);
        try {
            byte[] content = Files.readAllBytes(path);
            return new StoredObject(bucket, key, content, Files.probeContentType(path));
        } catch (NoSuchFileException e) {
            throw new PipelineException(HttpStatus.NOT_FOUND, PipelineStage.INGESTION,
                    "Object " + bucket + "/" + key + " not found", e);
        } catch (IOException e) {
            throw new PipelineException(HttpStatus.INTERNAL_SERVER_ERROR, PipelineStage.INGESTION,
                    "Unable to read object " + bucket + "/" + key, e);
        }
    }

    @Override
    public void store(String bucket, String key, byte[] content, String contentType) {
        Path path = resolve(bucket, key);
        try {
            Files.createDirectories(path.getParent());
            Files.write(path, content);
            log.debug("Stored object {}/{} ({} bytes)", bucket, key, content.length);
        } catch (IOException e) {
            throw new PipelineException(HttpStatus.INTERNAL_SERVER_ERROR, PipelineStage.INGESTION,
                    "Unable to write object " + bucket + "/" + key, e);
        }
    }

    private Path resolve(String bucket, String key) {
        if (bucket == null || bucket.isBlank() || key == null || key.isBlank()) {
            throw new PipelineException(HttpStatus.BAD_REQUEST, PipelineStage.INGESTION, "Bucket and key are required");
        }
        Path bucketRoot = root.resolve(bucket).normalize();
        Path path = bucketRoot.resolve(key).normalize();
        if (!bucketRoot.startsWith(root) || !path.startsWith(bucketRoot)) {
            throw new PipelineException(HttpStatus.BAD_REQUEST, PipelineStage.INGESTION, "Invalid object key " + key);
        }
        return path;
    }
}
