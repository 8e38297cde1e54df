package prism.coordinator.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * ObjectStore writing each bucket as a directory under a root directory.
 * Writes go to a temp file first and are moved into place.
 */
public class FileSystemObjectStore implements ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemObjectStore.class);

    private final Path root;

    public FileSystemObjectStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public void upload(String bucket, String objectName, byte[] content) throws IOException {
        Path target = resolve(bucket, objectName);
        Files.createDirectories(target.getParent());
        Path tmp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
        try {
            Files.write(tmp, content);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.debug("Stored {}/{} ({} bytes)", bucket, objectName, content.length);
    }

    @Override
    public boolean exists(String bucket, String objectName) {
        return Files.isRegularFile(resolve(bucket, objectName));
    }

    @Override
    public InputStream open(String bucket, String objectName) throws IOException {
        Path path = resolve(bucket, objectName);
        if (!Files.isRegularFile(path)) {
            throw new FileNotFoundException(bucket + "/" + objectName);
        }
        return Files.newInputStream(path);
    }

    private Path resolve(String bucket, String objectName) {
        requireName(bucket, "bucket");
        requireName(objectName, "object_name");
        Path path = root.resolve(bucket).resolve(objectName).normalize();
        if (!path.startsWith(root.resolve(bucket))) {
            throw new IllegalArgumentException("object name escapes bucket: " + objectName);
        }
        return path;
    }

    private static void requireName(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " is required");
        }
        if (value.contains("..") || value.startsWith("/") || value.contains("\\")) {
            throw new IllegalArgumentException("invalid " + what + ": " + value);
        }
    }
}
