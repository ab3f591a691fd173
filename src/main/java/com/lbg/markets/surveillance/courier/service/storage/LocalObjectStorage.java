package com.lbg.markets.surveillance.courier.service.storage;

import com.lbg.markets.surveillance.courier.exception.SourceNotFoundException;
import com.lbg.markets.surveillance.courier.exception.StorageNetworkException;
import com.lbg.markets.surveillance.courier.exception.StoragePermissionException;
import com.lbg.markets.surveillance.courier.exception.TransferException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Filesystem-backed storage. Objects live at {@code <root>/<bucket>/<key>}.
 */
public class LocalObjectStorage implements ObjectStorage {

    private static final Logger LOG = Logger.getLogger(LocalObjectStorage.class);
    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private final Path root;

    public LocalObjectStorage(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public StoredObject read(String bucket, String key) throws TransferException {
        Path path = resolve(bucket, key);
        if (!Files.isRegularFile(path)) {
            throw new SourceNotFoundException(bucket, key);
        }
        try {
            return new StoredObject(Files.newInputStream(path), detectContentType(path));
        } catch (NoSuchFileException e) {
            throw new SourceNotFoundException(bucket, key, e);
        } catch (AccessDeniedException e) {
            throw new StoragePermissionException("Read denied: " + bucket + "/" + key, e);
        } catch (IOException e) {
            throw new StorageNetworkException("Failed to open " + bucket + "/" + key, e);
        }
    }

    @Override
    public void write(String bucket, String key, byte[] content, String contentType) throws TransferException {
        Path target = resolve(bucket, key);
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(target.getParent());
            Files.write(temp, content);
            moveReplacing(temp, target);
            LOG.debugf("Wrote %d bytes to %s", content.length, target);
        } catch (AccessDeniedException e) {
            throw new StoragePermissionException("Write denied: " + bucket + "/" + key, e);
        } catch (IOException e) {
            throw new StorageNetworkException("Failed to write " + bucket + "/" + key, e);
        }
    }

    @Override
    public void delete(String bucket, String key) throws TransferException {
        try {
            Files.deleteIfExists(resolve(bucket, key));
        } catch (AccessDeniedException e) {
            throw new StoragePermissionException("Delete denied: " + bucket + "/" + key, e);
        } catch (IOException e) {
            throw new StorageNetworkException("Failed to delete " + bucket + "/" + key, e);
        }
    }

    @Override
    public void move(String bucket, String fromKey, String toKey) throws TransferException {
        Path from = resolve(bucket, fromKey);
        Path to = resolve(bucket, toKey);
        try {
            Files.createDirectories(to.getParent());
            moveReplacing(from, to);
        } catch (NoSuchFileException e) {
            throw new SourceNotFoundException(bucket, fromKey, e);
        } catch (AccessDeniedException e) {
            throw new StoragePermissionException("Move denied: " + bucket + "/" + fromKey, e);
        } catch (IOException e) {
            throw new StorageNetworkException("Failed to move " + bucket + "/" + fromKey + " to " + toKey, e);
        }
    }

    @Override
    public boolean exists(String bucket, String key) throws TransferException {
        return Files.isRegularFile(resolve(bucket, key));
    }

    /**
     * Resolve an object path, refusing keys that escape the bucket directory.
     */
    Path resolve(String bucket, String key) throws TransferException {
        Path bucketDir = root.resolve(bucket).normalize();
        Path path = bucketDir.resolve(key).normalize();
        if (!bucketDir.startsWith(root) || !path.startsWith(bucketDir) || path.equals(bucketDir)) {
            throw new StoragePermissionException("Object path escapes storage root: " + bucket + "/" + key);
        }
        return path;
    }

    private static void moveReplacing(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private String detectContentType(Path path) {
        try {
            String contentType = Files.probeContentType(path);
            return contentType != null ? contentType : DEFAULT_CONTENT_TYPE;
        } catch (IOException e) {
            return DEFAULT_CONTENT_TYPE;
        }
    }

    public Path getRoot() {
        return root;
    }
}
