package com.lbg.markets.surveillance.courier.service.storage;

import com.google.cloud.ReadChannel;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import com.google.cloud.storage.StorageOptions;
import com.lbg.markets.surveillance.courier.config.CourierConfiguration;
import com.lbg.markets.surveillance.courier.exception.RateLimitedException;
import com.lbg.markets.surveillance.courier.exception.SourceNotFoundException;
import com.lbg.markets.surveillance.courier.exception.StorageNetworkException;
import com.lbg.markets.surveillance.courier.exception.StoragePermissionException;
import com.lbg.markets.surveillance.courier.exception.StorageUnavailableException;
import com.lbg.markets.surveillance.courier.exception.TransferException;
import com.lbg.markets.surveillance.courier.exception.TransferTimeoutException;
import com.lbg.markets.surveillance.courier.exception.UnclassifiedTransferException;
import org.jboss.logging.Logger;

import java.nio.channels.Channels;

/**
 * Google Cloud Storage backend.
 */
public class GcsObjectStorage implements ObjectStorage {

    private static final Logger LOG = Logger.getLogger(GcsObjectStorage.class);

    private final Storage storage;

    public GcsObjectStorage(Storage storage) {
        this.storage = storage;
    }

    /**
     * Build a client for the configured project, pointing at an emulator when one is set.
     */
    public static GcsObjectStorage create(CourierConfiguration.GcsConfig config) {
        StorageOptions.Builder builder = StorageOptions.newBuilder()
                .setProjectId(config.projectId());

        if (config.emulatorHost().isPresent()) {
            builder.setHost("http://" + config.emulatorHost().get());
        }

        LOG.infof("GCS storage initialized for project: %s", config.projectId());
        return new GcsObjectStorage(builder.build().getService());
    }

    @Override
    public StoredObject read(String bucket, String key) throws TransferException {
        try {
            Blob blob = storage.get(BlobId.of(bucket, key));
            if (blob == null || !blob.exists()) {
                throw new SourceNotFoundException(bucket, key);
            }
            ReadChannel reader = blob.reader();
            return new StoredObject(Channels.newInputStream(reader), blob.getContentType());
        } catch (StorageException e) {
            throw translate(e, bucket, key);
        }
    }

    @Override
    public void write(String bucket, String key, byte[] content, String contentType) throws TransferException {
        BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(bucket, key))
                .setContentType(contentType)
                .build();
        try {
            storage.create(blobInfo, content);
            LOG.debugf("Uploaded %d bytes to gs://%s/%s", content.length, bucket, key);
        } catch (StorageException e) {
            throw translate(e, bucket, key);
        }
    }

    @Override
    public void delete(String bucket, String key) throws TransferException {
        try {
            storage.delete(BlobId.of(bucket, key));
        } catch (StorageException e) {
            throw translate(e, bucket, key);
        }
    }

    @Override
    public void move(String bucket, String fromKey, String toKey) throws TransferException {
        BlobId source = BlobId.of(bucket, fromKey);
        try {
            storage.copy(Storage.CopyRequest.of(source, BlobId.of(bucket, toKey))).getResult();
            storage.delete(source);
        } catch (StorageException e) {
            throw translate(e, bucket, fromKey);
        }
    }

    @Override
    public boolean exists(String bucket, String key) throws TransferException {
        try {
            Blob blob = storage.get(BlobId.of(bucket, key));
            return blob != null && blob.exists();
        } catch (StorageException e) {
            throw translate(e, bucket, key);
        }
    }

    /**
     * Map a GCS failure onto the transfer error taxonomy by HTTP status.
     */
    static TransferException translate(StorageException e, String bucket, String key) {
        String object = "gs://" + bucket + "/" + key;
        return switch (e.getCode()) {
            case 404 -> new SourceNotFoundException(bucket, key, e);
            case 401, 403 -> new StoragePermissionException("Access denied to " + object, e);
            case 408 -> new TransferTimeoutException("Request timed out for " + object, e);
            case 429 -> new RateLimitedException("Rate limited on " + object, e);
            case 500, 502, 503, 504 -> new StorageUnavailableException(
                    "GCS unavailable (" + e.getCode() + ") for " + object, e);
            default -> e.isRetryable() || e.getCode() == 0
                    ? new StorageNetworkException("GCS request failed for " + object + ": " + e.getMessage(), e)
                    : new UnclassifiedTransferException("GCS error " + e.getCode() + " for " + object, e);
        };
    }
}
