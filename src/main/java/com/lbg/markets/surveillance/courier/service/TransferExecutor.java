package com.lbg.markets.surveillance.courier.service;

import com.lbg.markets.surveillance.courier.exception.ChecksumMismatchException;
import com.lbg.markets.surveillance.courier.exception.StorageNetworkException;
import com.lbg.markets.surveillance.courier.exception.TransferException;
import com.lbg.markets.surveillance.courier.exception.TransferTimeoutException;
import com.lbg.markets.surveillance.courier.model.ObjectLocation;
import com.lbg.markets.surveillance.courier.model.TransferEvent;
import com.lbg.markets.surveillance.courier.model.TransferResult;
import com.lbg.markets.surveillance.courier.service.metrics.MetricsRecorder;
import com.lbg.markets.surveillance.courier.service.storage.ObjectStorage;
import com.lbg.markets.surveillance.courier.service.storage.StorageResolver;
import com.lbg.markets.surveillance.courier.service.storage.StoredObject;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.function.BooleanSupplier;

/**
 * Performs one transfer attempt: read the source, write the destination, verify integrity.
 * <p>
 * The object is first written under a temporary key next to the destination and only moved
 * into place once its checksum has been verified, so a failed attempt never leaves a
 * complete-looking destination object behind. The temporary key is unique per attempt.
 * <p>
 * A cancelled attempt stops before its destination write and before its move into place.
 */
@ApplicationScoped
public class TransferExecutor {

    private static final Logger LOG = Logger.getLogger(TransferExecutor.class);
    private static final int BUFFER_SIZE = 8192;
    static final String TEMP_KEY_SUFFIX = ".part-";

    private final StorageResolver storageResolver;
    private final MetricsRecorder metrics;

    @Inject
    public TransferExecutor(StorageResolver storageResolver, MetricsRecorder metrics) {
        this.storageResolver = storageResolver;
        this.metrics = metrics;
    }

    /**
     * @param attempt   1-based attempt number, used to keep each attempt's temporary object apart
     * @param cancelled polled before each destination side effect
     */
    public TransferResult execute(TransferEvent event, int attempt, BooleanSupplier cancelled)
            throws TransferException {
        long started = System.nanoTime();
        long bytes = 0;
        boolean success = false;

        try {
            ObjectStorage source = storageResolver.resolve(event.source().provider());
            ObjectStorage destination = storageResolver.resolve(event.destination().provider());

            ObjectLocation from = event.source();
            ObjectLocation to = event.destination();

            byte[] content;
            String sourceContentType;
            MessageDigest digest = newDigest();
            try (StoredObject object = source.read(from.bucket(), from.key())) {
                content = readDigesting(object.content(), digest);
                sourceContentType = object.contentType();
            } catch (IOException e) {
                throw new StorageNetworkException("Failed reading " + from + ": " + e.getMessage(), e);
            }
            bytes = content.length;
            String actualChecksum = HexFormat.of().formatHex(digest.digest());

            String contentType = event.metadata().contentType() != null
                    ? event.metadata().contentType()
                    : sourceContentType;
            String tempKey = temporaryKey(event, attempt);

            if (cancelled.getAsBoolean()) {
                throw cancelledBefore("write", event, attempt);
            }
            destination.write(to.bucket(), tempKey, content, contentType);

            if (event.metadata().hasChecksum() && !event.metadata().checksumSha256().equals(actualChecksum)) {
                discard(destination, to.bucket(), tempKey);
                throw new ChecksumMismatchException(event.metadata().checksumSha256(), actualChecksum);
            }

            if (cancelled.getAsBoolean()) {
                discard(destination, to.bucket(), tempKey);
                throw cancelledBefore("move", event, attempt);
            }
            destination.move(to.bucket(), tempKey, to.key());

            double durationSeconds = (System.nanoTime() - started) / 1_000_000_000.0;
            LOG.debugf("Transferred %d bytes %s -> %s in %.3fs", bytes, from, to, durationSeconds);
            success = true;
            return new TransferResult(bytes, durationSeconds, actualChecksum);
        } finally {
            metrics.recordAttempt(Duration.ofNanos(System.nanoTime() - started), bytes, success);
        }
    }

    static String temporaryKey(TransferEvent event, int attempt) {
        return event.destination().key() + TEMP_KEY_SUFFIX + event.eventId() + "-" + attempt;
    }

    private static TransferTimeoutException cancelledBefore(String stage, TransferEvent event, int attempt) {
        return new TransferTimeoutException(
                "Attempt " + attempt + " of " + event.eventId() + " cancelled before " + stage);
    }

    private static byte[] readDigesting(InputStream input, MessageDigest digest) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        byte[] chunk = new byte[BUFFER_SIZE];
        int read;
        while ((read = input.read(chunk)) != -1) {
            if (Thread.currentThread().isInterrupted()) {
                throw new IOException("Read interrupted");
            }
            digest.update(chunk, 0, read);
            buffer.write(chunk, 0, read);
        }
        return buffer.toByteArray();
    }

    /**
     * Remove a rejected temporary object. A failure here is logged; the mismatch is what gets reported.
     */
    private static void discard(ObjectStorage storage, String bucket, String key) {
        try {
            storage.delete(bucket, key);
        } catch (TransferException e) {
            LOG.errorf(e, "Failed to delete rejected object %s/%s", bucket, key);
        }
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
