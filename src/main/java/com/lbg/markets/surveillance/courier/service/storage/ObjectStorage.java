package com.lbg.markets.surveillance.courier.service.storage;

import com.lbg.markets.surveillance.courier.exception.TransferException;

/**
 * Storage backend for one provider. Failures surface as the transfer error taxonomy.
 */
public interface ObjectStorage {

    /**
     * Open an object for streaming read. The caller closes the returned object.
     */
    StoredObject read(String bucket, String key) throws TransferException;

    void write(String bucket, String key, byte[] content, String contentType) throws TransferException;

    /**
     * Delete an object. Deleting a missing object is not an error.
     */
    void delete(String bucket, String key) throws TransferException;

    /**
     * Move an object within a bucket, replacing any object at the target key.
     */
    void move(String bucket, String fromKey, String toKey) throws TransferException;

    boolean exists(String bucket, String key) throws TransferException;
}
