package com.lbg.markets.surveillance.courier.service.storage;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/**
 * An object opened for reading.
 *
 * @param content     object bytes, read once
 * @param contentType content type recorded by the backend, may be null
 */
public record StoredObject(InputStream content, String contentType) implements Closeable {

    @Override
    public void close() throws IOException {
        content.close();
    }
}
