package com.proxymirror.host;

/**
 * Exclusive permission to modify a document's tree. Closing twice is harmless.
 */
public interface WriteScope extends AutoCloseable {

    @Override
    void close();
}
