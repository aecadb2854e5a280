package com.aec.FileVault.storage;

import java.io.InputStream;

/**
 * Opaque blob store addressed by key. It knows nothing about owners or listings;
 * every failure surfaces as a {@link com.aec.FileVault.exception.FileVaultException}.
 */
public interface ObjectStorageGateway {

    /** Writes the blob, replacing any blob under the same key. */
    void put(String key, InputStream content, long size, String contentType);

    /**
     * Opens the blob for reading. The caller closes the stream.
     * A missing key fails with NOT_FOUND, anything else with STORAGE_FAILURE.
     */
    InputStream get(String key);

    /** Removes the blob; deleting a missing key is not an error. */
    void delete(String key);
}
