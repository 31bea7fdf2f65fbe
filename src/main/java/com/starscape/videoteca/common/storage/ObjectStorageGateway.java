package com.starscape.videoteca.common.storage;

import java.io.InputStream;
import java.time.Duration;

/**
 * Blob store holding the uploaded video files.
 *
 * <p>Implementations fail with {@link com.starscape.videoteca.common.exception.StorageException}
 * on I/O errors and with {@link com.starscape.videoteca.common.exception.NotFoundException}
 * where a missing object matters.
 */
public interface ObjectStorageGateway {
    
    /**
     * Upload content under the given key. Overwrites an existing object with the same key.
     *
     * @param key the storage key
     * @param content the bytes to store, read exactly {@code contentLength} bytes
     * @param contentLength number of bytes in {@code content}
     * @param contentType media type stored with the object
     * @return acknowledgement carrying the object's ETag
     */
    StoredObject put(String key, InputStream content, long contentLength, String contentType);
    
    /**
     * Issue a URL granting unauthenticated read access to the object for {@code ttl}.
     * Fails with NotFoundException if no object exists under the key.
     */
    SignedUrl signedUrl(String key, Duration ttl);
    
    /**
     * Delete the object. Deleting a missing key is not an error.
     */
    void delete(String key);
}
