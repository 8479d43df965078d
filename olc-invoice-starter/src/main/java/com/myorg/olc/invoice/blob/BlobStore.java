package com.myorg.olc.invoice.blob;

import java.time.Duration;
import java.util.Optional;

/**
 * Object storage for uploaded import files.
 */
public interface BlobStore {

    /**
     * Issues a time-bounded target for {@code objectKey}. Uploads through it are accepted until
     * {@link UploadTarget#expiresAt()} and then announced to every {@link BlobUploadListener}.
     */
    UploadTarget createUploadTarget(String objectKey, Duration ttl);

    /**
     * Stores {@code content} through a previously issued target.
     *
     * @throws UploadRejectedException if no target was issued for the key or it has expired
     */
    void upload(String objectKey, byte[] content);

    Optional<byte[]> get(String objectKey);

    /** Deleting an absent object is not an error. */
    void delete(String objectKey);

    void addUploadListener(BlobUploadListener listener);
}
