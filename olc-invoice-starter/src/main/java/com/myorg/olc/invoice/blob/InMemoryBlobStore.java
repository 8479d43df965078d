package com.myorg.olc.invoice.blob;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Single-instance blob store for development and tests. Upload targets are plain URLs under
 * {@code uploadBaseUrl}; something in front of the store (a controller) turns requests on them
 * into {@link #upload(String, byte[])} calls.
 */
@Slf4j
public class InMemoryBlobStore implements BlobStore {

    private final ConcurrentHashMap<String, byte[]> objects = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Instant> targets = new ConcurrentHashMap<>();
    private final List<BlobUploadListener> listeners = new CopyOnWriteArrayList<>();

    private final Clock clock;
    private final String uploadBaseUrl;

    public InMemoryBlobStore(Clock clock, String uploadBaseUrl) {
        this.clock = clock;
        this.uploadBaseUrl = uploadBaseUrl.endsWith("/") ? uploadBaseUrl : uploadBaseUrl + "/";
    }

    @Override
    public UploadTarget createUploadTarget(String objectKey, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("upload ttl must be positive");
        }
        Instant expiresAt = clock.instant().plus(ttl);
        targets.put(objectKey, expiresAt);
        return new UploadTarget(objectKey, uploadBaseUrl + objectKey, expiresAt);
    }

    @Override
    public void upload(String objectKey, byte[] content) {
        Instant expiresAt = targets.get(objectKey);
        if (expiresAt == null) {
            throw new UploadRejectedException("no upload target for " + objectKey);
        }
        if (!clock.instant().isBefore(expiresAt)) {
            targets.remove(objectKey);
            throw new UploadRejectedException("upload target for " + objectKey + " expired at " + expiresAt);
        }
        objects.put(objectKey, content.clone());
        log.debug("Blob stored key={} bytes={}", objectKey, content.length);

        for (BlobUploadListener l : listeners) {
            try {
                l.onUploadCompleted(objectKey);
            } catch (RuntimeException e) {
                // the object is stored; the listener owns reporting its own failure
                log.warn("Upload listener {} failed key={} error={}", l.getClass().getSimpleName(), objectKey, e.toString());
            }
        }
    }

    @Override
    public Optional<byte[]> get(String objectKey) {
        byte[] b = objects.get(objectKey);
        return b == null ? Optional.empty() : Optional.of(b.clone());
    }

    @Override
    public void delete(String objectKey) {
        objects.remove(objectKey);
        targets.remove(objectKey);
    }

    @Override
    public void addUploadListener(BlobUploadListener listener) {
        listeners.add(listener);
    }
}
