package com.myorg.olc.invoice.blob;

/**
 * Notified after an object arrived through an upload target.
 */
@FunctionalInterface
public interface BlobUploadListener {
    void onUploadCompleted(String objectKey);
}
