package com.myorg.olc.invoice.blob;

import java.time.Instant;

/**
 * Where a client may upload one object, and until when.
 */
public record UploadTarget(String objectKey, String url, Instant expiresAt) {}
