package com.myorg.olc.invoice;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.contracts.core.exception.OlcNonRetryableException;
import com.myorg.olc.contracts.core.exception.PoisonMessageException;
import com.myorg.olc.invoice.blob.BlobUploadListener;
import com.myorg.olc.queue.MessageHandler;
import com.myorg.olc.queue.QueueRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Hands upload notifications to the import service, either inline or through a durable queue.
 * With a queue, a failed import is retried and dead-lettered by the queue consumer.
 */
@Slf4j
public class UploadNotificationRouter implements BlobUploadListener {

    static final String OBJECT_KEY = "objectKey";

    private final InvoiceImportService imports;
    private final QueueRegistry queues;   // null when inline
    private final String uploadQueue;     // null when inline
    private final ObjectMapper mapper;

    public UploadNotificationRouter(InvoiceImportService imports, QueueRegistry queues, String uploadQueue, ObjectMapper mapper) {
        this.imports = imports;
        this.queues = queues;
        this.uploadQueue = uploadQueue == null || uploadQueue.isBlank() ? null : uploadQueue;
        this.mapper = mapper;
        if (this.uploadQueue != null && queues == null) {
            throw new IllegalStateException("upload queue " + uploadQueue + " configured without a queue registry");
        }
    }

    @Override
    public void onUploadCompleted(String objectKey) {
        if (uploadQueue == null) {
            importInline(objectKey);
            return;
        }
        String body = mapper.createObjectNode().put(OBJECT_KEY, objectKey).toString();
        String id = queues.queue(uploadQueue).enqueue(body, Map.of(OBJECT_KEY, objectKey));
        log.debug("Upload notification queued queue={} messageId={} key={}", uploadQueue, id, objectKey);
    }

    // without a queue nothing redelivers, so retryable failures are retried here up to the import's bound
    private void importInline(String objectKey) {
        int max = imports.maxProcessingAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                imports.onUploadCompleted(objectKey);
                return;
            } catch (OlcNonRetryableException e) {
                throw e;
            } catch (RuntimeException e) {
                if (attempt >= max) throw e;
                log.warn("Inline import failed, retrying key={} attempt={}/{} error={}", objectKey, attempt, max, e.toString());
            }
        }
    }

    public boolean isQueued() {
        return uploadQueue != null;
    }

    /** Consumer side of the upload queue. */
    public MessageHandler queueHandler() {
        return message -> imports.onUploadCompleted(objectKeyOf(message.body()));
    }

    String objectKeyOf(String body) {
        JsonNode n;
        try {
            n = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PoisonMessageException("upload notification is not JSON", e);
        }
        JsonNode key = n == null ? null : n.get(OBJECT_KEY);
        if (key == null || !key.isTextual() || key.asText().isBlank()) {
            throw new PoisonMessageException("upload notification has no " + OBJECT_KEY);
        }
        return key.asText();
    }
}
