package com.myorg.olc.queue;

/**
 * Processes one message. Returning normally acknowledges it; throwing leaves it for redelivery
 * or, once its budget is spent, for the dead-letter queue.
 */
@FunctionalInterface
public interface MessageHandler {
    void handle(QueueMessage message) throws Exception;
}
