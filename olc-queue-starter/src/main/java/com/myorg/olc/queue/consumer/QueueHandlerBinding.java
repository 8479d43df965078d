package com.myorg.olc.queue.consumer;

import com.myorg.olc.queue.MessageHandler;

/**
 * Declare as a bean to have {@code handler} consume {@code queue}.
 */
public record QueueHandlerBinding(String queue, MessageHandler handler) {}
