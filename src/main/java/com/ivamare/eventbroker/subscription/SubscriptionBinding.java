package com.ivamare.eventbroker.subscription;

import com.ivamare.eventbroker.handler.MessageHandler;

/**
 * A handler bound to a stream.
 *
 * @param stream Stream category
 * @param handler Handler receiving the stream's messages
 * @param consumerGroup Consumer group, or null for the handler's class name
 */
public record SubscriptionBinding(
    String stream,
    MessageHandler handler,
    String consumerGroup
) {}
