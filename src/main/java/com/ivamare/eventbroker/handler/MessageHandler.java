package com.ivamare.eventbroker.handler;

import com.ivamare.eventbroker.model.Message;

/**
 * Functional interface for stream message handlers.
 *
 * <p>Any exception thrown counts as a processing failure and drives the
 * subscription's retry and dead-letter policy.
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * Process a message.
     *
     * @param message The validated message
     * @param domainObject The message data converted to its registered type
     * @throws Exception on processing failure
     */
    void handle(Message message, Object domainObject) throws Exception;
}
