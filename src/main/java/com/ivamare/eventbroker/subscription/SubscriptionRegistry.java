package com.ivamare.eventbroker.subscription;

import com.ivamare.eventbroker.handler.MessageHandler;

import java.util.List;

/**
 * Registry of stream handlers to start subscriptions for.
 */
public interface SubscriptionRegistry {

    /**
     * Bind a handler to a stream.
     *
     * @param stream Stream category
     * @param handler Handler
     * @param consumerGroup Consumer group, or null for the handler's class name
     * @throws IllegalArgumentException if the same handler is already bound to the stream
     */
    void register(String stream, MessageHandler handler, String consumerGroup);

    /**
     * Scan a bean for {@link com.ivamare.eventbroker.handler.StreamHandler} and register it.
     *
     * @param bean The bean to inspect
     * @return the binding created, or null if the bean is not a stream handler
     */
    SubscriptionBinding registerBean(Object bean);

    List<SubscriptionBinding> bindings();

    void clear();
}
