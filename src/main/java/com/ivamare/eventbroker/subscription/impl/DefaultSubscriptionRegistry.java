package com.ivamare.eventbroker.subscription.impl;

import com.ivamare.eventbroker.handler.MessageHandler;
import com.ivamare.eventbroker.handler.StreamHandler;
import com.ivamare.eventbroker.subscription.SubscriptionBinding;
import com.ivamare.eventbroker.subscription.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Default implementation of SubscriptionRegistry.
 *
 * <p>Implements BeanPostProcessor to automatically discover
 * {@link MessageHandler} beans annotated with {@link StreamHandler}.
 */
public class DefaultSubscriptionRegistry implements SubscriptionRegistry, BeanPostProcessor {

    private static final Logger log = LoggerFactory.getLogger(DefaultSubscriptionRegistry.class);

    private final List<SubscriptionBinding> bindings = new CopyOnWriteArrayList<>();

    @Override
    public void register(String stream, MessageHandler handler, String consumerGroup) {
        add(stream, handler, consumerGroup);
    }

    private synchronized SubscriptionBinding add(String stream, MessageHandler handler, String consumerGroup) {
        if (stream == null || stream.isBlank()) {
            throw new IllegalArgumentException("Stream must not be blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Handler must not be null");
        }
        String group = consumerGroup != null && !consumerGroup.isBlank() ? consumerGroup : null;
        boolean duplicate = bindings.stream()
            .anyMatch(b -> b.stream().equals(stream) && b.handler() == handler);
        if (duplicate) {
            throw new IllegalArgumentException(
                "Handler " + handler.getClass().getName() + " already subscribed to " + stream);
        }
        SubscriptionBinding binding = new SubscriptionBinding(stream, handler, group);
        bindings.add(binding);
        log.debug("Registered subscription of {} to {}", handler.getClass().getName(), stream);
        return binding;
    }

    @Override
    public SubscriptionBinding registerBean(Object bean) {
        StreamHandler annotation = AnnotationUtils.findAnnotation(bean.getClass(), StreamHandler.class);
        if (annotation == null) {
            return null;
        }
        if (!(bean instanceof MessageHandler handler)) {
            throw new IllegalArgumentException(
                "@StreamHandler bean " + bean.getClass().getName() + " must implement MessageHandler");
        }

        SubscriptionBinding binding = add(annotation.stream(), handler, annotation.consumerGroup());
        log.info("Discovered stream handler {} for stream {}",
            bean.getClass().getSimpleName(), annotation.stream());
        return binding;
    }

    @Override
    public List<SubscriptionBinding> bindings() {
        return List.copyOf(bindings);
    }

    @Override
    public void clear() {
        bindings.clear();
    }

    /**
     * BeanPostProcessor callback - registers @StreamHandler beans.
     */
    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) {
        registerBean(bean);
        return bean;
    }
}
