package com.ivamare.eventbroker.handler;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a {@link MessageHandler} bean as a subscriber of a stream.
 *
 * <p>Example:
 * <pre>
 * &#64;Component
 * &#64;StreamHandler(stream = "orders")
 * public class OrderProjector implements MessageHandler {
 *     public void handle(Message message, Object event) {
 *         // ...
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface StreamHandler {

    /**
     * Stream category to consume.
     */
    String stream();

    /**
     * Consumer group name. Defaults to the handler's fully qualified class name.
     */
    String consumerGroup() default "";
}
