package com.ivamare.eventbroker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventbroker.broker.Broker;
import com.ivamare.eventbroker.broker.impl.InlineBroker;
import com.ivamare.eventbroker.broker.impl.StaleLeaseSweeper;
import com.ivamare.eventbroker.message.MessageCodec;
import com.ivamare.eventbroker.message.MessageTypeRegistry;
import com.ivamare.eventbroker.policy.RetryPolicy;
import com.ivamare.eventbroker.subscription.PriorityLaneRouter;
import com.ivamare.eventbroker.subscription.SubscriptionRegistry;
import com.ivamare.eventbroker.subscription.impl.DefaultSubscriptionRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Auto-configuration for Event Broker.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>In-process broker</li>
 *   <li>Message type registry and codec</li>
 *   <li>Priority lane router</li>
 *   <li>Subscription registry</li>
 *   <li>Retry Policy</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * eventbroker.enabled=false
 * </pre>
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "eventbroker", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(EventBrokerProperties.class)
public class EventBrokerAutoConfiguration {

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper eventBrokerObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // Register JSR310 module
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock eventBrokerClock() {
        return Clock.systemUTC();
    }

    // --- Retry Policy ---

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(EventBrokerProperties properties) {
        return properties.getBroker().toRetryPolicy();
    }

    // --- Broker ---

    @Bean
    @ConditionalOnMissingBean
    public Broker broker(ObjectMapper objectMapper, RetryPolicy retryPolicy,
                         EventBrokerProperties properties, Clock clock) {
        return new InlineBroker(
            objectMapper,
            properties.getBroker().toSettings().withRetryPolicy(retryPolicy),
            clock
        );
    }

    @Bean
    @ConditionalOnProperty(prefix = "eventbroker.broker", name = "stale-sweep-interval")
    public StaleLeaseSweeper staleLeaseSweeper(Broker broker, EventBrokerProperties properties) {
        if (!(broker instanceof InlineBroker inline)) {
            throw new IllegalStateException(
                "Stale lease sweep requires InlineBroker, found " + broker.getClass().getName());
        }
        StaleLeaseSweeper sweeper = new StaleLeaseSweeper(inline, properties.getBroker().getStaleSweepInterval());
        sweeper.start();
        return sweeper;
    }

    // --- Messages ---

    @Bean
    @ConditionalOnMissingBean
    public MessageTypeRegistry messageTypeRegistry() {
        return new MessageTypeRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageCodec messageCodec(ObjectMapper objectMapper, MessageTypeRegistry messageTypeRegistry) {
        return new MessageCodec(objectMapper, messageTypeRegistry);
    }

    // --- Subscriptions ---

    @Bean
    @ConditionalOnMissingBean
    public PriorityLaneRouter priorityLaneRouter(EventBrokerProperties properties) {
        return new PriorityLaneRouter(properties.getSubscription().getPriorityLanes().toConfig());
    }

    // Static: the registry is a BeanPostProcessor and must not pull in this configuration early
    @Bean
    @ConditionalOnMissingBean(SubscriptionRegistry.class)
    public static DefaultSubscriptionRegistry subscriptionRegistry() {
        return new DefaultSubscriptionRegistry();
    }
}
