package com.ivamare.eventbroker;

import com.ivamare.eventbroker.broker.Broker;
import com.ivamare.eventbroker.health.SubscriptionHealthIndicator;
import com.ivamare.eventbroker.message.MessageCodec;
import com.ivamare.eventbroker.subscription.PriorityLanesConfig;
import com.ivamare.eventbroker.subscription.Subscription;
import com.ivamare.eventbroker.subscription.SubscriptionBinding;
import com.ivamare.eventbroker.subscription.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.event.EventListener;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Auto-start configuration for subscriptions.
 *
 * <p>Enable with:
 * <pre>
 * eventbroker:
 *   subscription:
 *     auto-start: true
 * </pre>
 *
 * <p>A subscription is started for each registered stream handler.
 */
@AutoConfiguration(after = EventBrokerAutoConfiguration.class)
@ConditionalOnBean({Broker.class, SubscriptionRegistry.class})
@ConditionalOnProperty(prefix = "eventbroker.subscription", name = "auto-start", havingValue = "true")
public class SubscriptionAutoStartConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionAutoStartConfiguration.class);

    private final List<Subscription> subscriptions = new ArrayList<>();
    private final Broker broker;
    private final MessageCodec codec;
    private final SubscriptionRegistry subscriptionRegistry;
    private final EventBrokerProperties properties;
    private final Clock clock;

    public SubscriptionAutoStartConfiguration(
            Broker broker,
            MessageCodec codec,
            SubscriptionRegistry subscriptionRegistry,
            EventBrokerProperties properties,
            Clock clock) {
        this.broker = broker;
        this.codec = codec;
        this.subscriptionRegistry = subscriptionRegistry;
        this.properties = properties;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startSubscriptions() {
        List<SubscriptionBinding> bindings = subscriptionRegistry.bindings();

        if (bindings.isEmpty()) {
            log.warn("No stream handlers registered, no subscriptions to start");
            return;
        }

        EventBrokerProperties.SubscriptionProperties sp = properties.getSubscription();
        PriorityLanesConfig lanes = sp.getPriorityLanes().toConfig();

        for (SubscriptionBinding binding : bindings) {
            Subscription subscription = Subscription.builder()
                .broker(broker)
                .codec(codec)
                .handler(binding.handler())
                .stream(binding.stream())
                .consumerGroup(binding.consumerGroup())
                .messagesPerTick(sp.getMessagesPerTick())
                .blockingTimeout(sp.getBlockingTimeout())
                .maxRetries(sp.getMaxRetries())
                .enableDlq(sp.isEnableDlq())
                .priorityLanes(lanes)
                .backfillMaxWait(sp.getBackfillMaxWait())
                .clock(clock)
                .build();

            subscription.start();
            subscriptions.add(subscription);

            log.info("Started subscription for stream={} group={}", binding.stream(), subscription.consumerGroup());
        }
    }

    @PreDestroy
    public void stopSubscriptions() {
        if (subscriptions.isEmpty()) {
            return;
        }

        log.info("Stopping {} subscriptions...", subscriptions.size());

        subscriptions.forEach(s -> s.stop(Duration.ofSeconds(30)));

        log.info("All subscriptions stopped");
    }

    @Bean
    public List<Subscription> eventBrokerSubscriptions() {
        return subscriptions;
    }

    @Bean
    public HealthIndicator subscriptionHealthIndicator() {
        return new SubscriptionHealthIndicator(subscriptions);
    }
}
