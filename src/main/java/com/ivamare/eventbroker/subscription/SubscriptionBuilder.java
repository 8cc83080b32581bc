package com.ivamare.eventbroker.subscription;

import com.ivamare.eventbroker.broker.Broker;
import com.ivamare.eventbroker.handler.MessageHandler;
import com.ivamare.eventbroker.message.MessageCodec;
import com.ivamare.eventbroker.subscription.impl.StreamSubscription;

import java.time.Clock;
import java.time.Duration;

/**
 * Builder for creating Subscription instances.
 */
public class SubscriptionBuilder {

    private Broker broker;
    private MessageCodec codec;
    private MessageHandler handler;
    private String stream;
    private String consumerGroup;
    private int messagesPerTick = 10;
    private Duration blockingTimeout = Duration.ofSeconds(5);
    private int maxRetries = 3;
    private boolean enableDlq = true;
    private PriorityLanesConfig priorityLanes = PriorityLanesConfig.disabled();
    private Duration backfillMaxWait = Duration.ofSeconds(1);
    private Clock clock = Clock.systemUTC();

    /**
     * Set the broker to read from.
     *
     * @param broker The broker
     * @return this builder
     */
    public SubscriptionBuilder broker(Broker broker) {
        this.broker = broker;
        return this;
    }

    /**
     * Set the codec used to validate raw payloads.
     *
     * @param codec The message codec
     * @return this builder
     */
    public SubscriptionBuilder codec(MessageCodec codec) {
        this.codec = codec;
        return this;
    }

    /**
     * Set the handler messages are dispatched to.
     *
     * @param handler The handler
     * @return this builder
     */
    public SubscriptionBuilder handler(MessageHandler handler) {
        this.handler = handler;
        return this;
    }

    /**
     * Set the stream category to consume.
     *
     * @param stream Stream name
     * @return this builder
     */
    public SubscriptionBuilder stream(String stream) {
        this.stream = stream;
        return this;
    }

    /**
     * Override the consumer group. Defaults to the handler's class name.
     *
     * @param consumerGroup Consumer group name
     * @return this builder
     */
    public SubscriptionBuilder consumerGroup(String consumerGroup) {
        this.consumerGroup = consumerGroup;
        return this;
    }

    /**
     * Set the maximum number of messages read per poll.
     *
     * @param messagesPerTick Batch size (default 10)
     * @return this builder
     */
    public SubscriptionBuilder messagesPerTick(int messagesPerTick) {
        this.messagesPerTick = messagesPerTick;
        return this;
    }

    /**
     * Set how long a read waits for messages.
     *
     * @param blockingTimeout Blocking read timeout (default 5s)
     * @return this builder
     */
    public SubscriptionBuilder blockingTimeout(Duration blockingTimeout) {
        this.blockingTimeout = blockingTimeout;
        return this;
    }

    /**
     * Set the number of handler failures after which a message is dead-lettered.
     *
     * @param maxRetries Max handler attempts (default 3)
     * @return this builder
     */
    public SubscriptionBuilder maxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
        return this;
    }

    public SubscriptionBuilder enableDlq(boolean enableDlq) {
        this.enableDlq = enableDlq;
        return this;
    }

    public SubscriptionBuilder priorityLanes(PriorityLanesConfig priorityLanes) {
        this.priorityLanes = priorityLanes;
        return this;
    }

    /**
     * Cap on the blocking wait of a backfill lane read.
     *
     * @param backfillMaxWait Maximum backfill wait (default 1s)
     * @return this builder
     */
    public SubscriptionBuilder backfillMaxWait(Duration backfillMaxWait) {
        this.backfillMaxWait = backfillMaxWait;
        return this;
    }

    public SubscriptionBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * Build the subscription.
     *
     * @return the configured subscription
     * @throws IllegalStateException if required fields are missing or invalid
     */
    public StreamSubscription build() {
        if (broker == null) {
            throw new IllegalStateException("broker is required");
        }
        if (codec == null) {
            throw new IllegalStateException("codec is required");
        }
        if (handler == null) {
            throw new IllegalStateException("handler is required");
        }
        if (stream == null || stream.isBlank()) {
            throw new IllegalStateException("stream is required");
        }
        if (messagesPerTick <= 0) {
            throw new IllegalStateException("messagesPerTick must be positive");
        }
        if (maxRetries < 1) {
            throw new IllegalStateException("maxRetries must be at least 1");
        }
        if (blockingTimeout == null || blockingTimeout.isNegative()) {
            throw new IllegalStateException("blockingTimeout must not be negative");
        }

        if (priorityLanes == null) {
            priorityLanes = PriorityLanesConfig.disabled();
        }
        if (backfillMaxWait == null) {
            backfillMaxWait = Duration.ofSeconds(1);
        }
        if (clock == null) {
            clock = Clock.systemUTC();
        }

        return new StreamSubscription(
            broker,
            codec,
            handler,
            stream,
            consumerGroup,
            messagesPerTick,
            blockingTimeout,
            maxRetries,
            enableDlq,
            priorityLanes,
            backfillMaxWait,
            clock
        );
    }
}
