package com.ivamare.eventbroker.subscription;

import com.ivamare.eventbroker.broker.Broker;
import com.ivamare.eventbroker.model.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Producer side lane selection.
 *
 * <p>Messages whose priority is below the configured threshold go to the
 * backfill lane; everything else goes to the primary stream.
 */
public class PriorityLaneRouter {

    private static final Logger log = LoggerFactory.getLogger(PriorityLaneRouter.class);

    private final PriorityLanesConfig config;

    public PriorityLaneRouter(PriorityLanesConfig config) {
        this.config = config != null ? config : PriorityLanesConfig.disabled();
    }

    public PriorityLanesConfig config() {
        return config;
    }

    /**
     * Stream a message of the given priority should be written to.
     *
     * @param stream Primary stream
     * @param priority Message priority, null means {@link Priority#NORMAL}
     * @return the primary stream or its backfill lane
     */
    public String targetStream(String stream, Integer priority) {
        int effective = priority != null ? priority : Priority.NORMAL.getValue();
        if (config.enabled() && effective < config.threshold()) {
            return StreamNames.backfill(stream, config.backfillSuffix());
        }
        return stream;
    }

    /**
     * Publish a raw message to the lane matching its {@code metadata.domain.priority}.
     *
     * @param broker Target broker
     * @param stream Primary stream
     * @param payload Raw message payload
     * @return the broker assigned identifier
     */
    public String publish(Broker broker, String stream, Map<String, Object> payload) {
        String target = targetStream(stream, priorityOf(payload));
        if (!target.equals(stream)) {
            log.debug("Routing message to backfill lane {}", target);
        }
        return broker.publish(target, payload);
    }

    /**
     * Read {@code metadata.domain.priority} from a raw payload.
     *
     * @param payload Raw message payload
     * @return the priority, or null if absent or not an integer
     */
    static Integer priorityOf(Map<String, Object> payload) {
        if (payload != null
            && payload.get("metadata") instanceof Map<?, ?> metadata
            && metadata.get("domain") instanceof Map<?, ?> domain
            && (domain.get("priority") instanceof Integer || domain.get("priority") instanceof Long)) {
            return ((Number) domain.get("priority")).intValue();
        }
        return null;
    }
}
