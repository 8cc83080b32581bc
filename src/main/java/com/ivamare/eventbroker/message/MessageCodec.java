package com.ivamare.eventbroker.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ivamare.eventbroker.exception.DeserializationException;
import com.ivamare.eventbroker.model.DomainMeta;
import com.ivamare.eventbroker.model.Message;
import com.ivamare.eventbroker.model.MessageEnvelope;
import com.ivamare.eventbroker.model.MessageHeaders;
import com.ivamare.eventbroker.model.MessageKind;
import com.ivamare.eventbroker.model.Metadata;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Converts between raw broker payloads and structured {@link Message}s.
 *
 * <p>Raw payload layout:
 * <pre>
 * {
 *   "data": {...},
 *   "metadata": {
 *     "headers":  {"id", "time", "type", "stream", "idempotency_key", "traceparent"},
 *     "envelope": {"specversion", "checksum"},
 *     "domain":   {"fqn", "kind", "origin_stream", "stream_category", "version",
 *                  "sequence_id", "asynchronous", "expected_version", "priority"}
 *   }
 * }
 * </pre>
 *
 * <p>The checksum is the SHA-256 hex digest of {@code data} written as compact JSON
 * with map keys sorted and non-ASCII characters escaped.
 */
public class MessageCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final ObjectMapper canonicalMapper;
    private final MessageTypeRegistry typeRegistry;

    public MessageCodec(ObjectMapper objectMapper, MessageTypeRegistry typeRegistry) {
        this.objectMapper = objectMapper.copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);
        this.canonicalMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(JsonWriteFeature.ESCAPE_NON_ASCII)
            .build();
        this.typeRegistry = typeRegistry;
    }

    /**
     * Build a message with a freshly computed checksum.
     *
     * @param headers message headers
     * @param domain domain metadata
     * @param data message body
     * @return the message
     */
    public Message build(MessageHeaders headers, DomainMeta domain, Map<String, Object> data) {
        Map<String, Object> body = data != null ? data : Map.of();
        return new Message(body, new Metadata(headers, MessageEnvelope.withChecksum(computeChecksum(body)), domain));
    }

    /**
     * Write a message as a raw broker payload.
     *
     * @param message the message
     * @return payload map suitable for {@code Broker.publish}
     */
    public Map<String, Object> serialize(Message message) {
        return objectMapper.convertValue(message, MAP_TYPE);
    }

    /**
     * Parse and validate a raw broker payload.
     *
     * <p>Validates structure and, when the envelope carries one, the checksum.
     *
     * @param identifier broker message id, used for error context
     * @param payload raw payload
     * @return the message
     * @throws DeserializationException if the payload is malformed or fails integrity validation
     */
    public Message deserialize(String identifier, Map<String, Object> payload) {
        if (payload == null) {
            throw new DeserializationException(identifier, "Message payload is empty", Map.of());
        }
        requireField(identifier, payload, payload, "data");
        requireField(identifier, payload, payload, "metadata");
        if (!(payload.get("metadata") instanceof Map<?, ?> metadata)) {
            throw new DeserializationException(identifier, "Field 'metadata' is not an object",
                baseContext(payload, "ClassCastException"));
        }
        requireField(identifier, payload, metadata, "headers");

        Message message;
        try {
            message = objectMapper.convertValue(payload, Message.class);
        } catch (IllegalArgumentException e) {
            throw new DeserializationException(identifier, "Malformed message: " + e.getMessage(),
                baseContext(payload, e.getClass().getSimpleName()), e);
        }

        MessageEnvelope envelope = message.metadata().envelope();
        if (envelope.hasChecksum()) {
            String computed = computeChecksum(message.data());
            if (!envelope.checksum().equals(computed)) {
                Map<String, Object> context = new LinkedHashMap<>();
                context.put("stored_checksum", envelope.checksum());
                context.put("computed_checksum", computed);
                context.put("validation_requested", true);
                context.put("message_type", Objects.requireNonNullElse(message.type(), "unknown"));
                context.put("stream_name", streamName(message));
                throw new DeserializationException(messageId(identifier, message),
                    "Message integrity validation failed - checksum mismatch", context);
            }
        }
        return message;
    }

    /**
     * Convert a message's data into its registered class.
     *
     * @param identifier broker message id, used for error context
     * @param message the message
     * @return the domain object
     * @throws DeserializationException if the kind is unsupported or the type is not registered
     */
    public Object toDomainObject(String identifier, Message message) {
        DomainMeta domain = message.metadata().domain();
        MessageKind kind = domain != null ? domain.messageKind() : null;
        if (kind == null || !kind.isDispatchable()) {
            throw new DeserializationException(messageId(identifier, message),
                "Message kind is not supported for deserialization",
                domainContext(message, "InvalidDataError"));
        }

        Class<?> type = typeRegistry.get(message.type()).orElseThrow(() ->
            new DeserializationException(messageId(identifier, message),
                "Message type " + message.type() + " is not registered",
                domainContext(message, "ConfigurationException")));

        try {
            return objectMapper.convertValue(message.data(), type);
        } catch (IllegalArgumentException e) {
            throw new DeserializationException(messageId(identifier, message), e.getMessage(),
                domainContext(message, e.getClass().getSimpleName()), e);
        }
    }

    /**
     * SHA-256 hex digest of the canonical JSON form of {@code data}.
     *
     * @param data message body
     * @return lowercase hex digest
     */
    public String computeChecksum(Map<String, Object> data) {
        try {
            byte[] json = canonicalMapper.writeValueAsString(data).getBytes(StandardCharsets.UTF_8);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(json);
            return HexFormat.of().formatHex(digest);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Message data is not serializable", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private void requireField(String identifier, Map<String, Object> payload, Map<?, ?> container, String field) {
        if (!container.containsKey(field) || container.get(field) == null) {
            Map<String, Object> context = baseContext(payload, "MissingField");
            context.put("missing_field", field);
            throw new DeserializationException(identifier,
                "Missing required field '" + field + "' in message data", context);
        }
    }

    private Map<String, Object> baseContext(Map<String, Object> payload, String exceptionType) {
        Map<String, Object> context = new HashMap<>();
        context.put("available_fields", new ArrayList<>(payload.keySet()));
        context.put("original_exception_type", exceptionType);
        Object metadata = payload.get("metadata");
        String stream = "unknown";
        String type = "unknown";
        if (metadata instanceof Map<?, ?> meta && meta.get("headers") instanceof Map<?, ?> headers) {
            if (headers.get("stream") != null) {
                stream = headers.get("stream").toString();
            }
            if (headers.get("type") != null) {
                type = headers.get("type").toString();
            }
        }
        context.put("stream_name", stream);
        context.put("message_type", type);
        return context;
    }

    private Map<String, Object> domainContext(Message message, String exceptionType) {
        DomainMeta domain = message.metadata().domain();
        Map<String, Object> context = new HashMap<>();
        context.put("type", Objects.requireNonNullElse(message.type(), "unknown"));
        context.put("stream_name", streamName(message));
        context.put("metadata_kind", domain != null && domain.kind() != null ? domain.kind() : "unknown");
        context.put("original_exception_type", exceptionType);
        context.put("data_keys", new ArrayList<>(message.data().keySet()));
        return context;
    }

    private static String streamName(Message message) {
        MessageHeaders headers = message.metadata().headers();
        return headers != null && headers.stream() != null ? headers.stream() : "unknown";
    }

    private static String messageId(String identifier, Message message) {
        return message.id() != null ? message.id() : Objects.requireNonNullElse(identifier, "unknown");
    }
}
