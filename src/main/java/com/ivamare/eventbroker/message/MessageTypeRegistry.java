package com.ivamare.eventbroker.message;

import com.ivamare.eventbroker.exception.MessageTypeAlreadyRegisteredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps message type names (as carried in {@code metadata.headers.type}) to the
 * classes their data is converted into.
 */
public class MessageTypeRegistry {

    private static final Logger log = LoggerFactory.getLogger(MessageTypeRegistry.class);

    private final Map<String, Class<?>> types = new ConcurrentHashMap<>();

    /**
     * Register a message type.
     *
     * <p>Registering the same class twice is a no-op.
     *
     * @param typeName type name, for example {@code Shop.OrderPlaced.v1}
     * @param type class the message data converts to
     * @throws MessageTypeAlreadyRegisteredException if the name is bound to another class
     */
    public void register(String typeName, Class<?> type) {
        Class<?> existing = types.putIfAbsent(typeName, type);
        if (existing != null && !existing.equals(type)) {
            throw new MessageTypeAlreadyRegisteredException(typeName, existing);
        }
        log.debug("Registered message type {} -> {}", typeName, type.getName());
    }

    public Optional<Class<?>> get(String typeName) {
        if (typeName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(types.get(typeName));
    }

    public boolean isRegistered(String typeName) {
        return typeName != null && types.containsKey(typeName);
    }

    public Set<String> registeredTypes() {
        return Set.copyOf(types.keySet());
    }

    public void clear() {
        types.clear();
    }
}
