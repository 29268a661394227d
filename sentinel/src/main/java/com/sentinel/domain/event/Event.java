package com.sentinel.domain.event;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinel.domain.common.EventType;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable fact broadcast on the event bus.
 *
 * Subscribers get the instance for the duration of their callback only and must
 * treat it as read-only.
 */
public record Event(
    EventType type,
    String module,          // Originating component, for diagnostics
    EventData data,
    Instant timestamp
) {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public Event {
        Objects.requireNonNull(type, "type");
        module = module == null ? "unknown" : module;
        data = data == null ? GenericEventData.empty() : data;
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static Event of(EventType type, String module, EventData data) {
        return new Event(type, module, data, Instant.now());
    }

    /**
     * Payload as the requested typed variant.
     *
     * A generic map payload is converted field by field; fields the target type
     * does not know are ignored. Returns empty when the payload cannot be mapped.
     */
    public <T extends EventData> Optional<T> typedData(Class<T> type) {
        if (type.isInstance(data)) {
            return Optional.of(type.cast(data));
        }
        if (data instanceof GenericEventData generic) {
            try {
                return Optional.of(MAPPER.convertValue(generic.fields(), type));
            } catch (IllegalArgumentException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
