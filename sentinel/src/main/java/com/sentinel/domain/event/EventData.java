package com.sentinel.domain.event;

/**
 * Marker for event payloads.
 *
 * Typed payloads are records implementing this interface; producers that do not
 * have a typed variant publish {@link GenericEventData}.
 */
public interface EventData {
}
