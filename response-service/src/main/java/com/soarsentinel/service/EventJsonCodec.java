package com.soarsentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.soarsentinel.core.model.Event;

import java.io.IOException;

/**
 * Converts {@link Event}s to and from their JSON wire form.
 * <p>
 * Timestamps are written as ISO-8601 strings and unknown properties are
 * ignored on read, so producers may add fields without breaking consumers.
 * Instances are thread-safe.
 * </p>
 */
public class EventJsonCodec {

    private final ObjectMapper mapper;

    public EventJsonCodec() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @throws IllegalArgumentException if the event cannot be serialized
     */
    public byte[] encode(Event event) {
        try {
            return mapper.writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event " + event.getId() + ": "
                    + e.getOriginalMessage(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the payload is empty or not a valid
     *                                  event document
     */
    public Event decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new IllegalArgumentException("Empty event payload");
        }
        Event event;
        try {
            event = mapper.readValue(payload, Event.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed event payload: " + e.getMessage(), e);
        }
        if (event == null || event.getType() == null || event.getType().isBlank()) {
            throw new IllegalArgumentException("Event payload has no type");
        }
        return event;
    }
}
