package com.dockeriot.common.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Instant;

/**
 * Factory for the ObjectMapper shared by the services.
 * Timestamps are written as ISO-8601 instants (UTC, trailing {@code Z}); zone-less
 * timestamps are read as UTC.
 */
public final class JsonUtil {

    private JsonUtil() {}

    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());
        mapper.registerModule(new SimpleModule("utc-instants")
                .addDeserializer(Instant.class, new UtcInstantDeserializer()));
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        // Clients may send extra fields (including "id"); they are dropped, never bound.
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

        return mapper;
    }
}
