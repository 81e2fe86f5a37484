package io.llmops.platform.runtime.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import javax.annotation.Nonnull;

/**
 * Shared {@link ObjectMapper} setup for config documents, handle records and
 * state snapshots.
 */
public final class JsonMappers {

    private JsonMappers() {
    }

    /**
     * Create a mapper writing instants and durations as ISO-8601 strings.
     *
     * @return a new mapper
     */
    @Nonnull
    public static ObjectMapper create() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
