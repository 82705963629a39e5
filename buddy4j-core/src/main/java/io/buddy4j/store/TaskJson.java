package io.buddy4j.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Objects;

public final class TaskJson {

    private TaskJson() {
    }

    /**
     * Copies {@code base} and configures the copy for task documents: ISO-8601 instants, tolerant of
     * unknown fields, indented output.
     */
    public static ObjectMapper mapper(ObjectMapper base) {
        Objects.requireNonNull(base, "base must not be null");
        return base.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static ObjectMapper mapper() {
        return mapper(new ObjectMapper());
    }
}
