package com.calor.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMapper instances that read and write Calor trees.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = CalorJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(program);
 * Program program = mapper.readValue(json, Program.class);
 * </pre>
 */
public final class CalorJackson {

    private CalorJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for the Calor tree.
     *
     * The returned mapper:
     * - Handles polymorphic nodes via the "type" property
     * - Omits null components (optional sections, absent ids)
     * - Writes dates such as {@code §AUTHOR} and {@code §LOCK} timestamps as ISO-8601 text
     * - Writes decimal literals as strings
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());
        mapper.registerModule(new JavaTimeModule());

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

        // Ignore unknown properties during deserialization
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
