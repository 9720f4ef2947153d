package io.lattice.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.lattice.core.options.ExecutorSettings;

/**
 * Utility class for serializing and deserializing executor settings to/from JSON.
 *
 * <h3>Usage</h3>
 *
 * <pre>{@code
 * String json = ExecutorSettingsSerializer.toJson(settings);
 * ExecutorSettings restored = ExecutorSettingsSerializer.fromJson(json);
 * ExecutorSettingsDocument document = ExecutorSettingsSerializer.documentFromJson(fileContents);
 * }</pre>
 *
 * @implNote Thread-safe. A shared mapper is created once; Jackson mappers are safe for
 *     concurrent use after configuration.
 * @see LatticeJacksonModule for the registered type handlers
 */
public final class ExecutorSettingsSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private ExecutorSettingsSerializer() {}

    /**
     * Serializes settings to pretty-printed JSON.
     *
     * @param settings the settings, not null
     * @return JSON string representation, never null
     * @throws IllegalArgumentException if serialization fails
     */
    public static String toJson(ExecutorSettings settings) {
        try {
            return MAPPER.writeValueAsString(settings);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize executor settings: " + e.getMessage(), e);
        }
    }

    /**
     * Deserializes settings from JSON.
     *
     * @param json JSON string, not null
     * @return deserialized settings, never null
     * @throws IllegalArgumentException if deserialization fails
     */
    public static ExecutorSettings fromJson(String json) {
        try {
            return MAPPER.readValue(json, ExecutorSettings.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize executor settings: " + e.getMessage(), e);
        }
    }

    /**
     * Deserializes a settings document.
     *
     * @param json JSON string, not null
     * @return the document, never null
     * @throws IllegalArgumentException if the JSON is malformed or empty
     */
    public static ExecutorSettingsDocument documentFromJson(String json) {
        try {
            ExecutorSettingsDocument document =
                    MAPPER.readValue(json, ExecutorSettingsDocument.class);
            if (document == null) {
                throw new IllegalArgumentException("Executor settings document is empty");
            }
            return document;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize executor settings document: " + e.getMessage(), e);
        }
    }

    /**
     * Creates an ObjectMapper configured for executor settings.
     *
     * <p>Registers:
     *
     * <ul>
     *   <li>{@code LatticeJacksonModule} for builder-based settings
     *   <li>{@code JavaTimeModule} for {@code Duration} fields
     *   <li>{@code FAIL_ON_UNKNOWN_PROPERTIES} disabled for forward compatibility
     *   <li>Durations written as ISO-8601 strings (not numeric)
     * </ul>
     *
     * @return configured ObjectMapper, never null
     */
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new LatticeJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
