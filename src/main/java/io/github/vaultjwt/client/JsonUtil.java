package io.github.vaultjwt.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON helpers shared by the transport and the secret store.
 *
 * <p>Wraps a single Jackson {@link ObjectMapper}. Vault responses are handled as
 * generic {@code Map<String, Object>} trees; typed conversion is only used at
 * the edges where callers ask for their own classes ({@code readInto},
 * {@code writeFrom}).
 */
public final class JsonUtil {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private JsonUtil() {
        // Utility class
    }

    /**
     * Returns the shared mapper.
     *
     * @return the object mapper
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Serializes a value to a JSON string.
     *
     * @param value the value to serialize, null gives {@code "{}"}
     * @return the JSON string
     * @throws DecodeException if the value cannot be serialized
     */
    public static String toJson(Object value) throws DecodeException {
        if (value == null) {
            return "{}";
        }
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Cannot serialize " + value.getClass().getName() + " to JSON", e);
        }
    }

    /**
     * Parses a JSON string into a Map.
     *
     * @param json the JSON string
     * @return the parsed map, or null if the input is blank, malformed or not an object
     */
    public static Map<String, Object> parseObject(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }

        try {
            return MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    /**
     * Parses a JSON string into the given type.
     *
     * @param json the JSON string
     * @param type the target class
     * @param <T>  the target type
     * @return the parsed value
     * @throws DecodeException if the JSON does not match the type
     */
    public static <T> T parse(String json, Class<T> type) throws DecodeException {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Cannot decode JSON into " + type.getName(), e);
        }
    }

    /**
     * Re-encodes a generic map into a typed value.
     *
     * @param source the map, as returned by a secret read
     * @param type   the target type
     * @param <T>    the target type
     * @return the converted value
     * @throws DecodeException if the map does not fit the type
     */
    public static <T> T convert(Map<String, Object> source, JavaType type) throws DecodeException {
        try {
            return MAPPER.convertValue(source, type);
        } catch (IllegalArgumentException e) {
            throw new DecodeException("Cannot convert secret data into " + type, e);
        }
    }

    /**
     * Encodes an arbitrary value into a generic map.
     *
     * @param source the value, must serialize to a JSON object
     * @return the map
     * @throws DecodeException if the value does not serialize to a JSON object
     */
    public static Map<String, Object> toMap(Object source) throws DecodeException {
        if (source == null) {
            throw new DecodeException("Cannot convert null into secret data", 0);
        }
        try {
            return MAPPER.convertValue(source, MAP_TYPE);
        } catch (IllegalArgumentException e) {
            throw new DecodeException(
                    "Cannot convert " + source.getClass().getName() + " into secret data", e);
        }
    }

    /**
     * Parses the "errors" field from a Vault error response.
     *
     * @param json the JSON response body
     * @return list of error messages, or null if not present
     */
    public static List<String> parseErrors(String json) {
        Map<String, Object> root = parseObject(json);
        if (root == null) {
            return null;
        }

        Object errors = root.get("errors");
        if (errors instanceof List) {
            List<String> result = new ArrayList<>();
            for (Object item : (List<?>) errors) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
            return result;
        }

        return null;
    }
}
