package com.copytrader.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes the free-form detail maps stored in audit rows. Keys are sorted so two rows with the
 * same details compare equal as text; dates are ISO-8601.
 */
public final class JsonHelper {

    private static final ObjectMapper OBJECT_MAPPER =
            new ObjectMapper().findAndRegisterModules().disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private JsonHelper() {}

    /** Null for a null or empty map. */
    public static String detailsToJson(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(new TreeMap<>(details));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Audit details are not serializable: " + details.keySet(), e);
        }
    }
}
