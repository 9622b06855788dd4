package de.mirkosertic.mediashrink.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.lang.reflect.RecordComponent;

/**
 * JSON rendering of the response DTOs for whatever transport sits in front of {@link MediaShrinkOperations}.
 */
public final class ResponseJson {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private ResponseJson() {
    }

    public static String toJson(final Object response) {
        try {
            return OBJECT_MAPPER.writeValueAsString(response);
        } catch (final JsonProcessingException e) {
            return "{\"success\":false,\"error\":\"JSON serialization error: " + escapeJson(e.getMessage()) + "\"}";
        }
    }

    /**
     * True for a response record whose {@code success} component is false.
     */
    public static boolean isError(final Object response) {
        if (response instanceof Record record) {
            for (final RecordComponent component : record.getClass().getRecordComponents()) {
                if ("success".equals(component.getName())) {
                    try {
                        return component.getAccessor().invoke(record) instanceof Boolean success && !success;
                    } catch (final ReflectiveOperationException e) {
                        return false;
                    }
                }
            }
        }
        return false;
    }

    private static String escapeJson(final String str) {
        if (str == null) {
            return "";
        }
        return str.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}
