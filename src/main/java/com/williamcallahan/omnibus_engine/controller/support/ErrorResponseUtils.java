package com.williamcallahan.omnibus_engine.controller.support;

import com.williamcallahan.omnibus_engine.exception.VirtualBookContentException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the JSON error payloads returned by the omnibus endpoints.
 */
public final class ErrorResponseUtils {

    private ErrorResponseUtils() {
        // Utility class
    }

    public static Map<String, String> errorBody(String error, String detail) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error);
        if (detail != null && !detail.isBlank()) {
            body.put("message", detail);
        }
        return body;
    }

    /**
     * Error payload for a failed content request, naming the virtual book it concerns.
     */
    public static Map<String, String> contentErrorBody(String error, VirtualBookContentException failure) {
        Map<String, String> body = errorBody(error, failure.getMessage());
        if (failure.getVirtualBookId() != null) {
            body.put("virtualBookId", failure.getVirtualBookId());
        }
        return body;
    }
}
