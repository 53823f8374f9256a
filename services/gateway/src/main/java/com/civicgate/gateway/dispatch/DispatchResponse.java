package com.civicgate.gateway.dispatch;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/**
 * Uniform answer to a dispatched call.
 *
 * @param success whether the operation succeeded
 * @param sessionId session the call was recorded under (null when it was rejected before that)
 * @param result textual result of a successful call
 * @param error message of a failed call
 * @param errorType failure kind, such as {@code CapabilityDeniedException} or {@code HandlerError}
 * @param details extra fields of a failure (active groups of a denied call, for example)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DispatchResponse(
        boolean success,
        String sessionId,
        String result,
        String error,
        String errorType,
        Map<String, Object> details) {

    public DispatchResponse {
        details = details == null ? null : Map.copyOf(details);
    }

    public static DispatchResponse ok(String sessionId, String result) {
        return new DispatchResponse(true, sessionId, result, null, null, null);
    }

    public static DispatchResponse failure(String sessionId, String error, String errorType) {
        return new DispatchResponse(false, sessionId, null, error, errorType, null);
    }

    public static DispatchResponse rejected(String error, String errorType, Map<String, Object> details) {
        return new DispatchResponse(false, null, null, error, errorType, details);
    }
}
