package com.civicgate.gateway.infrastructure.web;

import com.civicgate.capability.ConfigurationException;
import com.civicgate.database.SessionQueryException;
import com.civicgate.database.SinkUnavailableException;
import com.civicgate.observability.CorrelationContextHolder;
import com.civicgate.security.AuthenticationException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions escaping the REST controllers to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://civicgate.dev/errors/sink-unavailable",
 *   "title": "Service Unavailable",
 *   "status": 503,
 *   "detail": "Session database not available",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Operation calls never get here: the dispatcher answers them with its own envelope.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String ERROR_TYPE_BASE = "https://civicgate.dev/errors/";

    @ExceptionHandler({IllegalArgumentException.class, ConfigurationException.class})
    public ProblemDetail handleBadRequest(RuntimeException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "Bad Request", "bad-request");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, detail, "Validation Error", "validation");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Malformed request body", "Bad Request", "bad-request");
    }

    @ExceptionHandler(AuthenticationException.class)
    public ProblemDetail handleAuthentication(AuthenticationException ex) {
        log.warn("Authentication failed: {}", ex.getMessage());
        return problem(HttpStatus.UNAUTHORIZED, ex.getMessage(), "Unauthorized", "authentication");
    }

    @ExceptionHandler(SinkUnavailableException.class)
    public ProblemDetail handleSinkUnavailable(SinkUnavailableException ex) {
        log.debug("Dashboard request while the session database is unavailable");
        return problem(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), "Service Unavailable", "sink-unavailable");
    }

    @ExceptionHandler(SessionQueryException.class)
    public ProblemDetail handleSessionQuery(SessionQueryException ex) {
        log.error("Session query failed", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), "Internal Server Error", "session-query");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", "Internal Server Error",
                "internal");
    }

    private static ProblemDetail problem(HttpStatus status, String detail, String title, String type) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
