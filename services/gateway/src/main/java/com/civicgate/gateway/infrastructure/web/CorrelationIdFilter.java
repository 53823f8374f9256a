package com.civicgate.gateway.infrastructure.web;

import com.civicgate.observability.CorrelationContext;
import com.civicgate.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates or generates a correlation ID for every HTTP request and puts it, with the
 * caller's session ID when one is sent, into {@link CorrelationContextHolder} for the duration
 * of the request.
 *
 * <p>The correlation ID is echoed in the {@value #CORRELATION_ID_HEADER} response header. Runs
 * first so every later filter and handler logs with it.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String SESSION_ID_HEADER = "X-Session-ID";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }
        String sessionId = request.getHeader(SESSION_ID_HEADER);
        if (sessionId != null && sessionId.isBlank()) {
            sessionId = null;
        }

        CorrelationContextHolder.set(new CorrelationContext(correlationId, sessionId, null, null));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads
            CorrelationContextHolder.clear();
        }
    }
}
