package com.flagship.pawn_ledger.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Binds the correlation id and the acting user of each API request to MDC.
 * The correlation id is taken from the request or generated, and always echoed
 * back. The actor is logged as sent; it is never verified here.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = CorrelationContext.newCorrelationId();
        }
        response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);

        CorrelationContext.bindRequest(correlationId, request.getHeader(CorrelationContext.ACTOR_HEADER));
        try {
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContext.unbindRequest();
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }
}
