package com.example.reconciliation.config;

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
 * Puts a traceId into MDC for every reconciliation API call (uploads, storage-backed runs,
 * batches, metrics reads), so the orchestrator's stage logs for a request share one id.
 * A caller-supplied {@code X-Trace-Id} is reused and always echoed back on the response.
 *
 * The run id put in MDC by the orchestrator is removed here as well once the request ends.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        TraceContextManager.ensureForHttp(request, response);
        try {
            filterChain.doFilter(request, response);
        } finally {
            TraceContextManager.clear();
        }
    }
}
