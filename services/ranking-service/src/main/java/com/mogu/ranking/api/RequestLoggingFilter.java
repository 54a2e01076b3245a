package com.mogu.ranking.api;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestLoggingFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    static final String REQUEST_ID = "x-request-id";
    static final String TRACE_ID = "x-trace-id";

    private final long slowThresholdMs;

    public RequestLoggingFilter(@Value("${ranking.request-log.slow-threshold-ms:1000}") long slowThresholdMs) {
        this.slowThresholdMs = slowThresholdMs;
    }

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain
    ) throws ServletException, IOException {
        String requestId = RequestIdUtil.resolveOrGenerate(request.getHeader(REQUEST_ID));
        String traceId = RequestIdUtil.resolveOrGenerate(request.getHeader(TRACE_ID));
        request.setAttribute(REQUEST_ID, requestId);
        request.setAttribute(TRACE_ID, traceId);
        response.setHeader(REQUEST_ID, requestId);
        response.setHeader(TRACE_ID, traceId);
        long startedAt = System.nanoTime();

        try {
            filterChain.doFilter(request, response);
        } finally {
            long latencyMs = (System.nanoTime() - startedAt) / 1_000_000L;
            if (latencyMs >= slowThresholdMs) {
                logger.warn(
                    "slow_request request_id={} trace_id={} method={} path={} status={} latency_ms={}",
                    requestId,
                    traceId,
                    request.getMethod(),
                    request.getRequestURI(),
                    response.getStatus(),
                    latencyMs
                );
            } else {
                logger.info(
                    "request_id={} trace_id={} method={} path={} status={} latency_ms={}",
                    requestId,
                    traceId,
                    request.getMethod(),
                    request.getRequestURI(),
                    response.getStatus(),
                    latencyMs
                );
            }
        }
    }
}
