package com.produto.api.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.util.Locale;
import java.util.UUID;

/**
 * Logs every HTTP request and its outcome under a generated request id.
 * The id is kept in the MDC for the duration of the request and echoed in X-Request-ID.
 * The body is buffered so X-Process-Time can still be set once the handler has finished.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestLoggingFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_MDC_KEY = "request_id";
    public static final String PROCESS_TIME_HEADER = "X-Process-Time";

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String requestId = UUID.randomUUID().toString();
        long start = System.nanoTime();

        MDC.put(REQUEST_ID_MDC_KEY, requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        log.info("[{}] {} {} - Client: {}", requestId, request.getMethod(), request.getRequestURI(), request.getRemoteAddr());

        ContentCachingResponseWrapper buffered = new ContentCachingResponseWrapper(response);
        try {
            filterChain.doFilter(request, buffered);
        } finally {
            try {
                double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
                log.info("[{}] Status: {} - Duration: {}s",
                    requestId, buffered.getStatus(), String.format(Locale.ROOT, "%.3f", seconds));
                buffered.setHeader(PROCESS_TIME_HEADER, String.format(Locale.ROOT, "%.6f", seconds));
                buffered.copyBodyToResponse();
            } finally {
                MDC.remove(REQUEST_ID_MDC_KEY);
            }
        }
    }
}
