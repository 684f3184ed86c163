package com.company.anomaly.web;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Correlates API logs with a request id (taken from X-Request-ID or generated) and logs
 * each request's status and latency.
 */
@Component
@Slf4j
public class RequestLoggingFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String MDC_REQUEST_ID_KEY = "requestId";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        String requestId = httpRequest.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }

        MDC.put(MDC_REQUEST_ID_KEY, requestId);
        httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
        long startNanos = System.nanoTime();

        try {
            chain.doFilter(request, response);
        } finally {
            long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
            if (httpRequest.getRequestURI().startsWith("/api/")) {
                log.info("{} {} -> {} ({} ms)", httpRequest.getMethod(), httpRequest.getRequestURI(),
                        httpResponse.getStatus(), elapsedMs);
            }
            MDC.remove(MDC_REQUEST_ID_KEY);
        }
    }
}
