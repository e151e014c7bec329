package com.synos.anomaly.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 메트릭 수집 엔드포인트(/api/metrics...)의 요청 본문을 debug 레벨로 로깅
 */
@Component
@Order(1)
public class RequestLoggingFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

    private static final String INGEST_PATH_PREFIX = "/api/metrics";
    private static final int MAX_LOGGED_BODY = 2000;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (!log.isDebugEnabled()
                || !"POST".equalsIgnoreCase(request.getMethod())
                || !request.getRequestURI().startsWith(INGEST_PATH_PREFIX)) {
            filterChain.doFilter(request, response);
            return;
        }

        ContentCachingRequestWrapper wrappedRequest = new ContentCachingRequestWrapper(request);
        try {
            filterChain.doFilter(wrappedRequest, response);
        } finally {
            byte[] requestBody = wrappedRequest.getContentAsByteArray();
            if (requestBody.length > 0) {
                String body = new String(requestBody, StandardCharsets.UTF_8);
                if (body.length() > MAX_LOGGED_BODY) {
                    body = body.substring(0, MAX_LOGGED_BODY) + "...";
                }
                log.debug("요청 본문 ({}), status={}: {}", request.getRequestURI(), response.getStatus(), body);
            }
        }
    }
}
