package com.nile.betaskca.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Enumeration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.ContentCachingResponseWrapper;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Verbose HTTP request/response logger, only active when the "dev" Spring profile is enabled.
 * Activate with:  --spring.profiles.active=dev  or  SPRING_PROFILES_ACTIVE=dev
 *
 * Request bodies of POST /users carry a plain-text password and are not logged.
 */
@Component
@Profile("dev")
public class HttpLogFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(HttpLogFilter.class);
    private static final int MAX_LOG_BYTES = 10_000;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        // Wrap to allow safe body logging after chain
        ContentCachingRequestWrapper req = new ContentCachingRequestWrapper(request);
        ContentCachingResponseWrapper res = new ContentCachingResponseWrapper(response);

        long t0 = System.nanoTime();
        try {
            filterChain.doFilter(req, res);
        } finally {
            long dtMs = (System.nanoTime() - t0) / 1_000_000;

            StringBuilder sb = new StringBuilder(4_096);
            sb.append("\n================ HTTP TRACE ================\n");
            sb.append(request.getMethod()).append(" ").append(request.getRequestURI());
            if (request.getQueryString() != null) sb.append("?").append(request.getQueryString());
            sb.append("\nRemoteAddr: ").append(request.getRemoteAddr()).append("\n");

            sb.append("\n-- Request Headers --\n");
            Enumeration<String> headerNames = request.getHeaderNames();
            while (headerNames.hasMoreElements()) {
                String name = headerNames.nextElement();
                sb.append(name).append(": ").append(request.getHeader(name)).append("\n");
            }

            sb.append("\n-- Request Body --\n");
            byte[] reqBuf = req.getContentAsByteArray();
            if (carriesPassword(request)) {
                sb.append("(redacted)\n");
            } else if (reqBuf.length > 0) {
                sb.append(truncate(reqBuf)).append("\n");
            } else {
                sb.append("(empty)\n");
            }

            sb.append("\n-- Response --\n");
            sb.append("Status: ").append(res.getStatus()).append(" (").append(dtMs).append(" ms)\n");
            sb.append("-- Response Body --\n");
            byte[] respBuf = res.getContentAsByteArray();
            if (respBuf.length > 0) {
                sb.append(truncate(respBuf)).append("\n");
            } else {
                sb.append("(empty)\n");
            }

            sb.append("============== END HTTP TRACE ==============\n");
            log.debug(sb.toString());

            // IMPORTANT: copy response body back to client
            res.copyBodyToResponse();
        }
    }

    static boolean carriesPassword(HttpServletRequest request) {
        String uri = request.getRequestURI();
        return "POST".equals(request.getMethod()) && (uri.equals("/users") || uri.equals("/users/"));
    }

    private static String truncate(byte[] bytes) {
        int len = Math.min(bytes.length, MAX_LOG_BYTES);
        return new String(bytes, 0, len, StandardCharsets.UTF_8)
                + (bytes.length > MAX_LOG_BYTES ? "\n... [truncated] ..." : "");
    }
}
