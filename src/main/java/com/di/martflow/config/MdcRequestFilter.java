package com.di.martflow.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Correlates warehouse API calls in the log.
 *
 * <p>Each request gets a {@code requestId} (a caller's {@code X-Request-Id} when it is a plain
 * token, a generated {@code req-xxxxxxxx} otherwise) and a {@code requestPath}. The id is echoed
 * on the response so a client can match an ETL or query call to its log lines; the pipeline adds
 * {@code runId} underneath and the error handler reads {@code requestPath}. Values the thread held
 * before the request are put back afterwards.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcRequestFilter extends OncePerRequestFilter {

    static final String REQUEST_ID = "requestId";
    static final String REQUEST_PATH = "requestPath";
    static final String REQUEST_ID_HEADER = "X-Request-Id";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String requestId = resolveRequestId(request.getHeader(REQUEST_ID_HEADER));
        String path = request.getRequestURI();

        String previousId = MDC.get(REQUEST_ID);
        String previousPath = MDC.get(REQUEST_PATH);
        MDC.put(REQUEST_ID, requestId);
        MDC.put(REQUEST_PATH, path != null ? path : "");
        response.setHeader(REQUEST_ID_HEADER, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            restore(REQUEST_ID, previousId);
            restore(REQUEST_PATH, previousPath);
        }
    }

    /** A caller-supplied id is kept only when it cannot break a log line. */
    static String resolveRequestId(String header) {
        if (header != null) {
            String trimmed = header.trim();
            if (ACCEPTED_ID.matcher(trimmed).matches()) {
                return trimmed;
            }
        }
        return "req-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static void restore(String key, String previous) {
        if (previous != null) {
            MDC.put(key, previous);
        } else {
            MDC.remove(key);
        }
    }
}
