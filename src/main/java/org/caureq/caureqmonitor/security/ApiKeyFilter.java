package org.caureq.caureqmonitor.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqmonitor.config.AppProps;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Optional shared-key check for the agents' write calls (POST and DELETE on /snapshots).
 * Disabled while {@code app.api-key} is blank; reads are never gated.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiKeyFilter extends OncePerRequestFilter {
    static final String HEADER = "X-API-KEY";

    private final AppProps props;

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        if (props.apiKeyRequired() && isSnapshotWrite(req)) {
            String key = req.getHeader(HEADER);
            if (key == null || !key.equals(props.apiKey())) {
                log.warn("rejected {} {} from {}: missing or invalid {}",
                        req.getMethod(), req.getRequestURI(), req.getRemoteAddr(), HEADER);
                res.setStatus(HttpStatus.UNAUTHORIZED.value());
                res.setContentType(MediaType.APPLICATION_JSON_VALUE);
                res.getWriter().write("{\"code\":\"AUTH_REQUIRED\",\"message\":\"Missing or invalid X-API-KEY\"}");
                return;
            }
        }

        chain.doFilter(req, res);
    }

    private static boolean isSnapshotWrite(HttpServletRequest req) {
        var path = req.getRequestURI().substring(req.getContextPath().length()); // ex: "/snapshots/42"
        var method = req.getMethod();
        boolean snapshots = path.equals("/snapshots") || path.startsWith("/snapshots/");
        return snapshots && ("POST".equalsIgnoreCase(method) || "DELETE".equalsIgnoreCase(method));
    }
}
