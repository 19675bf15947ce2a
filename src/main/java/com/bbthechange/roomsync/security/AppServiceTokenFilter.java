package com.bbthechange.roomsync.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Authenticates federation callbacks from the homeserver.
 * Validates the hs_token sent as a Bearer token, or as the legacy access_token query parameter.
 * Only applies to /matrix/appservice/** endpoints.
 */
@Component
public class AppServiceTokenFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(AppServiceTokenFilter.class);
    private static final String APPSERVICE_PATH_PREFIX = "/matrix/appservice/";
    private static final String BEARER_PREFIX = "Bearer ";
    private static final String ACCESS_TOKEN_PARAM = "access_token";

    private final String homeserverToken;

    public AppServiceTokenFilter(@Value("${matrix.homeserver-token:}") String homeserverToken) {
        this.homeserverToken = homeserverToken;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(APPSERVICE_PATH_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (homeserverToken == null || homeserverToken.isBlank()) {
            logger.error("No homeserver token configured, rejecting federation call to {}", request.getRequestURI());
            writeError(response, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "Internal configuration error");
            return;
        }

        String providedToken = extractToken(request);
        if (providedToken == null || !MessageDigest.isEqual(
                providedToken.getBytes(StandardCharsets.UTF_8), homeserverToken.getBytes(StandardCharsets.UTF_8))) {
            logger.warn("Invalid homeserver token for federation endpoint: {}", request.getRequestURI());
            writeError(response, HttpServletResponse.SC_FORBIDDEN, "Invalid token");
            return;
        }

        filterChain.doFilter(request, response);
    }

    private String extractToken(HttpServletRequest request) {
        String authorization = request.getHeader("Authorization");
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            return authorization.substring(BEARER_PREFIX.length()).trim();
        }
        return request.getParameter(ACCESS_TOKEN_PARAM);
    }

    private static void writeError(HttpServletResponse response, int status, String error) throws IOException {
        response.setStatus(status);
        response.setContentType("application/json");
        response.getWriter().write("{\"error\":\"" + error + "\"}");
    }
}
