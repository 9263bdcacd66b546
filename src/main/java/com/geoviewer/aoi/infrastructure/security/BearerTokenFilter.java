package com.geoviewer.aoi.infrastructure.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Authentication filter for the AOI endpoints.
 * Requires a Bearer token and exposes the caller's user id as a request attribute.
 *
 * Tokens are not verified against an identity provider. The user id is derived
 * from the token prefix so the same token always maps to the same user.
 */
@Component
public class BearerTokenFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(BearerTokenFilter.class);

    public static final String USER_ID_ATTRIBUTE = "userId";

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String PROTECTED_PATH = "/aoi";
    private static final int USER_ID_TOKEN_CHARS = 8;

    private final ObjectMapper objectMapper;

    public BearerTokenFilter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        boolean protectedPath = path.equals(PROTECTED_PATH) || path.startsWith(PROTECTED_PATH + "/");
        return !protectedPath || "OPTIONS".equals(request.getMethod());
    }

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain
    ) throws ServletException, IOException {

        String authHeader = request.getHeader("Authorization");

        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            logger.warn("Missing or invalid Authorization header for {} {}", request.getMethod(), request.getRequestURI());
            sendErrorResponse(response, HttpServletResponse.SC_UNAUTHORIZED,
                "UNAUTHORIZED", "Missing or invalid authorization header");
            return;
        }

        String token = authHeader.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            logger.warn("Empty bearer token for {} {}", request.getMethod(), request.getRequestURI());
            sendErrorResponse(response, HttpServletResponse.SC_UNAUTHORIZED, "UNAUTHORIZED", "Empty token");
            return;
        }

        String userId = userIdFor(token);
        request.setAttribute(USER_ID_ATTRIBUTE, userId);
        logger.debug("Request authenticated as {}", userId);
        filterChain.doFilter(request, response);
    }

    static String userIdFor(String token) {
        return "user_" + token.substring(0, Math.min(USER_ID_TOKEN_CHARS, token.length()));
    }

    private void sendErrorResponse(HttpServletResponse response, int status,
                                   String error, String message) throws IOException {
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());

        Map<String, String> errorBody = Map.of(
            "error", error,
            "message", message
        );

        response.getWriter().write(objectMapper.writeValueAsString(errorBody));
    }
}
