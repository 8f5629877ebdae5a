package com.flagship.quota_ledger.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.quota_ledger.config.LedgerProperties;
import com.flagship.quota_ledger.exception.ApiError;
import com.flagship.quota_ledger.exception.ErrorKind;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Rejects ledger API calls that do not carry the shared service credential.
 *
 * The credential identifies the calling backend, not the end user. It is
 * accepted as {@code Authorization: Bearer <token>} or in the configured
 * header, and checked before any ledger logic or store access.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@Slf4j
public class ServiceTokenFilter extends OncePerRequestFilter {

    static final String PROTECTED_PREFIX = "/api/";
    private static final String BEARER_PREFIX = "bearer ";

    private final byte[] expectedToken;
    private final String headerName;
    private final ObjectMapper objectMapper;

    public ServiceTokenFilter(LedgerProperties properties, ObjectMapper objectMapper) {
        this.expectedToken = properties.getAuth().getServiceToken().getBytes(StandardCharsets.UTF_8);
        this.headerName = properties.getAuth().getHeaderName();
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String presented = extractToken(request);
        if (presented == null || !MessageDigest.isEqual(expectedToken, presented.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Rejected unauthenticated call: method={}, path={}, credentialPresent={}",
                request.getMethod(), request.getRequestURI(), presented != null);
            writeUnauthorized(response);
            return;
        }
        filterChain.doFilter(request, response);
    }

    private String extractToken(HttpServletRequest request) {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String bearer = authorization.substring(BEARER_PREFIX.length()).trim();
            if (!bearer.isEmpty()) {
                return bearer;
            }
        }
        String header = request.getHeader(headerName);
        return header != null && !header.isBlank() ? header.trim() : null;
    }

    private void writeUnauthorized(HttpServletResponse response) throws IOException {
        response.setStatus(ErrorKind.UNAUTHORIZED.getStatus().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(),
            ApiError.of(ErrorKind.UNAUTHORIZED, "Missing or invalid service credential"));
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(PROTECTED_PREFIX);
    }
}
