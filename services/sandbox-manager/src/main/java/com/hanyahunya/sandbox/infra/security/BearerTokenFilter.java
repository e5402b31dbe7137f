package com.hanyahunya.sandbox.infra.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hanyahunya.sandbox.adapter.in.web.error.ErrorResponse;
import com.hanyahunya.sandbox.common.error.GlobalErrorCode;
import com.hanyahunya.sandbox.infra.config.SandboxManagerProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Requires {@code Authorization: Bearer <token>} on the management API when a token is configured.
 */
@Slf4j
@Component
public class BearerTokenFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final byte[] expectedToken;
    private final ObjectMapper objectMapper;

    public BearerTokenFilter(SandboxManagerProperties properties, ObjectMapper objectMapper) {
        this.expectedToken = properties.bearerToken().getBytes(StandardCharsets.UTF_8);
        this.objectMapper = objectMapper;
        if (expectedToken.length == 0) {
            log.warn("sandbox.bearer-token is not configured, management API authentication is disabled");
        }
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        if (expectedToken.length == 0) return true;
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return path.equals("/health");
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (StringUtils.hasText(header) && header.startsWith(BEARER_PREFIX)) {
            byte[] presented = header.substring(BEARER_PREFIX.length()).trim().getBytes(StandardCharsets.UTF_8);
            // 상수 시간 비교
            if (MessageDigest.isEqual(expectedToken, presented)) {
                filterChain.doFilter(request, response);
                return;
            }
        }

        log.warn("Rejected unauthenticated request: {} {}", request.getMethod(), request.getRequestURI());
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(),
                ErrorResponse.of(GlobalErrorCode.UNAUTHORIZED, GlobalErrorCode.UNAUTHORIZED.getMessage()));
    }
}
