package com.baskettecase.mongostudio.security;

import com.baskettecase.mongostudio.config.MongoStudioProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Collections;

/**
 * Access Token Authentication Filter
 *
 * Checks the configured access token on REST and MCP requests. The token is read from
 * {@code Authorization: Bearer <token>} or from the {@code X-Access-Token} header.
 * With no token configured every request passes through unauthenticated.
 */
@Slf4j
@Component
public class AccessTokenAuthenticationFilter extends OncePerRequestFilter {

    static final String TOKEN_HEADER = "X-Access-Token";
    static final String ROLE = "ROLE_STUDIO_USER";

    private final byte[] expectedToken;

    public AccessTokenAuthenticationFilter(MongoStudioProperties properties) {
        String token = properties.getSecurity().getAccessToken();
        this.expectedToken = token == null || token.isBlank()
            ? null
            : token.trim().getBytes(StandardCharsets.UTF_8);
    }

    public boolean isEnabled() {
        return expectedToken != null;
    }

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain
    ) throws ServletException, IOException {

        String requestPath = request.getRequestURI();

        if (!isEnabled() || isPublicEndpoint(requestPath)) {
            filterChain.doFilter(request, response);
            return;
        }

        String token = extractToken(request);
        if (token != null && MessageDigest.isEqual(expectedToken, token.getBytes(StandardCharsets.UTF_8))) {
            UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                "mongo-studio", null, Collections.singletonList(new SimpleGrantedAuthority(ROLE)));
            SecurityContextHolder.getContext().setAuthentication(authentication);

            log.debug("✅ Authenticated request: {} {}", request.getMethod(), requestPath);
            filterChain.doFilter(request, response);
            return;
        }

        log.warn("❌ Rejected request to {} from {}: {}", requestPath, request.getRemoteAddr(),
            token == null ? "no access token" : "invalid access token");
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType("application/json");
        response.getWriter().write(
            "{\"error\":\"Unauthorized\",\"message\":\"Valid access token required. " +
            "Provide it in the Authorization header as 'Bearer {token}' or in the X-Access-Token header\"}"
        );
    }

    private String extractToken(HttpServletRequest request) {
        String authHeader = request.getHeader("Authorization");
        if (authHeader != null && authHeader.trim().toLowerCase().startsWith("bearer ")) {
            return authHeader.trim().substring(7).trim();
        }
        String header = request.getHeader(TOKEN_HEADER);
        return header != null && !header.isBlank() ? header.trim() : null;
    }

    static boolean isPublicEndpoint(String path) {
        return path.startsWith("/actuator/health") || path.startsWith("/actuator/info");
    }
}
