package com.campusfeedback.backend.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Authenticates internal service calls carrying the shared API key in {@code X-API-Key}.
 * Requests without the header pass through unauthenticated.
 */
@Component
@Slf4j
public class ServiceApiKeyFilter extends OncePerRequestFilter {

    public static final String API_KEY_HEADER = "X-API-Key";
    public static final String SERVICE_AUTHORITY = "ROLE_SERVICE";
    static final String SERVICE_PRINCIPAL = "service-account";

    private final String apiKey;

    public ServiceApiKeyFilter(@Value("${app.service.api-key:}") String apiKey) {
        this.apiKey = apiKey;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String presented = request.getHeader(API_KEY_HEADER);

        if (StringUtils.hasText(presented) && SecurityContextHolder.getContext().getAuthentication() == null) {
            if (matches(presented)) {
                var authorities = List.of(new SimpleGrantedAuthority(SERVICE_AUTHORITY));
                var auth = new UsernamePasswordAuthenticationToken(SERVICE_PRINCIPAL, null, authorities);
                SecurityContextHolder.getContext().setAuthentication(auth);
            } else {
                log.warn("Invalid API key for URI: {}", request.getRequestURI());
            }
        }

        filterChain.doFilter(request, response);
    }

    private boolean matches(String presented) {
        if (!StringUtils.hasText(apiKey)) {
            return false;
        }
        return MessageDigest.isEqual(apiKey.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8));
    }
}
