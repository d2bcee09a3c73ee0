package com.gatehouse.backend.global.security;

import java.io.IOException;
import java.util.Optional;

import com.gatehouse.backend.global.error.ProblemException;
import com.gatehouse.backend.modules.auth.application.AuthenticationService;
import com.gatehouse.backend.modules.auth.infrastructure.web.SessionCookieManager;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the session token of each request, from the bearer header or the session cookie.
 * A presented token that does not resolve ends the request with 401.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    private final AuthenticationService authenticationService;
    private final SessionCookieManager sessionCookieManager;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;

    public JwtAuthenticationFilter(
            AuthenticationService authenticationService,
            SessionCookieManager sessionCookieManager,
            RestAuthenticationEntryPoint authenticationEntryPoint
    ) {
        this.authenticationService = authenticationService;
        this.sessionCookieManager = sessionCookieManager;
        this.authenticationEntryPoint = authenticationEntryPoint;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        Optional<String> token = sessionCookieManager.resolveToken(request);
        if (token.isPresent()) {
            try {
                authenticationService.loadPrincipalFromToken(token.get());
            } catch (ProblemException ex) {
                SecurityContextHolder.clearContext();
                log.debug("Rejected session token on {}: {}", request.getRequestURI(), ex.getCode());
                authenticationEntryPoint.reject(request, response, ex);
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getServletPath();
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        return path.equals("/auth/sign-in")
                || path.equals("/auth/sign-up")
                || path.equals("/auth/sign-out")
                || path.startsWith("/actuator/health")
                || path.startsWith("/v3/api-docs")
                || path.startsWith("/swagger-ui");
    }
}
