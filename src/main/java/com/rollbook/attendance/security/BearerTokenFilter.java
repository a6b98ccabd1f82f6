package com.rollbook.attendance.security;

import java.io.IOException;
import java.util.List;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rollbook.attendance.model.dto.ErrorResponseDTO;
import com.rollbook.attendance.service.AccessTokenService;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * OncePerRequestFilter on /students, /attendance and /reports.
 * Reads the "Authorization: Bearer" header, verifies the token via
 * AccessTokenService and returns 401 if it is missing or invalid. On success the
 * teacher becomes the authenticated principal of the request.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BearerTokenFilter extends OncePerRequestFilter {

    static final List<String> PROTECTED_PATHS = List.of("/students", "/attendance", "/reports");

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String TEACHER_ROLE = "ROLE_TEACHER";

    private final AccessTokenService tokenService;
    private final ObjectMapper objectMapper;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !isProtected(pathWithinApplication(request));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER_PREFIX) || header.length() == BEARER_PREFIX.length()) {
            log.debug("AUTH_FILTER: No bearer token on {}", request.getRequestURI());
            writeUnauthorized(response, ErrorResponseDTO.of("Unauthorized"));
            return;
        }

        AccessTokenService.ValidationResult result = tokenService.validateToken(header.substring(BEARER_PREFIX.length()));
        if (!result.valid()) {
            log.warn("AUTH_FILTER: Rejected token on {}: {}", request.getRequestURI(), result.errorMessage());
            writeUnauthorized(response, ErrorResponseDTO.of("Invalid token", result.errorMessage()));
            return;
        }

        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                new AuthenticatedTeacher(result.teacherId()), null,
                List.of(new SimpleGrantedAuthority(TEACHER_ROLE)));
        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(authentication);
        SecurityContextHolder.setContext(context);

        log.debug("AUTH_FILTER: Teacher {} authenticated for {}", result.teacherId(), request.getRequestURI());
        filterChain.doFilter(request, response);
    }

    static boolean isProtected(String path) {
        for (String prefix : PROTECTED_PATHS) {
            if (path.equals(prefix) || path.startsWith(prefix + "/")) {
                return true;
            }
        }
        return false;
    }

    private static String pathWithinApplication(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }

    private void writeUnauthorized(HttpServletResponse response, ErrorResponseDTO body) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
