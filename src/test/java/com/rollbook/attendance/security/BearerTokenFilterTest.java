package com.rollbook.attendance.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Instant;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rollbook.attendance.service.AccessTokenService;

class BearerTokenFilterTest {

    private AccessTokenService tokenService;
    private BearerTokenFilter filter;

    @BeforeEach
    void setUp() {
        tokenService = mock(AccessTokenService.class);
        filter = new BearerTokenFilter(tokenService, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void onlyTeacherRoutesAreProtected() {
        assertThat(BearerTokenFilter.isProtected("/students")).isTrue();
        assertThat(BearerTokenFilter.isProtected("/attendance/mark")).isTrue();
        assertThat(BearerTokenFilter.isProtected("/reports/summary")).isTrue();
        assertThat(BearerTokenFilter.isProtected("/auth/login")).isFalse();
        assertThat(BearerTokenFilter.isProtected("/studentsx")).isFalse();
        assertThat(BearerTokenFilter.isProtected("/actuator/health")).isFalse();
    }

    @Test
    void publicRoutePassesWithoutToken() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/auth/login");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(chain.getRequest()).isSameAs(request);
        verifyNoInteractions(tokenService);
    }

    @Test
    void missingHeaderIsUnauthorized() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/students");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentAsString()).isEqualTo("{\"message\":\"Unauthorized\"}");
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    void invalidTokenCarriesTheReason() throws Exception {
        when(tokenService.validateToken("expired"))
                .thenReturn(AccessTokenService.ValidationResult.failure("Token has expired"));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/reports/summary");
        request.addHeader("Authorization", "Bearer expired");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentAsString())
                .isEqualTo("{\"message\":\"Invalid token\",\"error\":\"Token has expired\"}");
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    void validTokenAuthenticatesTheTeacher() throws Exception {
        when(tokenService.validateToken("good"))
                .thenReturn(AccessTokenService.ValidationResult.success(42L, Instant.now().plusSeconds(60)));
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/attendance/mark");
        request.addHeader("Authorization", "Bearer good");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(chain.getRequest()).isSameAs(request);
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertThat(authentication.getPrincipal()).isEqualTo(new AuthenticatedTeacher(42L));
        assertThat(authentication.getAuthorities()).extracting("authority").containsExactly("ROLE_TEACHER");
    }
}
