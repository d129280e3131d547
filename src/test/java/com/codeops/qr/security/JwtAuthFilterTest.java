package com.codeops.qr.security;

import com.codeops.qr.exception.MissingTokenException;
import com.codeops.qr.exception.TokenExpiredException;
import com.codeops.qr.exception.TokenMalformedException;
import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for JwtAuthFilter covering SecurityContext population and failure recording.
 */
@ExtendWith(MockitoExtension.class)
class JwtAuthFilterTest {

    @Mock
    private BearerTokenGate bearerTokenGate;

    @Mock
    private FilterChain filterChain;

    @InjectMocks
    private JwtAuthFilter jwtAuthFilter;

    private MockHttpServletRequest request;
    private MockHttpServletResponse response;

    @BeforeEach
    void setUp() {
        SecurityContextHolder.clearContext();
        request = new MockHttpServletRequest();
        response = new MockHttpServletResponse();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void validToken_setsSecurityContextWithScopes() throws Exception {
        Subject subject = new Subject("admin", Instant.now(), Instant.now().plusSeconds(60), List.of("qr:generate"));
        when(bearerTokenGate.authenticate(request)).thenReturn(subject);

        jwtAuthFilter.doFilterInternal(request, response, filterChain);

        var authentication = SecurityContextHolder.getContext().getAuthentication();
        assertThat(authentication).isNotNull();
        assertThat(authentication.getPrincipal()).isEqualTo(subject);
        assertThat(authentication.getAuthorities()).extracting(GrantedAuthority::getAuthority)
                .containsExactly("SCOPE_qr:generate");
        verify(filterChain).doFilter(request, response);
    }

    @Test
    void missingToken_recordsFailureAndContinues() throws Exception {
        when(bearerTokenGate.authenticate(request)).thenThrow(new MissingTokenException());

        jwtAuthFilter.doFilterInternal(request, response, filterChain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(request.getAttribute(JwtAuthFilter.AUTH_FAILURE_ATTR)).isInstanceOf(MissingTokenException.class);
        verify(filterChain).doFilter(request, response);
    }

    @Test
    void expiredToken_recordsFailureAndContinues() throws Exception {
        when(bearerTokenGate.authenticate(request)).thenThrow(new TokenExpiredException(null));

        jwtAuthFilter.doFilterInternal(request, response, filterChain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(request.getAttribute(JwtAuthFilter.AUTH_FAILURE_ATTR)).isInstanceOf(TokenExpiredException.class);
        verify(filterChain).doFilter(request, response);
    }

    @Test
    void malformedToken_recordsFailureAndContinues() throws Exception {
        when(bearerTokenGate.authenticate(request)).thenThrow(new TokenMalformedException());

        jwtAuthFilter.doFilterInternal(request, response, filterChain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(request.getAttribute(JwtAuthFilter.AUTH_FAILURE_ATTR)).isInstanceOf(TokenMalformedException.class);
        verify(filterChain).doFilter(request, response);
    }
}
