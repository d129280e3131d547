package com.codeops.qr.security;

import com.codeops.qr.config.AuthProperties;
import com.codeops.qr.config.JwtProperties;
import com.codeops.qr.exception.InvalidCredentialsException;
import com.codeops.qr.exception.TokenExpiredException;
import com.codeops.qr.exception.TokenMalformedException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

/**
 * Tests for TokenService covering issuance, verification, expiry, tampering, and startup checks.
 */
class TokenServiceTest {

    private static final String SECRET = "test-secret-key-minimum-32-characters-long-for-hs256-testing";
    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private CredentialStore credentialStore;
    private TokenService tokenService;

    @BeforeEach
    void setUp() {
        String hashed = new BCryptPasswordEncoder().encode("hashed-pass-789");
        AuthProperties authProperties = new AuthProperties();
        authProperties.setUsers("{\"admin\":\"secure_password_123\",\"hasher\":\"" + hashed + "\"}");
        credentialStore = new CredentialStore(authProperties, new ObjectMapper());
        tokenService = service(SECRET, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void issue_validCredentials_returnsBearerTokenWithTtl() {
        IssuedToken token = tokenService.issue("admin", "secure_password_123");

        assertThat(token.accessToken()).isNotBlank();
        assertThat(token.tokenType()).isEqualTo("bearer");
        assertThat(token.expiresIn()).isEqualTo(1800);
        assertThat(token.expiresAt()).isEqualTo(NOW.plusSeconds(1800));
    }

    @Test
    void issueThenVerify_returnsSameSubject() {
        IssuedToken token = tokenService.issue("admin", "secure_password_123");

        Subject subject = tokenService.verify(token.accessToken());

        assertThat(subject.username()).isEqualTo("admin");
        assertThat(subject.issuedAt()).isEqualTo(NOW);
        assertThat(subject.expiresAt()).isEqualTo(NOW.plusSeconds(1800));
        assertThat(subject.hasScope("qr:generate")).isTrue();
    }

    @Test
    void verify_justBeforeExpiry_succeeds() {
        IssuedToken token = tokenService.issue("admin", "secure_password_123");
        TokenService later = service(SECRET, Clock.fixed(NOW.plusSeconds(1799), ZoneOffset.UTC));

        assertThat(later.verify(token.accessToken()).username()).isEqualTo("admin");
    }

    @Test
    void verify_afterTtl_throwsTokenExpired() {
        IssuedToken token = tokenService.issue("admin", "secure_password_123");
        TokenService later = service(SECRET, Clock.offset(Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofSeconds(1801)));

        assertThatThrownBy(() -> later.verify(token.accessToken()))
                .isInstanceOf(TokenExpiredException.class)
                .hasMessage("Token has expired");
    }

    @Test
    void issue_bcryptSecret_matchesPlainPassword() {
        IssuedToken token = tokenService.issue("hasher", "hashed-pass-789");

        assertThat(tokenService.verify(token.accessToken()).username()).isEqualTo("hasher");
    }

    @Test
    void issue_wrongPasswordAndUnknownUser_failIdentically() {
        Throwable wrongPassword = catchThrowable(
                () -> tokenService.issue("admin", "nope"));
        Throwable unknownUser = catchThrowable(
                () -> tokenService.issue("mallory", "secure_password_123"));

        assertThat(wrongPassword).isInstanceOf(InvalidCredentialsException.class);
        assertThat(unknownUser).isInstanceOf(InvalidCredentialsException.class);
        assertThat(wrongPassword.getMessage()).isEqualTo(unknownUser.getMessage());
    }

    @Test
    void issue_nullPassword_throwsInvalidCredentials() {
        assertThatThrownBy(() -> tokenService.issue("admin", null))
                .isInstanceOf(InvalidCredentialsException.class);
    }

    @Test
    void verify_tokenSignedWithDifferentKey_throwsMalformed() {
        TokenService other = service("another-secret-key-that-is-also-32-chars-or-more", Clock.fixed(NOW, ZoneOffset.UTC));
        IssuedToken foreign = other.issue("admin", "secure_password_123");

        assertThatThrownBy(() -> tokenService.verify(foreign.accessToken()))
                .isInstanceOf(TokenMalformedException.class);
    }

    @Test
    void verify_tamperedPayload_throwsMalformed() {
        String token = tokenService.issue("admin", "secure_password_123").accessToken();
        String[] parts = token.split("\\.");
        String payload = new String(Base64.getUrlDecoder().decode(parts[1]), StandardCharsets.UTF_8);
        String forged = Base64.getUrlEncoder().withoutPadding()
                .encodeToString(payload.replace("\"admin\"", "\"root\"").getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> tokenService.verify(parts[0] + "." + forged + "." + parts[2]))
                .isInstanceOf(TokenMalformedException.class);
    }

    @Test
    void verify_garbage_throwsMalformed() {
        assertThatThrownBy(() -> tokenService.verify("not.a.valid.jwt"))
                .isInstanceOf(TokenMalformedException.class);
        assertThatThrownBy(() -> tokenService.verify(""))
                .isInstanceOf(TokenMalformedException.class);
    }

    @Test
    void verify_wrongIssuer_throwsMalformed() {
        SecretKey key = Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8));
        String token = Jwts.builder()
                .subject("admin")
                .issuer("someone-else")
                .issuedAt(Date.from(NOW))
                .expiration(Date.from(NOW.plusSeconds(600)))
                .signWith(key)
                .compact();

        assertThatThrownBy(() -> tokenService.verify(token))
                .isInstanceOf(TokenMalformedException.class);
    }

    @Test
    void validateSecret_throwsForShortSecret() {
        JwtProperties properties = new JwtProperties();
        properties.setSecret("short");
        TokenService shortService = new TokenService(properties, credentialStore, Clock.systemUTC());

        assertThatThrownBy(shortService::validateSecret)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("32 characters");
    }

    @Test
    void validateSecret_throwsForMissingSecret() {
        TokenService missing = new TokenService(new JwtProperties(), credentialStore, Clock.systemUTC());

        assertThatThrownBy(missing::validateSecret)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("SECRET_KEY");
    }

    private TokenService service(String secret, Clock clock) {
        JwtProperties properties = new JwtProperties();
        properties.setSecret(secret);
        TokenService service = new TokenService(properties, credentialStore, clock);
        service.validateSecret();
        return service;
    }
}
