package com.codeops.qr.security;

import com.codeops.qr.config.AppConstants;
import com.codeops.qr.config.JwtProperties;
import com.codeops.qr.exception.InvalidCredentialsException;
import com.codeops.qr.exception.TokenExpiredException;
import com.codeops.qr.exception.TokenMalformedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.List;
import java.util.UUID;

/**
 * Issues and verifies HS256-signed access tokens.
 *
 * <p>Tokens carry the username as subject, the configured issuer, issue and expiry
 * times, and the {@code qr:generate} scope. Validity depends only on the signature and
 * the current time; nothing is stored server-side.</p>
 *
 * <p>The signing secret is checked at startup: it must be present and at least
 * {@value AppConstants#MIN_SECRET_LENGTH} characters long.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TokenService {

    static final String SCOPES_CLAIM = "scopes";

    private static final Credential TIMING_DUMMY = new Credential("", "timing-equalization-secret");

    private final JwtProperties jwtProperties;
    private final CredentialStore credentialStore;
    private final Clock clock;
    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder();

    private SecretKey signingKey;

    /**
     * Validates the signing secret and derives the HMAC key.
     *
     * @throws IllegalStateException if the secret is missing or too short
     */
    @PostConstruct
    public void validateSecret() {
        String secret = jwtProperties.getSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("SECRET_KEY must be set");
        }
        if (secret.length() < AppConstants.MIN_SECRET_LENGTH) {
            throw new IllegalStateException("SECRET_KEY must be at least "
                    + AppConstants.MIN_SECRET_LENGTH + " characters");
        }
        if (jwtProperties.getTtlSeconds() <= 0) {
            throw new IllegalStateException("Token TTL must be positive");
        }
        signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Issues a token for a configured user.
     *
     * @param username the username
     * @param password the password to check
     * @return the signed token and its lifetime
     * @throws InvalidCredentialsException if the username is unknown or the password does not match
     */
    public IssuedToken issue(String username, String password) {
        Credential credential = credentialStore.lookup(username).orElse(null);
        boolean matches;
        if (credential == null) {
            secretMatches(TIMING_DUMMY, password);
            matches = false;
        } else {
            matches = secretMatches(credential, password);
        }
        if (!matches) {
            log.warn("Token request rejected for username '{}'", username);
            throw new InvalidCredentialsException();
        }

        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plusSeconds(jwtProperties.getTtlSeconds());
        String token = Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(credential.username())
                .issuer(jwtProperties.getIssuer())
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .claim(SCOPES_CLAIM, List.of(AppConstants.SCOPE_QR_GENERATE))
                .signWith(signingKey, Jwts.SIG.HS256)
                .compact();

        log.info("Issued token for '{}' expiring at {}", credential.username(), expiresAt);
        return new IssuedToken(token, AppConstants.TOKEN_TYPE, jwtProperties.getTtlSeconds(), expiresAt);
    }

    /**
     * Verifies a token's signature, issuer, and expiry.
     *
     * @param token the compact JWT
     * @return the authenticated subject
     * @throws TokenExpiredException   if the token is past its expiry
     * @throws TokenMalformedException if the token cannot be parsed or verified
     */
    public Subject verify(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenMalformedException();
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .requireIssuer(jwtProperties.getIssuer())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw new TokenExpiredException(e);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token rejected: {}", e.getMessage());
            throw new TokenMalformedException(e);
        }

        if (claims.getSubject() == null || claims.getSubject().isBlank()
                || claims.getExpiration() == null || claims.getIssuedAt() == null) {
            throw new TokenMalformedException();
        }
        return new Subject(claims.getSubject(), claims.getIssuedAt().toInstant(),
                claims.getExpiration().toInstant(), scopesOf(claims));
    }

    private boolean secretMatches(Credential credential, String password) {
        String candidate = password != null ? password : "";
        if (credential.isHashed()) {
            return passwordEncoder.matches(candidate, credential.secret());
        }
        return MessageDigest.isEqual(sha256(candidate), sha256(credential.secret()));
    }

    private static List<String> scopesOf(Claims claims) {
        Object scopes = claims.get(SCOPES_CLAIM);
        if (scopes instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }

    private static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
