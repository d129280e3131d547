package com.codeops.qr.controller;

import com.codeops.qr.config.AppConstants;
import com.codeops.qr.dto.request.TokenRequest;
import com.codeops.qr.dto.response.TokenResponse;
import com.codeops.qr.dto.response.TokenValidationResponse;
import com.codeops.qr.security.IssuedToken;
import com.codeops.qr.security.SecurityUtils;
import com.codeops.qr.security.Subject;
import com.codeops.qr.security.TokenService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for token issuance and validation.
 * Token issuance is public; validation requires a bearer token.
 */
@RestController
@RequestMapping(AppConstants.API_PREFIX + "/auth")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Authentication", description = "Issue and validate bearer tokens")
public class AuthController {

    private final TokenService tokenService;

    /**
     * Issues an access token for a configured user.
     *
     * @param request the username and password
     * @return the signed token, its type, and lifetime in seconds
     */
    @PostMapping("/token")
    public TokenResponse createToken(@Valid @RequestBody TokenRequest request) {
        log.info("Token requested for '{}'", request.username());
        IssuedToken token = tokenService.issue(request.username(), request.password());
        return new TokenResponse(token.accessToken(), token.tokenType(), token.expiresIn());
    }

    /**
     * Reports the subject of the bearer token that authenticated this request.
     * An invalid or expired token never reaches this method.
     *
     * @return the token subject, expiry in epoch seconds, and scopes
     */
    @PostMapping("/validate")
    public TokenValidationResponse validateToken() {
        Subject subject = SecurityUtils.getCurrentSubject();
        return new TokenValidationResponse(true, subject.username(),
                subject.expiresAt().getEpochSecond(), subject.scopes());
    }
}
