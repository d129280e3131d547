package com.codeops.qr.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configured user credentials, bound to the {@code codeops.auth} prefix.
 *
 * <p>{@code users} holds the raw {@code AUTH_USERS} JSON object mapping username to
 * password or BCrypt hash. When it is blank the single {@code username}/{@code password}
 * pair is used instead.</p>
 *
 * @see com.codeops.qr.security.CredentialStore
 */
@ConfigurationProperties(prefix = "codeops.auth")
@Getter
@Setter
public class AuthProperties {
    private String users;
    private String username;
    private String password;
}
