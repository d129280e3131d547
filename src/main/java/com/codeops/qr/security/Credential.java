package com.codeops.qr.security;

/**
 * A configured user. The secret is either a plaintext password or a BCrypt hash.
 *
 * @param username the unique username
 * @param secret   the password or its BCrypt hash
 */
public record Credential(String username, String secret) {

    /**
     * Returns whether the secret is a BCrypt hash rather than a plaintext password.
     *
     * @return true for {@code $2a$}, {@code $2b$} and {@code $2y$} hashes
     */
    public boolean isHashed() {
        return secret.startsWith("$2a$") || secret.startsWith("$2b$") || secret.startsWith("$2y$");
    }

    @Override
    public String toString() {
        return "Credential[username=" + username + ", secret=****]";
    }
}
