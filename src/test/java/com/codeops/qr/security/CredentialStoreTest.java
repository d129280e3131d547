package com.codeops.qr.security;

import com.codeops.qr.config.AuthProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for CredentialStore covering JSON loading, the single-user fallback, and startup failures.
 */
class CredentialStoreTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void lookup_findsConfiguredUsers() {
        CredentialStore store = store("{\"admin\":\"secure_password_123\",\"ops\":\"ops-pass\"}", null, null);

        assertThat(store.size()).isEqualTo(2);
        assertThat(store.lookup("admin")).get()
                .extracting(Credential::secret).isEqualTo("secure_password_123");
        assertThat(store.lookup("ops")).isPresent();
    }

    @Test
    void lookup_unknownOrNullUsername_returnsEmpty() {
        CredentialStore store = store("{\"admin\":\"secure_password_123\"}", null, null);

        assertThat(store.lookup("root")).isEmpty();
        assertThat(store.lookup(null)).isEmpty();
    }

    @Test
    void blankUsersJson_fallsBackToSingleUser() {
        CredentialStore store = store("  ", "admin", "secure_password_123");

        assertThat(store.size()).isEqualTo(1);
        assertThat(store.lookup("admin")).isPresent();
    }

    @Test
    void malformedJson_failsFast() {
        assertThatThrownBy(() -> store("{not json", null, null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("AUTH_USERS");
    }

    @Test
    void nonObjectJson_failsFast() {
        assertThatThrownBy(() -> store("[\"admin\"]", null, null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("JSON object");
    }

    @Test
    void duplicateUsername_failsFast() {
        assertThatThrownBy(() -> store("{\"admin\":\"a\",\"admin\":\"b\"}", null, null))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void nonStringPassword_failsFast() {
        assertThatThrownBy(() -> store("{\"admin\":123}", null, null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("admin");
    }

    @Test
    void emptyObject_failsFast() {
        assertThatThrownBy(() -> store("{}", null, null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("at least one user");
    }

    @Test
    void noUsersAndNoFallback_failsFast() {
        assertThatThrownBy(() -> store(null, null, null))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void credential_detectsBcryptHashes() {
        assertThat(new Credential("a", "$2a$10$abcdefghijklmnopqrstuv").isHashed()).isTrue();
        assertThat(new Credential("a", "plain-password").isHashed()).isFalse();
        assertThat(new Credential("a", "secret").toString()).doesNotContain("secret");
    }

    private CredentialStore store(String users, String username, String password) {
        AuthProperties properties = new AuthProperties();
        properties.setUsers(users);
        properties.setUsername(username);
        properties.setPassword(password);
        return new CredentialStore(properties, objectMapper);
    }
}
