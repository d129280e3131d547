package com.codeops.qr.security;

import com.codeops.qr.config.AuthProperties;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only store of the users allowed to request tokens.
 *
 * <p>Built once at startup from {@code AUTH_USERS}, a JSON object mapping each username
 * to its password or BCrypt hash. When {@code AUTH_USERS} is blank the single
 * {@code AUTH_USERNAME}/{@code AUTH_PASSWORD} pair is used. Any malformed configuration
 * aborts startup with an {@link IllegalStateException}.</p>
 *
 * <p>The backing map is immutable, so lookups need no synchronization.</p>
 */
@Component
@Slf4j
public class CredentialStore {

    private final Map<String, Credential> credentials;

    /**
     * Parses the configured users.
     *
     * @param authProperties the configured credentials
     * @param objectMapper   the application object mapper
     * @throws IllegalStateException if the configuration is malformed or yields no users
     */
    public CredentialStore(AuthProperties authProperties, ObjectMapper objectMapper) {
        String usersJson = authProperties.getUsers();
        Map<String, Credential> parsed = usersJson != null && !usersJson.isBlank()
                ? parseUsers(usersJson, objectMapper)
                : singleUser(authProperties.getUsername(), authProperties.getPassword());
        if (parsed.isEmpty()) {
            throw new IllegalStateException("AUTH_USERS must configure at least one user");
        }
        this.credentials = Map.copyOf(parsed);
        log.info("Loaded {} configured user(s)", credentials.size());
    }

    /**
     * Finds the credential for a username.
     *
     * @param username the username to look up
     * @return the credential, or empty when the username is not configured
     */
    public Optional<Credential> lookup(String username) {
        if (username == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(credentials.get(username));
    }

    /**
     * Returns the number of configured users.
     *
     * @return the user count
     */
    public int size() {
        return credentials.size();
    }

    private static Map<String, Credential> parseUsers(String usersJson, ObjectMapper objectMapper) {
        JsonNode root;
        try {
            root = objectMapper.copy()
                    .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
                    .readTree(usersJson);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("AUTH_USERS is not valid JSON or repeats a username", e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("AUTH_USERS must be a JSON object mapping username to password");
        }

        Map<String, Credential> users = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String username = field.getKey();
            JsonNode secret = field.getValue();
            if (username.isBlank()) {
                throw new IllegalStateException("AUTH_USERS contains a blank username");
            }
            if (!secret.isTextual() || secret.asText().isBlank()) {
                throw new IllegalStateException("AUTH_USERS entry '" + username + "' must have a non-blank string password");
            }
            users.put(username, new Credential(username, secret.asText()));
        }
        return users;
    }

    private static Map<String, Credential> singleUser(String username, String password) {
        if (username == null || username.isBlank() || password == null || password.isBlank()) {
            throw new IllegalStateException("Either AUTH_USERS or both AUTH_USERNAME and AUTH_PASSWORD must be set");
        }
        return Map.of(username, new Credential(username, password));
    }
}
