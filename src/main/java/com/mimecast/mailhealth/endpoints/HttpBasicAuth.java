package com.mimecast.mailhealth.endpoints;

import com.sun.net.httpserver.HttpExchange;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * HTTP Basic Authentication for the exporter endpoint.
 *
 * <p>Authentication is off unless both username and password are given.
 * <p>Usage:
 * <pre>{@code
 * HttpBasicAuth auth = new HttpBasicAuth(username, password, "Mail Health Exporter");
 * if (!auth.isAuthenticated(exchange)) {
 *     auth.sendAuthRequired(exchange);
 *     return;
 * }
 * }</pre>
 */
public class HttpBasicAuth {
    private static final Logger log = LogManager.getLogger(HttpBasicAuth.class);

    private static final String BASIC = "Basic ";

    private final byte[] username;
    private final byte[] password;
    private final boolean authEnabled;
    private final String realm;

    /**
     * Constructs a new HttpBasicAuth instance.
     *
     * @param username Username, null or empty to disable authentication.
     * @param password Password, null or empty to disable authentication.
     * @param realm    Realm name.
     */
    public HttpBasicAuth(String username, String password, String realm) {
        this.authEnabled = username != null && !username.isEmpty() && password != null && !password.isEmpty();
        this.username = authEnabled ? username.getBytes(StandardCharsets.UTF_8) : new byte[0];
        this.password = authEnabled ? password.getBytes(StandardCharsets.UTF_8) : new byte[0];
        this.realm = realm != null ? realm : "Restricted";
    }

    /**
     * Checks if authentication is enabled.
     *
     * @return Boolean.
     */
    public boolean isAuthEnabled() {
        return authEnabled;
    }

    /**
     * Checks the Authorization header of a request.
     *
     * @param exchange HttpExchange instance.
     * @return True if authentication is off or the credentials match.
     */
    public boolean isAuthenticated(HttpExchange exchange) {
        if (!authEnabled) {
            return true;
        }
        return matches(exchange.getRequestHeaders().getFirst("Authorization"));
    }

    /**
     * Checks an Authorization header value.
     *
     * @param header Header value, may be null.
     * @return Boolean.
     */
    boolean matches(String header) {
        if (header == null || !header.startsWith(BASIC)) {
            log.debug("Authentication failed: missing or invalid Authorization header");
            return false;
        }

        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(header.substring(BASIC.length()).trim());
        } catch (IllegalArgumentException e) {
            log.debug("Authentication failed: undecodable credentials: {}", e.getMessage());
            return false;
        }

        String credentials = new String(decoded, StandardCharsets.UTF_8);
        int colon = credentials.indexOf(':');
        if (colon < 0) {
            log.debug("Authentication failed: malformed credentials");
            return false;
        }

        // Compare both halves so timing does not reveal which one differs.
        boolean userOk = MessageDigest.isEqual(username, credentials.substring(0, colon).getBytes(StandardCharsets.UTF_8));
        boolean passOk = MessageDigest.isEqual(password, credentials.substring(colon + 1).getBytes(StandardCharsets.UTF_8));
        if (!(userOk && passOk)) {
            log.debug("Authentication failed: invalid credentials");
        }
        return userOk && passOk;
    }

    /**
     * Sends a 401 response with a WWW-Authenticate challenge.
     *
     * @param exchange HttpExchange instance.
     * @throws IOException If an I/O error occurs.
     */
    public void sendAuthRequired(HttpExchange exchange) throws IOException {
        log.debug("Sending 401 Unauthorized to {}", exchange.getRemoteAddress());
        exchange.getResponseHeaders().set("WWW-Authenticate", "Basic realm=\"" + realm + "\"");
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        byte[] responseBytes = "Unauthorized".getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(401, responseBytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(responseBytes);
        }
    }
}
