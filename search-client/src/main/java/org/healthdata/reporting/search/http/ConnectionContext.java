package org.healthdata.reporting.search.http;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.Locale;

import lombok.Builder;
import lombok.Getter;

/**
 * Where and how to reach the search cluster: endpoint, optional basic credentials, TLS trust and the
 * per-request timeout.
 */
@Getter
public class ConnectionContext {
    public enum Protocol {
        HTTP,
        HTTPS
    }

    private final URI uri;
    private final Protocol protocol;
    private final String username;
    private final String password;
    private final boolean insecure;
    /** PEM bundle of trusted CA certificates, or null for the JDK trust store. */
    private final Path caCert;
    private final Duration requestTimeout;

    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    @Builder
    private ConnectionContext(String host, String username, String password, boolean insecure, Path caCert,
                              Duration requestTimeout) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Search host is required");
        }
        try {
            this.uri = new URI(host.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid search host: " + host, e);
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new IllegalArgumentException("Search host must include a scheme and host name: " + host);
        }
        this.protocol = switch (uri.getScheme().toLowerCase(Locale.ROOT)) {
            case "http" -> Protocol.HTTP;
            case "https" -> Protocol.HTTPS;
            default -> throw new IllegalArgumentException("Unsupported scheme: " + uri.getScheme());
        };
        if ((username == null) != (password == null)) {
            throw new IllegalArgumentException("Both username and password must be provided, or neither");
        }
        this.username = username;
        this.password = password;
        this.insecure = insecure;
        if (caCert != null && !Files.isReadable(caCert)) {
            throw new IllegalArgumentException("CA certificate is not readable: " + caCert);
        }
        this.caCert = caCert;
        this.requestTimeout = requestTimeout != null ? requestTimeout : DEFAULT_REQUEST_TIMEOUT;
        if (this.requestTimeout.isZero() || this.requestTimeout.isNegative()) {
            throw new IllegalArgumentException("Request timeout must be positive: " + requestTimeout);
        }
    }

    public boolean hasCredentials() {
        return username != null;
    }

    /** Value for the {@code Authorization} header, or null without credentials. */
    public String basicAuthorization() {
        if (!hasCredentials()) {
            return null;
        }
        var token = Base64.getEncoder().encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
        return "Basic " + token;
    }

    @Override
    public String toString() {
        return "ConnectionContext{uri=" + uri + ", authenticated=" + hasCredentials() + ", insecure=" + insecure
            + ", caCert=" + caCert + ", requestTimeout=" + requestTimeout + "}";
    }
}
