package org.healthdata.reporting.service.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;

import org.healthdata.reporting.common.IndexAllowList;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.Yaml;

/**
 * Settings for the reporting core.
 *
 * <p>Loaded in priority order, lowest first:
 * <ol>
 *   <li>classpath defaults ({@value #DEFAULT_CONFIG_FILE})</li>
 *   <li>environment variables ({@code ELASTICSEARCH_HOST}, {@code ALLOWED_HEALTH_INDEXES}, ...)</li>
 *   <li>system properties ({@code reporting.search.host}, ...)</li>
 * </ol>
 */
@Slf4j
@Getter
public class ReportingConfig {
    static final String DEFAULT_CONFIG_FILE = "reporting.yaml";

    static final String ENV_HOST = "ELASTICSEARCH_HOST";
    static final String ENV_USERNAME = "ELASTICSEARCH_USERNAME";
    static final String ENV_PASSWORD = "ELASTICSEARCH_PASSWORD";
    static final String ENV_INSECURE = "ELASTICSEARCH_INSECURE";
    static final String ENV_CA_CERT = "ELASTICSEARCH_CA_CERT";
    static final String ENV_REQUEST_TIMEOUT = "ELASTICSEARCH_REQUEST_TIMEOUT_SECONDS";
    static final String ENV_MAX_CONNECTIONS = "ELASTICSEARCH_MAX_CONNECTIONS";
    static final String ENV_ALLOWED_INDEXES = "ALLOWED_HEALTH_INDEXES";
    static final String ENV_PROJECT_INDEX_MAPPING = "PROJECT_INDEX_MAPPING";
    static final String ENV_DEFAULT_SOURCE_LIMIT = "JOIN_DEFAULT_SOURCE_LIMIT";
    static final String ENV_MAX_PAIRS_PER_KEY = "JOIN_MAX_PAIRS_PER_KEY";

    private static final OverrideKeys ENV_KEYS = new OverrideKeys(ENV_HOST, ENV_USERNAME, ENV_PASSWORD,
        ENV_INSECURE, ENV_CA_CERT, ENV_REQUEST_TIMEOUT, ENV_MAX_CONNECTIONS, ENV_ALLOWED_INDEXES, ENV_PROJECT_INDEX_MAPPING, ENV_DEFAULT_SOURCE_LIMIT,
        ENV_MAX_PAIRS_PER_KEY);
    private static final OverrideKeys PROPERTY_KEYS = new OverrideKeys("reporting.search.host",
        "reporting.search.username", "reporting.search.password", "reporting.search.insecure",
        "reporting.search.ca-cert", "reporting.search.request-timeout-seconds", "reporting.search.max-connections", "reporting.allowed-indexes", "reporting.project-index-mapping",
        "reporting.join.default-source-limit", "reporting.join.max-pairs-per-key");

    private String searchHost = "http://localhost:9200";
    private String searchUsername;
    private String searchPassword;
    private boolean searchInsecure;
    private String searchCaCert;
    private int searchRequestTimeoutSeconds = 30;
    private int maxConnections;
    private IndexAllowList allowedIndexes = IndexAllowList.of(List.of());
    private Map<String, String> projectIndexMapping = Map.of();
    private int defaultSearchSize = 50;
    private int defaultSourceLimit = 1000;
    private int defaultPageSize = 100;
    private int maxPageSize = 1000;
    private int maxPairsPerKey;

    ReportingConfig() {
    }

    public static ReportingConfig load() {
        return load(DEFAULT_CONFIG_FILE, System.getenv(), System.getProperties());
    }

    /** Loads from the given classpath resource, environment and system properties. */
    public static ReportingConfig load(String resource, Map<String, String> environment, Properties systemProperties) {
        ReportingConfig config = new ReportingConfig();
        config.loadFromClasspath(resource);
        config.applyOverrides(environment::get, ENV_KEYS);
        config.applyOverrides(systemProperties::getProperty, PROPERTY_KEYS);
        config.check();

        log.info("Configuration loaded: searchHost={}, authenticated={}, allowedIndexes={}, projects={}",
            config.searchHost, config.searchUsername != null, config.allowedIndexes.getPatterns(),
            config.projectIndexMapping.keySet());
        return config;
    }

    public Duration getSearchRequestTimeout() {
        return Duration.ofSeconds(searchRequestTimeoutSeconds);
    }

    /** Path of the trusted CA bundle, or null to use the JDK trust store. */
    public Path getSearchCaCertPath() {
        return searchCaCert != null ? Path.of(searchCaCert) : null;
    }

    public List<String> getAllowedPatterns() {
        return allowedIndexes.getPatterns();
    }

    private void loadFromClasspath(String resource) {
        try (InputStream is = ReportingConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                log.debug("No {} on the classpath, using built-in defaults", resource);
                return;
            }
            Map<String, Object> root = new Yaml().load(is);
            if (root != null) {
                applyYamlConfig(root);
                log.debug("Loaded defaults from classpath: {}", resource);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + resource, e);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(Map<String, Object> root) {
        Map<String, Object> reporting = (Map<String, Object>) root.get("reporting");
        if (reporting == null) {
            return;
        }

        Map<String, Object> search = (Map<String, Object>) reporting.get("search");
        if (search != null) {
            searchHost = stringOr(search.get("host"), searchHost);
            searchUsername = stringOr(search.get("username"), searchUsername);
            searchPassword = stringOr(search.get("password"), searchPassword);
            if (search.get("insecure") != null) {
                searchInsecure = (Boolean) search.get("insecure");
            }
            searchCaCert = stringOr(search.get("ca-cert"), searchCaCert);
            searchRequestTimeoutSeconds = intOr(search.get("request-timeout-seconds"), searchRequestTimeoutSeconds);
            maxConnections = intOr(search.get("max-connections"), maxConnections);
            defaultSearchSize = intOr(search.get("default-size"), defaultSearchSize);
        }

        Object allowed = reporting.get("allowed-indexes");
        if (allowed instanceof List) {
            allowedIndexes = IndexAllowList.of((List<String>) allowed);
        }
        Object mapping = reporting.get("project-index-mapping");
        if (mapping instanceof Map) {
            Map<String, String> normalized = new LinkedHashMap<>();
            ((Map<String, Object>) mapping).forEach((project, index) ->
                normalized.put(project.toLowerCase(Locale.ROOT), String.valueOf(index)));
            projectIndexMapping = Map.copyOf(normalized);
        }

        Map<String, Object> join = (Map<String, Object>) reporting.get("join");
        if (join != null) {
            defaultSourceLimit = intOr(join.get("default-source-limit"), defaultSourceLimit);
            defaultPageSize = intOr(join.get("default-page-size"), defaultPageSize);
            maxPageSize = intOr(join.get("max-page-size"), maxPageSize);
            maxPairsPerKey = intOr(join.get("max-pairs-per-key"), maxPairsPerKey);
        }
    }

    private void applyOverrides(Function<String, String> lookup, OverrideKeys keys) {
        String value;
        if ((value = lookup.apply(keys.host())) != null) {
            searchHost = value;
        }
        if ((value = lookup.apply(keys.username())) != null) {
            searchUsername = value;
        }
        if ((value = lookup.apply(keys.password())) != null) {
            searchPassword = value;
        }
        if ((value = lookup.apply(keys.insecure())) != null) {
            searchInsecure = Boolean.parseBoolean(value.trim());
        }
        if ((value = lookup.apply(keys.caCert())) != null) {
            searchCaCert = value;
        }
        if ((value = lookup.apply(keys.requestTimeoutSeconds())) != null) {
            searchRequestTimeoutSeconds = parseInt(keys.requestTimeoutSeconds(), value);
        }
        if ((value = lookup.apply(keys.maxConnections())) != null) {
            maxConnections = parseInt(keys.maxConnections(), value);
        }
        if ((value = lookup.apply(keys.allowedIndexes())) != null) {
            allowedIndexes = IndexAllowList.parse(value);
        }
        if ((value = lookup.apply(keys.projectIndexMapping())) != null) {
            projectIndexMapping = parseProjectIndexMapping(value);
        }
        if ((value = lookup.apply(keys.defaultSourceLimit())) != null) {
            defaultSourceLimit = parseInt(keys.defaultSourceLimit(), value);
        }
        if ((value = lookup.apply(keys.maxPairsPerKey())) != null) {
            maxPairsPerKey = parseInt(keys.maxPairsPerKey(), value);
        }
    }

    private void check() {
        if (searchUsername != null && searchUsername.isBlank()) {
            searchUsername = null;
        }
        if (searchPassword != null && searchPassword.isBlank()) {
            searchPassword = null;
        }
        if (searchCaCert != null && searchCaCert.isBlank()) {
            searchCaCert = null;
        }
        if (searchRequestTimeoutSeconds < 1) {
            throw new IllegalStateException("Search request timeout must be at least one second, got "
                + searchRequestTimeoutSeconds);
        }
        if (defaultSourceLimit < 1 || defaultPageSize < 1 || maxPageSize < defaultPageSize || maxPairsPerKey < 0
            || defaultSearchSize < 1) {
            throw new IllegalStateException("Inconsistent join limits: sourceLimit=" + defaultSourceLimit
                + ", pageSize=" + defaultPageSize + ", maxPageSize=" + maxPageSize
                + ", maxPairsPerKey=" + maxPairsPerKey + ", searchSize=" + defaultSearchSize);
        }
        if (allowedIndexes.isEmpty()) {
            log.warn("No allowed indexes configured; every search will be denied");
        }
    }

    /**
     * Parses {@code project:index} pairs separated by commas. Project keys are lower-cased; malformed pairs
     * are skipped.
     */
    static Map<String, String> parseProjectIndexMapping(String value) {
        Map<String, String> mapping = new LinkedHashMap<>();
        for (String pair : value.split(",")) {
            String[] parts = pair.trim().split(":");
            if (parts.length == 2 && !parts[0].isBlank() && !parts[1].isBlank()) {
                mapping.put(parts[0].trim().toLowerCase(Locale.ROOT), parts[1].trim());
            } else if (!pair.isBlank()) {
                log.warn("Ignoring malformed project mapping entry '{}'", pair);
            }
        }
        return Map.copyOf(mapping);
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Setting " + key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static String stringOr(Object value, String fallback) {
        return value != null ? value.toString() : fallback;
    }

    private static int intOr(Object value, int fallback) {
        return value instanceof Number ? ((Number) value).intValue() : fallback;
    }

    private record OverrideKeys(
        String host,
        String username,
        String password,
        String insecure,
        String caCert,
        String requestTimeoutSeconds,
        String maxConnections,
        String allowedIndexes,
        String projectIndexMapping,
        String defaultSourceLimit,
        String maxPairsPerKey
    ) {}
}
