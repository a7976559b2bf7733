package com.stratasystems.persistence.etcd;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Connection settings for the remote etcd tier.
 */
public class EtcdBackendConfig {

    public static final String ENDPOINTS_ENV = "STRATA_ETCD_ENDPOINTS";
    public static final String KEY_PREFIX_ENV = "STRATA_ETCD_PREFIX";
    public static final String DEFAULT_KEY_PREFIX = "/strata/";

    private final List<String> endpoints;
    private final String keyPrefix;
    private final Duration requestTimeout;

    private EtcdBackendConfig(Builder builder) {
        this.endpoints = List.copyOf(builder.endpoints);
        this.keyPrefix = builder.keyPrefix;
        this.requestTimeout = builder.requestTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@value #ENDPOINTS_ENV} (comma separated) and optionally {@value #KEY_PREFIX_ENV}
     * from the process environment.
     *
     * @throws IllegalArgumentException if no endpoints are configured
     */
    public static EtcdBackendConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static EtcdBackendConfig fromEnvironment(Map<String, String> env) {
        String endpoints = env.get(ENDPOINTS_ENV);
        if (endpoints == null || endpoints.isBlank()) {
            throw new IllegalArgumentException(ENDPOINTS_ENV + " is not set");
        }
        Builder builder = builder().endpoints(Arrays.stream(endpoints.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList()));
        String prefix = env.get(KEY_PREFIX_ENV);
        if (prefix != null && !prefix.isBlank()) {
            builder.keyPrefix(prefix.trim());
        }
        return builder.build();
    }

    public List<String> getEndpoints() {
        return endpoints;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    @Override
    public String toString() {
        return "EtcdBackendConfig{" +
                "endpoints=" + endpoints +
                ", keyPrefix='" + keyPrefix + '\'' +
                ", requestTimeout=" + requestTimeout +
                '}';
    }

    public static class Builder {
        private List<String> endpoints = List.of("http://localhost:2379");
        private String keyPrefix = DEFAULT_KEY_PREFIX;
        private Duration requestTimeout = Duration.ofSeconds(5);

        public Builder endpoints(String... endpoints) {
            return endpoints(Arrays.asList(endpoints));
        }

        public Builder endpoints(List<String> endpoints) {
            this.endpoints = endpoints;
            return this;
        }

        public Builder keyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public EtcdBackendConfig build() {
            if (endpoints == null || endpoints.isEmpty()) {
                throw new IllegalArgumentException("At least one endpoint is required");
            }
            if (keyPrefix == null || keyPrefix.isEmpty()) {
                throw new IllegalArgumentException("Key prefix cannot be empty");
            }
            if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
                throw new IllegalArgumentException("Request timeout must be positive");
            }
            return new EtcdBackendConfig(this);
        }
    }
}
