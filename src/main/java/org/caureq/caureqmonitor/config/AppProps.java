package org.caureq.caureqmonitor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app")
public record AppProps(String apiKey, QueryProps query) {
    /** Paging bounds for the list endpoints */
    public record QueryProps(int defaultLimit, int maxLimit) {}

    public boolean apiKeyRequired() {
        return apiKey != null && !apiKey.isBlank();
    }
}
