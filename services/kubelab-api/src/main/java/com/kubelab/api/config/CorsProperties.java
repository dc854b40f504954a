package com.kubelab.api.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Cross-origin settings, bound from {@code kubelab.web.cors.*}.
 *
 * @param allowedOriginPatterns origin patterns allowed to call the API (default {@code *}).
 */
@ConfigurationProperties(prefix = "kubelab.web.cors")
public record CorsProperties(List<String> allowedOriginPatterns) {

    public CorsProperties {
        if (allowedOriginPatterns == null || allowedOriginPatterns.isEmpty()) {
            allowedOriginPatterns = List.of("*");
        } else {
            allowedOriginPatterns = List.copyOf(allowedOriginPatterns);
        }
    }
}
