package dev.repodocs.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.time.Duration;

/**
 * Generation service connection settings. generateTimeout caps a whole relay lifetime;
 * refineTimeout is the shorter cap for refinement calls.
 */
@ConfigurationProperties(prefix = "repodocs.upstream")
public record UpstreamProperties(URI baseUrl, Duration connectTimeout,
                                 Duration generateTimeout, Duration refineTimeout) {
    public UpstreamProperties {
        if (baseUrl == null) baseUrl = URI.create("http://localhost:8000");
        if (connectTimeout == null) connectTimeout = Duration.ofSeconds(10);
        if (generateTimeout == null) generateTimeout = Duration.ofMinutes(10);
        if (refineTimeout == null) refineTimeout = Duration.ofMinutes(2);
    }
}
