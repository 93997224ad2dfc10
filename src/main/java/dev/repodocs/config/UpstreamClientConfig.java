package dev.repodocs.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * One connection pool to the generation service per application context, injected
 * wherever it is needed. Tests build their own {@link WebClient} against a fake upstream.
 *
 * <p>The Netty response timeout is the read-inactivity cap and is set to the generation
 * deadline, since a generation may legitimately go quiet for a while between progress frames.
 */
@Configuration
public class UpstreamClientConfig {

    public static final String GENERATION_SERVICE = "generation-service";

    @Bean
    public WebClient generationWebClient(UpstreamProperties properties) {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(properties.generateTimeout())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.connectTimeout().toMillis());
        return WebClient.builder()
                .baseUrl(properties.baseUrl().toString())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .build();
        return CircuitBreakerRegistry.of(config);
    }

    @Bean
    public CircuitBreaker generationServiceCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(GENERATION_SERVICE);
    }
}
