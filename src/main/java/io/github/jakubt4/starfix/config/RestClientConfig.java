package io.github.jakubt4.starfix.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

import java.time.Duration;

/**
 * HTTP timeouts for outbound calls to a remote solver. The read timeout must cover the
 * longest solve timeout a client will request.
 */
@Configuration
public class RestClientConfig {

    @Bean
    RestClientCustomizer restClientCustomizer(
            @Value("${starfix.client.connect-timeout:5s}") final Duration connectTimeout,
            @Value("${starfix.client.read-timeout:30s}") final Duration readTimeout) {
        return builder -> {
            final var requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(connectTimeout);
            requestFactory.setReadTimeout(readTimeout);
            builder.requestFactory(requestFactory);
        };
    }
}
