package io.github.jakubt4.anor.config;

import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

/**
 * Bounds every archive call with the connect and read timeouts from {@link ArchiveProperties}.
 */
@Configuration
public class RestClientConfig {

    @Bean
    RestClientCustomizer restClientCustomizer(final ArchiveProperties archiveProperties) {
        return builder -> {
            final var requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(archiveProperties.getConnectTimeout());
            requestFactory.setReadTimeout(archiveProperties.getReadTimeout());
            builder.requestFactory(requestFactory);
        };
    }
}
