package io.github.jakubt4.anor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Remote archive connection settings ({@code anor.archive.*}).
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "anor.archive")
public class ArchiveProperties {

    private String baseUrl = "http://localhost:8095/api";
    private Path downloadDirectory = Path.of(System.getProperty("java.io.tmpdir"), "anor", "data");
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(60);

    /** Hosts whose plain-http download URLs are upgraded to https. */
    private List<String> httpsHosts = new ArrayList<>();

    private Retry retry = new Retry();

    @Getter
    @Setter
    public static class Retry {
        private int maxAttempts = 3;
        private long delayMs = 5000;
    }
}
