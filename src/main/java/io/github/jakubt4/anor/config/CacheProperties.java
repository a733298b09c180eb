package io.github.jakubt4.anor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Composite cache settings ({@code anor.cache.*}).
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "anor.cache")
public class CacheProperties {

    private Path directory = Path.of(System.getProperty("java.io.tmpdir"), "anor", "cache");

    /** Entries kept in the in-memory tier. */
    private long memoryEntries = 32;

    /** Entries older than this read as absent; {@code null} disables expiry. */
    private Duration maxAge;
}
