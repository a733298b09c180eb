package io.github.jakubt4.anor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Anor: acquisition and fusion of full-disk solar observations.
 *
 * <p>Searches a remote solar archive for a requested day, downloads the matching FITS
 * files, calibrates them and fuses them into one exposure-weighted composite that is
 * cached on disk for later rendering.
 *
 * @see io.github.jakubt4.anor.service.AcquisitionOrchestrator
 * @see io.github.jakubt4.anor.service.fusion.FusionEngine
 */
@SpringBootApplication
@EnableRetry
public class AnorApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnorApplication.class, args);
    }
}
