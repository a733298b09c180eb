package io.github.jakubt4.anor.dto;

/**
 * Inbound request for a composite via the REST API.
 *
 * @param date         observation day, ISO {@code yyyy-MM-dd}
 * @param source       source id or {@code "auto"} (default)
 * @param band         wavelength in Ångström or detector number; source default when absent
 * @param detector     detector code (e.g. "C2") for coronagraph sources
 * @param forceRefresh bypass the cache when {@code true}
 */
public record CompositeRequest(String date, String source, Integer band, String detector, Boolean forceRefresh) {
}
