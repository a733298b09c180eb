package io.github.jakubt4.anor.dto;

import java.util.List;

/**
 * Body of the archive's {@code /search} endpoint.
 */
public record CatalogSearchResponse(List<CandidateRecord> records) {

    public List<CandidateRecord> recordsOrEmpty() {
        return records == null ? List.of() : records;
    }
}
