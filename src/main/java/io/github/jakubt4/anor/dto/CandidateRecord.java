package io.github.jakubt4.anor.dto;

import java.net.URI;
import java.time.Instant;

/**
 * One file the archive catalogue reports for a search.
 *
 * @param id         archive-side record identifier
 * @param fileName   name the file is stored under locally; derived from {@link #url} when absent
 * @param url        download location, absolute or relative to the archive base URL
 * @param startTime  observation start
 * @param endTime    observation end
 * @param instrument instrument name
 * @param wavelength wavelength in Ångström, {@code null} for detector-coded sources
 * @param detector   detector code, {@code null} for imagers
 * @param provider   data provider reported by the archive
 */
public record CandidateRecord(String id,
                              String fileName,
                              String url,
                              Instant startTime,
                              Instant endTime,
                              String instrument,
                              Integer wavelength,
                              String detector,
                              String provider) {

    public String localFileName() {
        if (fileName != null && !fileName.isBlank()) {
            return fileName;
        }
        final var path = url == null ? null : URI.create(url).getPath();
        final var name = path == null ? "" : path.substring(path.lastIndexOf('/') + 1);
        return name.isBlank() ? id + ".fits" : name;
    }
}
