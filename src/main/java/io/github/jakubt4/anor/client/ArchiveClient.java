package io.github.jakubt4.anor.client;

import io.github.jakubt4.anor.dto.CandidateRecord;
import io.github.jakubt4.anor.model.AcquisitionTarget;
import io.github.jakubt4.anor.model.SearchWindow;

import java.nio.file.Path;
import java.util.List;

/**
 * Adapter over the remote scientific archive: time/band scoped search and file download.
 */
public interface ArchiveClient {

    /**
     * Lists the archive records matching the window and target.
     *
     * @return matching records, empty when nothing matches or the archive stayed unreachable
     */
    List<CandidateRecord> search(SearchWindow window, AcquisitionTarget target);

    /**
     * Downloads the candidates into {@code directory}. Files already present under the same
     * name are reused and never overwritten.
     *
     * @return local paths of the candidates that were retrieved, in candidate order; callers
     *         compare its size against the request to detect a partial download
     */
    List<Path> download(List<CandidateRecord> candidates, Path directory);
}
