package com.releasegate.core.pipeline;

import com.releasegate.core.model.ChangeSignal;
import com.releasegate.core.model.FileRecord;
import com.releasegate.core.model.SecuritySignal;

import java.time.Duration;
import java.util.List;

/**
 * Input of one analysis run.
 *
 * @param repositoryRoot repository root, carried through for provenance
 * @param files already-loaded source files
 * @param security security signal, {@link SecuritySignal#none()} when absent
 * @param changes change signal, {@link ChangeSignal#none()} when absent
 * @param deadline maximum duration of the per-file stage, null for no deadline
 */
public record AnalysisRequest(
    String repositoryRoot,
    List<FileRecord> files,
    SecuritySignal security,
    ChangeSignal changes,
    Duration deadline
) {
    public AnalysisRequest {
        files = files == null ? List.of() : List.copyOf(files);
        security = security != null ? security : SecuritySignal.none();
        changes = changes != null ? changes : ChangeSignal.none();
    }

    /**
     * Creates a request without signals or deadline.
     *
     * @param repositoryRoot repository root
     * @param files files to analyze
     * @return request
     */
    public static AnalysisRequest of(String repositoryRoot, List<FileRecord> files) {
        return new AnalysisRequest(repositoryRoot, files, null, null, null);
    }
}
