package com.releasegate.core.pipeline;

/**
 * Fatal failure of an analysis run.
 *
 * <p>Per-file failures never surface as this exception; they are logged and the file is
 * listed in {@link com.releasegate.core.model.AnalysisResult#skippedFiles()}.
 */
public class AnalysisException extends RuntimeException {

    /**
     * Pipeline stage that failed.
     */
    public enum Stage {
        INPUT,
        ANALYSIS,
        AGGREGATION,
        RISK_ASSESSMENT
    }

    private final Stage stage;
    private final String filePath;

    public AnalysisException(Stage stage, String message) {
        this(stage, message, null, null);
    }

    public AnalysisException(Stage stage, String message, Throwable cause) {
        this(stage, message, null, cause);
    }

    public AnalysisException(Stage stage, String message, String filePath, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.filePath = filePath;
    }

    public Stage getStage() {
        return stage;
    }

    /**
     * Returns the file being processed when the failure occurred.
     *
     * @return file path, or null for batch-level failures
     */
    public String getFilePath() {
        return filePath;
    }
}
