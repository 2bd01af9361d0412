package com.releasegate.core.model;

/**
 * How the structural facts of a file were produced.
 *
 * <p>Keeps a zero complexity from being mistaken for "analyzed and trivially simple".
 */
public enum AnalysisMode {
    /** A registered language handler analyzed the file. */
    ANALYZED,
    /** The language handler could not parse the content. */
    PARSE_FAILED,
    /** No handler is registered for the language; the generic extractor ran instead. */
    FALLBACK,
    /** Analysis threw unexpectedly; facts are empty. */
    FAILED
}
