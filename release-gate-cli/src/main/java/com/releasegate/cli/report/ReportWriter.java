package com.releasegate.cli.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.releasegate.core.model.AnalysisResult;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.Locale;

/**
 * Writes an {@link AnalysisResult} as a console summary or as pretty-printed JSON.
 */
public class ReportWriter {

    /**
     * Supported output formats.
     */
    public enum Format {
        TEXT,
        JSON;

        public static Format parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown output format: " + value + " (expected text or json)", e);
            }
        }
    }

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private final TextReportPrinter textPrinter = new TextReportPrinter();

    public void write(AnalysisResult result, Format format, PrintWriter out) throws IOException {
        switch (format) {
            case TEXT -> textPrinter.print(result, out);
            case JSON -> {
                out.println(toJson(result));
                out.flush();
            }
        }
    }

    public static String toJson(AnalysisResult result) throws IOException {
        return JSON_MAPPER.writeValueAsString(result);
    }
}
