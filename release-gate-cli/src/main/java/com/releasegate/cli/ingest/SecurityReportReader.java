package com.releasegate.cli.ingest;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.releasegate.core.model.SecuritySignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the security scanner's JSON report into a {@link SecuritySignal}.
 *
 * <p><b>Format:</b>
 * <pre>{@code
 * {
 *   "vulnerabilities": [
 *     {"severity": "critical", "file": "app/db.py", "line": 42, "description": "SQL injection"}
 *   ],
 *   "secrets": [ {"file": "config.py", "line": 3} ]
 * }
 * }</pre>
 * Severities are case-insensitive; unknown fields are ignored.
 */
public final class SecurityReportReader {

    private static final Logger log = LoggerFactory.getLogger(SecurityReportReader.class);

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    private SecurityReportReader() {
        // Utility class
    }

    /**
     * Reads a security report.
     *
     * @param report report file, may be null
     * @return security signal, {@link SecuritySignal#none()} when no report is given
     * @throws IOException if the report exists but cannot be read or parsed
     */
    public static SecuritySignal read(Path report) throws IOException {
        if (report == null) {
            log.debug("No security report given");
            return SecuritySignal.none();
        }
        if (!Files.exists(report)) {
            log.warn("Security report not found: {}. Assuming no findings.", report);
            return SecuritySignal.none();
        }
        SecuritySignal signal = MAPPER.readValue(report.toFile(), SecuritySignal.class);
        if (signal == null) {
            return SecuritySignal.none();
        }
        log.info("Loaded security report: {} vulnerabilities, {} secrets",
            signal.vulnerabilities().size(), signal.secrets().size());
        return signal;
    }
}
