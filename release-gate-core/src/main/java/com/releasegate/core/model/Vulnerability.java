package com.releasegate.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A vulnerability reported by the security-scan collaborator.
 *
 * @param severity severity level
 * @param file affected file path, may be null
 * @param line affected line, 0 when unknown
 * @param description description
 * @param recommendation optional fix recommendation
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Vulnerability(
    @JsonProperty("severity") Severity severity,
    @JsonProperty("file") String file,
    @JsonProperty("line") int line,
    @JsonProperty("description") String description,
    @JsonProperty("recommendation") String recommendation
) {
    public Vulnerability {
        Objects.requireNonNull(severity, "severity must not be null");
        description = description != null ? description : "";
    }
}
