package com.releasegate.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Location of a hard-coded secret or credential literal.
 *
 * @param file file path
 * @param line line number, 0 when unknown
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SecretLocation(
    @JsonProperty("file") String file,
    @JsonProperty("line") int line
) {}
