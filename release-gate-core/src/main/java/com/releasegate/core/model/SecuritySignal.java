package com.releasegate.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output of the security-scan collaborator. Absent lists mean "no findings".
 *
 * @param vulnerabilities reported vulnerabilities
 * @param secrets detected secret locations
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SecuritySignal(
    @JsonProperty("vulnerabilities") List<Vulnerability> vulnerabilities,
    @JsonProperty("secrets") @JsonAlias("secrets_found") List<SecretLocation> secrets
) {
    private static final SecuritySignal NONE = new SecuritySignal(List.of(), List.of());

    public SecuritySignal {
        vulnerabilities = vulnerabilities == null ? List.of() : List.copyOf(vulnerabilities);
        secrets = secrets == null ? List.of() : List.copyOf(secrets);
    }

    public static SecuritySignal none() {
        return NONE;
    }

    /**
     * Counts vulnerabilities of the given severity.
     *
     * @param severity severity to count
     * @return number of matching vulnerabilities
     */
    public long count(Severity severity) {
        return vulnerabilities.stream().filter(v -> v.severity() == severity).count();
    }
}
