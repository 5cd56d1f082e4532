package com.boundgen.domain.validation.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Individual validation finding.
 *
 * @param ruleId      rule that produced it, e.g. CONTRADICTION-001
 * @param severity    FATAL/ERROR fail the attempt, WARNING is informational
 * @param location    JSON pointer into the document, e.g. /recommendations/2
 * @param message     human-readable description
 * @param remediation suggested fix rendered into the next attempt's feedback (nullable)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Finding(
        String ruleId,
        Severity severity,
        String location,
        String message,
        String remediation
) {
    public static Finding of(String ruleId, Severity severity, String location, String message) {
        return new Finding(ruleId, severity, location, message, null);
    }

    public boolean isBlocking() {
        return severity.isBlocking();
    }
}
