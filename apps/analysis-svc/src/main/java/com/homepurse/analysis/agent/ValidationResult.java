package com.homepurse.analysis.agent;

import java.util.Set;

/**
 * Verdict of the safety validator. {@code reason} is set only on rejection; it is fed verbatim to
 * the repair prompt. {@code referencedTables} lists the allow-listed relations an accepted query reads.
 */
public record ValidationResult(boolean accepted, String reason, Set<String> referencedTables) {

    public ValidationResult {
        referencedTables = referencedTables == null ? Set.of() : Set.copyOf(referencedTables);
    }

    public static ValidationResult accept(Set<String> referencedTables) {
        return new ValidationResult(true, null, referencedTables);
    }

    public static ValidationResult reject(String reason) {
        return new ValidationResult(false, reason, Set.of());
    }
}
