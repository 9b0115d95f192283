/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.trivector;

import java.util.List;

/**
 * Isolation evidence collected by the tri-vector analysis.
 *
 * @param isolated            whether no optimization was observed to touch the safety space
 * @param preservedProperties safety properties the analysis found preserved
 * @param violations          names of optimizations observed to affect the safety space
 */
public record SafetyIsolationResult(boolean isolated, List<String> preservedProperties, List<String> violations) {

    public SafetyIsolationResult {
        preservedProperties = preservedProperties == null ? List.of() : List.copyOf(preservedProperties);
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public static SafetyIsolationResult isolatedPreserving(String... preserved) {
        return new SafetyIsolationResult(true, List.of(preserved), List.of());
    }

    public static SafetyIsolationResult violatedBy(String... optimizations) {
        return new SafetyIsolationResult(false, List.of(), List.of(optimizations));
    }
}
