/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Complete outcome of verifying one document.
 *
 * <p>Artifact maps are keyed by property id. A proof is only recorded for a proven property and a
 * counterexample only for a disproven one.</p>
 */
public record VerificationReport(VerificationStatus status,
                                 List<VerifiedProperty> properties,
                                 Map<String, ProofCertificate> proofs,
                                 Map<String, CounterexampleModel> counterexamples,
                                 Map<String, UnsatCore> unsatCores,
                                 VerificationStatistics statistics,
                                 List<SolverDiagnostic> diagnostics) {

    public VerificationReport {
        Objects.requireNonNull(status, "status must not be null");
        properties = properties == null ? List.of() : List.copyOf(properties);
        proofs = copy(proofs);
        counterexamples = copy(counterexamples);
        unsatCores = copy(unsatCores);
        statistics = statistics == null ? VerificationStatistics.empty() : statistics;
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static VerificationReport disabled() {
        return new VerificationReport(VerificationStatus.disabled(), List.of(), Map.of(), Map.of(), Map.of(),
                VerificationStatistics.empty(), List.of());
    }

    /**
     * Report for a run that never reached its properties.
     */
    public static VerificationReport aborted(VerificationStatus status, SolverDiagnostic diagnostic) {
        return new VerificationReport(status, List.of(), Map.of(), Map.of(), Map.of(),
                VerificationStatistics.empty(), List.of(diagnostic));
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
