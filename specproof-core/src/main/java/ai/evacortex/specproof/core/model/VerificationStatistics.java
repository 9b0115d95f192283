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
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable snapshot of the counters owned by one verification engine.
 */
public record VerificationStatistics(long totalTimeMs,
                                     int smtQueries,
                                     int successfulProofs,
                                     int counterexamples,
                                     int timeouts,
                                     int errors,
                                     long peakMemoryBytes,
                                     Map<String, String> solverStatistics) {

    public VerificationStatistics {
        solverStatistics = solverStatistics == null
                ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(solverStatistics));
    }

    public static VerificationStatistics empty() {
        return new VerificationStatistics(0L, 0, 0, 0, 0, 0, 0L, Map.of());
    }
}
