/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.trivector;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Output of the external tri-vector analysis, consumed by document verification.
 *
 * @param signal               decomposed signal; {@code null} when the analysis found none
 * @param orthogonalityResults ordered map from constraint label (e.g. {@code "V_H ⊥ V_S"}) to the pair analysed
 * @param safetyIsolation      isolation evidence for the safety space
 */
public record TriVectorValidationResult(TriVectorSignal signal,
                                        Map<String, OrthogonalityResult> orthogonalityResults,
                                        SafetyIsolationResult safetyIsolation) {

    public TriVectorValidationResult {
        orthogonalityResults = orthogonalityResults == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(orthogonalityResults));
        safetyIsolation = safetyIsolation == null
                ? new SafetyIsolationResult(false, null, null)
                : safetyIsolation;
    }

    public Optional<TriVectorSignal> signalIfPresent() {
        return Optional.ofNullable(signal);
    }
}
