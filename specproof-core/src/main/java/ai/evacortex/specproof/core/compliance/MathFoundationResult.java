/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.compliance;

import java.util.List;

public record MathFoundationResult(boolean ambiguityVerified,
                                   double calculatedAmbiguity,
                                   List<PipelineProof> pipelineProofs,
                                   TokenEfficiencyResult tokenEfficiency) {

    public MathFoundationResult {
        pipelineProofs = pipelineProofs == null ? List.of() : List.copyOf(pipelineProofs);
    }

    static MathFoundationResult fallback() {
        return new MathFoundationResult(false, 1.0, List.of(), new TokenEfficiencyResult(0L, 1000L, null, false));
    }
}
