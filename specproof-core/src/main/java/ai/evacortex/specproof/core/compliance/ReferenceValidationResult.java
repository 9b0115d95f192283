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
import java.util.Objects;

/**
 * Outcome of a reference compliance validation.
 *
 * @param issues one entry per phase that degraded to its fallback value
 */
public record ReferenceValidationResult(ComplianceLevel level,
                                        double score,
                                        MathFoundationResult mathFoundations,
                                        TriVectorOrthogonalityResult triVectorOrthogonality,
                                        FeatureComplianceResult featureCompliance,
                                        LayerCompositionResult layerComposition,
                                        List<String> issues,
                                        long verificationTimeMs) {

    public ReferenceValidationResult {
        Objects.requireNonNull(level, "level must not be null");
        Objects.requireNonNull(mathFoundations, "mathFoundations must not be null");
        Objects.requireNonNull(triVectorOrthogonality, "triVectorOrthogonality must not be null");
        Objects.requireNonNull(featureCompliance, "featureCompliance must not be null");
        Objects.requireNonNull(layerComposition, "layerComposition must not be null");
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
