/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.compliance;

/**
 * Weighted compliance score:
 * <pre>
 *     0.125·ambiguity + 0.125·tokens          (math foundations, 25%)
 *   + 0.125·V_H⊥V_S + 0.125·V_L⊥V_S           (orthogonality, 25%)
 *   + 0.35·percentage/100                     (feature compliance, 35%)
 *   + 0.15·verifiedLayers/3                   (layer composition, 15%)
 * </pre>
 * divided by the total weight and clamped to [0, 1].
 */
public final class ComplianceScoring {

    static final double AMBIGUITY_WEIGHT = 0.125;
    static final double TOKEN_WEIGHT = 0.125;
    static final double ORTHOGONALITY_WEIGHT = 0.125;
    static final double FEATURE_WEIGHT = 0.35;
    static final double LAYER_WEIGHT = 0.15;

    private ComplianceScoring() {
    }

    public static double score(MathFoundationResult math,
                               TriVectorOrthogonalityResult orthogonality,
                               FeatureComplianceResult features,
                               LayerCompositionResult layers) {
        double score = 0.0;
        double weight = 0.0;

        score += AMBIGUITY_WEIGHT * (math.ambiguityVerified() ? 1.0 : 0.0);
        score += TOKEN_WEIGHT * (math.tokenEfficiency().meetsSpec() ? 1.0 : 0.0);
        weight += AMBIGUITY_WEIGHT + TOKEN_WEIGHT;

        score += ORTHOGONALITY_WEIGHT * (orthogonality.semanticSafetyOrthogonal() ? 1.0 : 0.0);
        score += ORTHOGONALITY_WEIGHT * (orthogonality.structuralSafetyOrthogonal() ? 1.0 : 0.0);
        weight += 2 * ORTHOGONALITY_WEIGHT;

        score += FEATURE_WEIGHT * (features.percentage() / 100.0);
        weight += FEATURE_WEIGHT;

        score += LAYER_WEIGHT * (layers.verifiedLayers() / 3.0);
        weight += LAYER_WEIGHT;

        double normalized = weight > 0.0 ? score / weight : 0.0;
        return Math.max(0.0, Math.min(1.0, normalized));
    }

    public static ComplianceLevel level(double score) {
        return ComplianceLevel.fromScore(score);
    }
}
