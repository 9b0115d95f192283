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
 * Compliance tiers, best first. Each tier covers scores from its lower bound (inclusive) up to the next tier.
 */
public enum ComplianceLevel {
    PERFECT(1.0),
    HIGH(0.85),
    PARTIAL(0.60),
    LOW(0.30),
    FAILED(Double.NEGATIVE_INFINITY);

    private final double lowerBound;

    ComplianceLevel(double lowerBound) {
        this.lowerBound = lowerBound;
    }

    public double lowerBound() {
        return lowerBound;
    }

    public static ComplianceLevel fromScore(double score) {
        for (ComplianceLevel level : values()) {
            if (score >= level.lowerBound) {
                return level;
            }
        }
        return FAILED;
    }
}
