/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.trivector;

import java.util.Objects;

/**
 * Decomposition of a signal into its semantic (V_H), structural (V_L) and safety (V_S) spaces.
 */
public record TriVectorSignal(VectorSpace semantic, VectorSpace structural, VectorSpace safety) {

    public TriVectorSignal {
        Objects.requireNonNull(semantic, "semantic must not be null");
        Objects.requireNonNull(structural, "structural must not be null");
        Objects.requireNonNull(safety, "safety must not be null");
    }

    public static TriVectorSignal standard() {
        return new TriVectorSignal(
                new VectorSpace("V_H", 768),
                new VectorSpace("V_L", 512),
                new VectorSpace("V_S", 256));
    }
}
