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

public record OrthogonalityResult(String space1, String space2, OrthogonalityType type, double confidence) {

    public OrthogonalityResult {
        Objects.requireNonNull(space1, "space1 must not be null");
        Objects.requireNonNull(space2, "space2 must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }
}
