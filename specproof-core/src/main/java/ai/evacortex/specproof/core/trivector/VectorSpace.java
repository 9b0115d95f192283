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

public record VectorSpace(String name, int dimension) {

    public VectorSpace {
        Objects.requireNonNull(name, "name must not be null");
        if (dimension < 0) throw new IllegalArgumentException("dimension must be >= 0");
    }
}
