/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.ast;

import java.util.Objects;

/**
 * A function declared in a functions block. The body is kept as the raw lambda text;
 * signatures are not parsed.
 */
public record FunctionDefinition(String name, String lambda) {

    public FunctionDefinition {
        Objects.requireNonNull(name, "name must not be null");
        lambda = lambda == null ? "" : lambda;
    }
}
