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

public record TypeDefinition(String name, TypeExpression typeExpr) {

    public TypeDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(typeExpr, "typeExpr must not be null");
    }
}
