/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.ast;

import java.util.List;

public record FunctionsBlock(List<FunctionDefinition> functions) implements Block {

    public FunctionsBlock {
        functions = functions == null ? List.of() : List.copyOf(functions);
    }

    public static FunctionsBlock of(FunctionDefinition... functions) {
        return new FunctionsBlock(List.of(functions));
    }

    @Override
    public String blockType() {
        return "Functions";
    }
}
