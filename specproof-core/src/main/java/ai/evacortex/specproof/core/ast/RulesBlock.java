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

public record RulesBlock(List<String> rules) implements Block {

    public RulesBlock {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    @Override
    public String blockType() {
        return "Rules";
    }
}
