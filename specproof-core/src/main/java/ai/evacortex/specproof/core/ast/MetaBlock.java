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

public record MetaBlock(List<String> entries) implements Block {

    public MetaBlock {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    @Override
    public String blockType() {
        return "Meta";
    }
}
