/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.ast;

/**
 * A typed top-level block of a {@link Document}.
 *
 * <p>The hierarchy is closed: meta entries, type definitions, rules, functions and evidence.</p>
 */
public sealed interface Block permits MetaBlock, TypesBlock, RulesBlock, FunctionsBlock, EvidenceBlock {

    /**
     * @return short block kind name, e.g. {@code "Types"}
     */
    String blockType();
}
