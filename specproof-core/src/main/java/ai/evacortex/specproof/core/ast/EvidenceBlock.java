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
 * Evidence recorded by the document author.
 *
 * @param delta declared semantic density, may be {@code null}
 * @param phi   declared completeness count, may be {@code null}
 * @param tau   declared quality tier symbol, may be {@code null}
 */
public record EvidenceBlock(Double delta, Long phi, String tau) implements Block {

    @Override
    public String blockType() {
        return "Evidence";
    }
}
