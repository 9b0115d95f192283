/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.ast;

public record DocumentMetadata(String domain, String protocol) {

    public static DocumentMetadata empty() {
        return new DocumentMetadata(null, null);
    }
}
