/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.exceptions;

public class SpecProofException extends RuntimeException {
    public SpecProofException(String message) {
        super(message);
    }

    public SpecProofException(String message, Throwable cause) {
        super(message, cause);
    }
}
