/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.exceptions;

public class BackendUnavailableException extends SpecProofException {
    public BackendUnavailableException(String message) {
        super("Solver backend unavailable: " + message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super("Solver backend unavailable: " + message, cause);
    }
}
