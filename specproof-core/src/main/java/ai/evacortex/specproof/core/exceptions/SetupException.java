/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.exceptions;

/**
 * The solver environment could not be built for a document. Aborts the whole run.
 */
public class SetupException extends SpecProofException {
    public SetupException(String message) {
        super("Environment setup failed: " + message);
    }

    public SetupException(String message, Throwable cause) {
        super("Environment setup failed: " + message, cause);
    }
}
