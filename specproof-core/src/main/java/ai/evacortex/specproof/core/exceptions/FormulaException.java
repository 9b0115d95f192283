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
 * A single formula could not be built or parsed. Affects only the property it belongs to.
 */
public class FormulaException extends SpecProofException {
    public FormulaException(String message) {
        super("Invalid formula: " + message);
    }

    public FormulaException(String message, Throwable cause) {
        super("Invalid formula: " + message, cause);
    }
}
