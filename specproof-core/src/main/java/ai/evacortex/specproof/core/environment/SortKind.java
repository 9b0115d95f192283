/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.environment;

public enum SortKind {
    /** Theory sort provided by the solver itself (Int, Real, Bool). */
    BUILTIN,
    /** {@code define-sort} alias of a builtin sort. */
    ALIAS,
    /** {@code declare-sort} with no interpretation. */
    UNINTERPRETED
}
