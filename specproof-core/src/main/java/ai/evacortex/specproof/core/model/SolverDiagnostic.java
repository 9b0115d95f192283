/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.model;

import java.util.Objects;

public record SolverDiagnostic(DiagnosticLevel level, String message, String context, long timestampMillis) {

    public SolverDiagnostic {
        Objects.requireNonNull(level, "level must not be null");
        Objects.requireNonNull(message, "message must not be null");
        context = context == null ? "" : context;
    }

    public static SolverDiagnostic of(DiagnosticLevel level, String message, String context) {
        return new SolverDiagnostic(level, message, context, System.currentTimeMillis());
    }
}
