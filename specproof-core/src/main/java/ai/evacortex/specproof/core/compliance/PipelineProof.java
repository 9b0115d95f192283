/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.compliance;

/**
 * Success-rate comparison of an n-step pipeline: {@code baseline = 0.62ⁿ}, {@code target = 0.98ⁿ}.
 */
public record PipelineProof(int steps, double baselineRate, double targetRate, double improvementFactor,
                            boolean smtVerified) {
}
