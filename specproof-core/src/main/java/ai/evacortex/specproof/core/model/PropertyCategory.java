/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.model;

public enum PropertyCategory {
    TRI_VECTOR_ORTHOGONALITY,
    TEMPORAL_SAFETY,
    TEMPORAL_LIVENESS,
    TYPE_SAFETY,
    CORRECTNESS,
    RESOURCE_CONSTRAINTS,
    PROTOCOL_COMPLIANCE
}
