/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.compliance;

import ai.evacortex.specproof.core.model.ProofCertificate;

/**
 * Evidence that guarantees of {@code fromLayer} enable {@code enablesProperty} in {@code toLayer}.
 *
 * @param certificate proof certificate when the edge was proven with proofs enabled, {@code null} otherwise
 */
public record CompositionProof(String fromLayer,
                               String toLayer,
                               String enablesProperty,
                               boolean smtVerified,
                               ProofCertificate certificate) {
}
