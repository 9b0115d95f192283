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

import java.util.List;

/**
 * @param semanticStructuralOverlapAllowed the semantic and structural spaces may overlap; recorded, not solved
 * @param certificates                     proof certificates of the disjointness checks that were proven
 */
public record TriVectorOrthogonalityResult(boolean semanticSafetyOrthogonal,
                                           boolean structuralSafetyOrthogonal,
                                           boolean semanticStructuralOverlapAllowed,
                                           List<ProofCertificate> certificates) {

    public TriVectorOrthogonalityResult {
        certificates = certificates == null ? List.of() : List.copyOf(certificates);
    }

    static TriVectorOrthogonalityResult fallback() {
        return new TriVectorOrthogonalityResult(false, false, false, List.of());
    }
}
