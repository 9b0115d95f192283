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
import java.util.Optional;

/**
 * A single verified obligation.
 *
 * <p>The certificate is only ever present for a {@code PROVEN} result; the constructor rejects
 * anything else so that a stale certificate can never leak into a report.</p>
 *
 * @param id           identifier, unique within one verification run
 * @param category     property family
 * @param description  human-readable description
 * @param formula      the SMT-LIB text sent to the solver
 * @param result       the decided outcome
 * @param elapsedNanos wall time spent on this property
 * @param certificate  proof certificate, or {@code null}
 */
public record VerifiedProperty(String id,
                               PropertyCategory category,
                               String description,
                               String formula,
                               PropertyResult result,
                               long elapsedNanos,
                               ProofCertificate certificate) {

    public VerifiedProperty {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(result, "result must not be null");
        description = description == null ? "" : description;
        formula = formula == null ? "" : formula;
        if (certificate != null && !result.is(PropertyResult.Kind.PROVEN)) {
            throw new IllegalArgumentException("certificate is only allowed for proven properties: " + id);
        }
    }

    public Optional<ProofCertificate> certificateIfPresent() {
        return Optional.ofNullable(certificate);
    }
}
