/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.engine;

import ai.evacortex.specproof.core.model.PropertyResult;
import ai.evacortex.specproof.core.model.VerificationStatus;
import ai.evacortex.specproof.core.model.VerifiedProperty;

import java.util.List;
import java.util.Objects;

/**
 * Folds per-property results into a document verdict.
 *
 * <p>An error or a disproven property fails the document. Without failures, every property proven
 * gives {@code ALL_VERIFIED}, at least one gives {@code PARTIALLY_VERIFIED}, none gives
 * {@code INCOMPLETE}.</p>
 */
public final class ResultAggregator {

    public VerificationStatus aggregate(List<VerifiedProperty> properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        if (properties.isEmpty()) {
            return VerificationStatus.incomplete();
        }
        for (VerifiedProperty p : properties) {
            if (p.result().is(PropertyResult.Kind.ERROR)) {
                return VerificationStatus.failed("Property '" + p.id() + "' errored: " + p.result().reason());
            }
        }
        for (VerifiedProperty p : properties) {
            if (p.result().is(PropertyResult.Kind.DISPROVEN)) {
                return VerificationStatus.failed("Property '" + p.id() + "' disproven");
            }
        }
        long proven = properties.stream().filter(p -> p.result().is(PropertyResult.Kind.PROVEN)).count();
        if (proven == properties.size()) {
            return VerificationStatus.allVerified();
        }
        return proven > 0 ? VerificationStatus.partiallyVerified() : VerificationStatus.incomplete();
    }
}
