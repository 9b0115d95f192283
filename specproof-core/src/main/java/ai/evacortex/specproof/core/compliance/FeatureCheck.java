/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.compliance;

import ai.evacortex.specproof.core.ast.Document;

/**
 * One independent verification unit of the feature registry.
 *
 * <p>Checks must be side-effect free. An exception thrown by a check fails the whole feature
 * compliance phase, which then degrades to its fallback.</p>
 */
@FunctionalInterface
public interface FeatureCheck {

    Outcome check(Document document);

    record Outcome(boolean implemented, boolean smtVerified, boolean mathematicallyCorrect, String details) {

        public static Outcome verified(String details) {
            return new Outcome(true, true, true, details);
        }

        public static Outcome implementedOnly(String details) {
            return new Outcome(true, false, true, details);
        }

        public static Outcome missing(String details) {
            return new Outcome(false, false, false, details);
        }
    }
}
