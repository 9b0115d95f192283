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

/**
 * Document-level verdict derived from a set of verified properties. Only {@link Kind#FAILED} carries a reason.
 */
public record VerificationStatus(Kind kind, String reason) {

    public enum Kind { ALL_VERIFIED, PARTIALLY_VERIFIED, INCOMPLETE, FAILED, DISABLED }

    public VerificationStatus {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind != Kind.FAILED) {
            reason = null;
        } else if (reason == null) {
            reason = "";
        }
    }

    public static VerificationStatus allVerified() {
        return new VerificationStatus(Kind.ALL_VERIFIED, null);
    }

    public static VerificationStatus partiallyVerified() {
        return new VerificationStatus(Kind.PARTIALLY_VERIFIED, null);
    }

    public static VerificationStatus incomplete() {
        return new VerificationStatus(Kind.INCOMPLETE, null);
    }

    public static VerificationStatus failed(String reason) {
        return new VerificationStatus(Kind.FAILED, reason);
    }

    public static VerificationStatus disabled() {
        return new VerificationStatus(Kind.DISABLED, null);
    }

    public boolean is(Kind expected) {
        return kind == expected;
    }
}
