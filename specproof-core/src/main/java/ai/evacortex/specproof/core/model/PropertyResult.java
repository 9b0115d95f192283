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
 * Outcome of verifying a single property. Only {@link Kind#ERROR} carries a reason.
 */
public record PropertyResult(Kind kind, String reason) {

    public enum Kind { PROVEN, DISPROVEN, UNKNOWN, ERROR, UNSUPPORTED }

    private static final PropertyResult PROVEN = new PropertyResult(Kind.PROVEN, null);
    private static final PropertyResult DISPROVEN = new PropertyResult(Kind.DISPROVEN, null);
    private static final PropertyResult UNKNOWN = new PropertyResult(Kind.UNKNOWN, null);
    private static final PropertyResult UNSUPPORTED = new PropertyResult(Kind.UNSUPPORTED, null);

    public PropertyResult {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == Kind.ERROR && (reason == null || reason.isBlank())) {
            reason = "unspecified error";
        }
        if (kind != Kind.ERROR) {
            reason = null;
        }
    }

    public static PropertyResult proven() {
        return PROVEN;
    }

    public static PropertyResult disproven() {
        return DISPROVEN;
    }

    public static PropertyResult unknown() {
        return UNKNOWN;
    }

    public static PropertyResult unsupported() {
        return UNSUPPORTED;
    }

    public static PropertyResult error(String reason) {
        return new PropertyResult(Kind.ERROR, reason);
    }

    public boolean is(Kind expected) {
        return kind == expected;
    }

    @Override
    public String toString() {
        return kind == Kind.ERROR ? "ERROR(" + reason + ")" : kind.name();
    }
}
