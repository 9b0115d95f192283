/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.model;

import java.util.List;
import java.util.Objects;

public record UnsatCore(String id, List<String> coreAssertions, String explanation, List<String> suggestions) {

    public UnsatCore {
        Objects.requireNonNull(id, "id must not be null");
        coreAssertions = coreAssertions == null ? List.of() : List.copyOf(coreAssertions);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
}
