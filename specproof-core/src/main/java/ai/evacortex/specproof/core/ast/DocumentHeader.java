/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.ast;

import java.util.List;
import java.util.Objects;

public record DocumentHeader(String version, String name, String date, HeaderMetadata metadata) {

    public DocumentHeader {
        Objects.requireNonNull(version, "version must not be null");
        Objects.requireNonNull(name, "name must not be null");
        date = date == null ? "" : date;
    }

    public record HeaderMetadata(String author, String description, List<String> tags) {
        public HeaderMetadata {
            tags = tags == null ? List.of() : List.copyOf(tags);
        }
    }
}
