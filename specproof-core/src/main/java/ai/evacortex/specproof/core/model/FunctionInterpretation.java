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

/**
 * Finite interpretation of an uninterpreted function in a counterexample model.
 */
public record FunctionInterpretation(String name,
                                     List<String> domain,
                                     String codomain,
                                     List<Entry> mapping,
                                     String defaultValue) {

    public record Entry(List<String> arguments, String value) {
        public Entry {
            arguments = List.copyOf(arguments);
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    public FunctionInterpretation {
        Objects.requireNonNull(name, "name must not be null");
        domain = domain == null ? List.of() : List.copyOf(domain);
        mapping = mapping == null ? List.of() : List.copyOf(mapping);
    }
}
