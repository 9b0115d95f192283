/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Satisfying assignment that witnesses a {@code DISPROVEN} property.
 *
 * @param id                      model identifier, derived from the property id
 * @param assignments             constant name to value
 * @param functionInterpretations function name to its finite interpretation
 * @param evaluation              fingerprint of the script the model satisfies
 * @param explanation             supplementary human-readable summary
 */
public record CounterexampleModel(String id,
                                  Map<String, String> assignments,
                                  Map<String, FunctionInterpretation> functionInterpretations,
                                  String evaluation,
                                  String explanation) {

    public CounterexampleModel {
        Objects.requireNonNull(id, "id must not be null");
        assignments = assignments == null
                ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
        functionInterpretations = functionInterpretations == null
                ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(functionInterpretations));
    }

    public static CounterexampleModel empty(String id, String explanation) {
        return new CounterexampleModel(id, Map.of(), Map.of(), "", explanation);
    }

    public boolean isEmpty() {
        return assignments.isEmpty() && functionInterpretations.isEmpty();
    }
}
