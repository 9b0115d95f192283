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
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Evidence attached to a {@code PROVEN} property, decoded from the solver's proof object.
 *
 * @param id          certificate identifier, derived from the property id
 * @param format      proof format produced by the backend (e.g. {@code "z3-proof"})
 * @param content     textual rendering of the solver proof
 * @param size        number of inference steps in the proof
 * @param rules       histogram of inference rule names used by the proof
 * @param premises    asserted formulas the proof depends on
 * @param valid       whether the proof concluded {@code false} from the premises
 * @param formulaHash fingerprint of the script that was refuted
 * @param explanation supplementary human-readable summary
 */
public record ProofCertificate(String id,
                               String format,
                               String content,
                               int size,
                               Map<String, Integer> rules,
                               List<String> premises,
                               boolean valid,
                               String formulaHash,
                               String explanation) {

    public ProofCertificate {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(format, "format must not be null");
        content = content == null ? "" : content;
        rules = rules == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(rules));
        premises = premises == null ? List.of() : List.copyOf(premises);
    }
}
