/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.engine;

import ai.evacortex.specproof.core.model.FunctionInterpretation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Backend-neutral answer to one satisfiability check.
 *
 * <p>{@code proof} and {@code unsatCore} can only accompany {@code UNSAT}, {@code model} only {@code SAT}.
 * Each artifact is {@code null} (or empty) when it was not requested or could not be extracted.</p>
 *
 * @param status        three-valued answer
 * @param reasonUnknown solver explanation for {@code UNKNOWN}, e.g. {@code "timeout"}
 * @param proof         decoded refutation
 * @param model         decoded satisfying assignment
 * @param unsatCore     labels of the tracked assertions in the core
 * @param statistics    solver-internal statistics of this check
 */
public record SolverAnswer(SatStatus status,
                           String reasonUnknown,
                           Proof proof,
                           Model model,
                           List<String> unsatCore,
                           Map<String, String> statistics) {

    /**
     * @param content        textual rendering of the proof term
     * @param steps          number of distinct inference steps
     * @param rules          inference rule name to number of uses
     * @param premises       asserted formulas used as hypotheses
     * @param concludesFalse whether the root of the proof is {@code false}
     */
    public record Proof(String content, int steps, Map<String, Integer> rules, List<String> premises,
                        boolean concludesFalse) {
        public Proof {
            content = content == null ? "" : content;
            rules = rules == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(rules));
            premises = premises == null ? List.of() : List.copyOf(premises);
        }
    }

    public record Model(Map<String, String> constants, Map<String, FunctionInterpretation> functions) {
        public Model {
            constants = constants == null
                    ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(constants));
            functions = functions == null
                    ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        }
    }

    public SolverAnswer {
        Objects.requireNonNull(status, "status must not be null");
        unsatCore = unsatCore == null ? List.of() : List.copyOf(unsatCore);
        statistics = statistics == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(statistics));
        if (status != SatStatus.UNSAT && (proof != null || !unsatCore.isEmpty())) {
            throw new IllegalArgumentException("proof and unsat core require UNSAT, got " + status);
        }
        if (status != SatStatus.SAT && model != null) {
            throw new IllegalArgumentException("model requires SAT, got " + status);
        }
    }

    public static SolverAnswer sat(Model model, Map<String, String> statistics) {
        return new SolverAnswer(SatStatus.SAT, null, null, model, List.of(), statistics);
    }

    public static SolverAnswer unsat(Proof proof, List<String> unsatCore, Map<String, String> statistics) {
        return new SolverAnswer(SatStatus.UNSAT, null, proof, null, unsatCore, statistics);
    }

    public static SolverAnswer unknown(String reason, Map<String, String> statistics) {
        return new SolverAnswer(SatStatus.UNKNOWN, reason, null, null, List.of(), statistics);
    }
}
