/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.encoding;

import ai.evacortex.specproof.core.ast.Document;
import ai.evacortex.specproof.core.environment.EnvironmentBuilder;
import ai.evacortex.specproof.core.model.PropertyCategory;
import ai.evacortex.specproof.core.trivector.OrthogonalityResult;
import ai.evacortex.specproof.core.trivector.OrthogonalityType;
import ai.evacortex.specproof.core.trivector.SafetyIsolationResult;
import ai.evacortex.specproof.core.trivector.TriVectorSignal;
import ai.evacortex.specproof.core.trivector.TriVectorValidationResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds {@link Obligation}s from document-derived inputs.
 *
 * <p>All methods are pure and deterministic: equal inputs produce equal obligations, and nothing here
 * talks to a solver. Every obligation states the desired property as its goal; the engine is responsible
 * for asserting the negation.</p>
 *
 * <p>Formulas reference the domain sorts {@code Vector} and {@code Signal} declared by
 * {@link EnvironmentBuilder}, either in a document environment or in
 * {@link EnvironmentBuilder#domainPreamble()}.</p>
 */
public final class PropertyEncoder {

    static final String SPACE_SORT = "Space";
    static final String OPTIMIZATION_SORT = "Optimization";
    static final String SAFETY_SPACE = "safety_space";

    /** Sorts declared by tri-vector obligations; documents may not define types with these names. */
    public static final Set<String> OBLIGATION_SORTS = Set.of(SPACE_SORT, OPTIMIZATION_SORT);

    /** Functions and constants declared by tri-vector obligations; documents may not define them. */
    public static final Set<String> OBLIGATION_SYMBOLS = Set.of(SAFETY_SPACE, "support", "in_space",
            "dot_product", "affects", "direct_sum", "project_H", "project_L", "project_S");

    private static final String VECTOR = EnvironmentBuilder.VECTOR;
    private static final String SIGNAL = EnvironmentBuilder.SIGNAL;

    /**
     * Orthogonality goal for two spaces. Space names are substituted verbatim.
     */
    public static String orthogonalityFormula(String space1, String space2) {
        return "(forall ((v1 " + VECTOR + ") (v2 " + VECTOR + ")) "
                + "(=> (and (in_space v1 " + space1 + ") (in_space v2 " + space2 + ")) "
                + "(= (dot_product v1 v2) 0.0)))";
    }

    public Obligation orthogonality(String space1, String space2, OrthogonalityType type) {
        return orthogonality("orthogonality:" + space1 + "/" + space2,
                space1 + " ⊥ " + space2, space1, space2, type);
    }

    /**
     * Orthogonality of two concern spaces.
     *
     * <p>Vectors belong to exactly the space of their support block and vectors with different support
     * blocks have a zero inner product. A {@code COMPLETELY_ORTHOGONAL} input places the spaces on
     * distinct blocks, a {@code NOT_ORTHOGONAL} input on the same block; a partial result adds no fact.</p>
     */
    public Obligation orthogonality(String id, String description, String space1, String space2,
                                    OrthogonalityType type) {
        Objects.requireNonNull(space1, "space1 must not be null");
        Objects.requireNonNull(space2, "space2 must not be null");
        Objects.requireNonNull(type, "type must not be null");

        Set<String> declarations = new LinkedHashSet<>();
        declarations.add(SmtLib.declareSort(SPACE_SORT));
        declarations.add(SmtLib.declareFun("support", List.of(VECTOR), SPACE_SORT));
        declarations.add(SmtLib.declareFun("in_space", List.of(VECTOR, SPACE_SORT), "Bool"));
        declarations.add(SmtLib.declareFun("dot_product", List.of(VECTOR, VECTOR), "Real"));
        declarations.add(SmtLib.declareConst(space1, SPACE_SORT));
        declarations.add(SmtLib.declareConst(space2, SPACE_SORT));

        List<String> axioms = new ArrayList<>();
        axioms.add("(forall ((v " + VECTOR + ") (s " + SPACE_SORT + ")) (= (in_space v s) (= (support v) s)))");
        axioms.add("(forall ((v1 " + VECTOR + ") (v2 " + VECTOR + ")) "
                + "(=> (distinct (support v1) (support v2)) (= (dot_product v1 v2) 0.0)))");
        switch (type) {
            case COMPLETELY_ORTHOGONAL:
                axioms.add("(distinct " + space1 + " " + space2 + ")");
                break;
            case NOT_ORTHOGONAL:
                axioms.add("(= " + space1 + " " + space2 + ")");
                break;
            default:
                break;
        }
        return new Obligation(id, PropertyCategory.TRI_VECTOR_ORTHOGONALITY, description,
                List.copyOf(declarations), axioms, orthogonalityFormula(space1, space2));
    }

    /**
     * Non-interference of optimizations with the safety space.
     *
     * <p>An isolated input contributes the non-interference fact established by the analysis; each
     * recorded violation contributes a ground {@code affects} fact.</p>
     */
    public Obligation safetyIsolation(SafetyIsolationResult isolation) {
        Objects.requireNonNull(isolation, "isolation must not be null");
        String goal = "(forall ((optimization " + OPTIMIZATION_SORT + ")) "
                + "(not (affects optimization " + SAFETY_SPACE + ")))";

        Set<String> declarations = new LinkedHashSet<>();
        declarations.add(SmtLib.declareSort(OPTIMIZATION_SORT));
        declarations.add(SmtLib.declareSort(SPACE_SORT));
        declarations.add(SmtLib.declareConst(SAFETY_SPACE, SPACE_SORT));
        declarations.add(SmtLib.declareFun("affects", List.of(OPTIMIZATION_SORT, SPACE_SORT), "Bool"));

        List<String> axioms = new ArrayList<>();
        if (isolation.isolated()) {
            axioms.add(goal);
        }
        for (String violation : isolation.violations()) {
            String symbol = SmtLib.quote(violation);
            declarations.add(SmtLib.declareConst(symbol, OPTIMIZATION_SORT));
            axioms.add("(affects " + symbol + " " + SAFETY_SPACE + ")");
        }
        return new Obligation("safety_isolation", PropertyCategory.TRI_VECTOR_ORTHOGONALITY,
                "No optimization affects the safety space", List.copyOf(declarations), axioms, goal);
    }

    /**
     * Existence and uniqueness of the three-way decomposition {@code s = vh ⊕ vl ⊕ vs} via the projections.
     */
    public Obligation decomposition(TriVectorSignal signal) {
        Objects.requireNonNull(signal, "signal must not be null");
        List<String> declarations = List.of(
                SmtLib.declareFun("direct_sum", List.of(VECTOR, VECTOR, VECTOR), SIGNAL),
                SmtLib.declareFun("project_H", List.of(SIGNAL), VECTOR),
                SmtLib.declareFun("project_L", List.of(SIGNAL), VECTOR),
                SmtLib.declareFun("project_S", List.of(SIGNAL), VECTOR));
        String lossless = "(forall ((s " + SIGNAL + ")) "
                + "(= s (direct_sum (project_H s) (project_L s) (project_S s))))";
        String goal = "(forall ((s " + SIGNAL + ")) (exists ((vh " + VECTOR + ") (vl " + VECTOR + ") (vs "
                + VECTOR + ")) (and (= s (direct_sum vh vl vs)) (= vh (project_H s)) "
                + "(= vl (project_L s)) (= vs (project_S s)))))";
        String description = "Signal decomposes uniquely into " + signal.semantic().name() + " ⊕ "
                + signal.structural().name() + " ⊕ " + signal.safety().name();
        return new Obligation("signal_decomposition", PropertyCategory.TRI_VECTOR_ORTHOGONALITY,
                description, declarations, List.of(lossless), goal);
    }

    /**
     * Obligations derived from a tri-vector analysis: one per orthogonality constraint, then safety
     * isolation and decomposition. Empty when the analysis found no signal.
     */
    public List<Obligation> triVector(TriVectorValidationResult result) {
        if (result == null || result.signal() == null) return List.of();
        List<Obligation> out = new ArrayList<>();
        for (Map.Entry<String, OrthogonalityResult> entry : result.orthogonalityResults().entrySet()) {
            OrthogonalityResult pair = entry.getValue();
            out.add(orthogonality("orthogonality:" + entry.getKey(), entry.getKey(),
                    pair.space1(), pair.space2(), pair.type()));
        }
        out.add(safetyIsolation(result.safetyIsolation()));
        out.add(decomposition(result.signal()));
        return out;
    }

    public List<Obligation> temporal(Document document) {
        return List.of();
    }

    public List<Obligation> typeSafety(Document document) {
        return List.of();
    }

    public List<Obligation> correctness(Document document) {
        return List.of();
    }

    /**
     * All obligations for one document run, in verification order.
     */
    public List<Obligation> encodeDocument(Document document, TriVectorValidationResult triVector) {
        Objects.requireNonNull(document, "document must not be null");
        List<Obligation> out = new ArrayList<>(triVector(triVector));
        out.addAll(temporal(document));
        out.addAll(typeSafety(document));
        out.addAll(correctness(document));
        return out;
    }

    /**
     * {@code ambiguity < 0.02} where {@code ambiguity = 1 - unique_parses / total_parses}, with the
     * measured ambiguity fixed as a fact.
     */
    public Obligation ambiguityBound(double measured) {
        List<String> declarations = List.of(
                SmtLib.declareConst("ambiguity", "Real"),
                SmtLib.declareConst("unique_parses", "Real"),
                SmtLib.declareConst("total_parses", "Real"));
        List<String> axioms = List.of(
                "(= ambiguity (- 1.0 (/ unique_parses total_parses)))",
                "(>= unique_parses 0.0)",
                "(>= total_parses 1.0)",
                "(<= unique_parses total_parses)",
                "(= ambiguity " + SmtLib.decimal(measured) + ")");
        return new Obligation("ambiguity_bound", PropertyCategory.CORRECTNESS,
                "Ambiguity below 0.02", declarations, axioms, "(< ambiguity 0.02)");
    }

    /**
     * Pipeline success rates over {@code steps} steps: the target rate exceeds the baseline and the
     * improvement factor is above one.
     */
    public Obligation pipelineRates(int steps, double baselineRate, double targetRate, double improvementFactor) {
        List<String> declarations = List.of(
                SmtLib.declareConst("baseline_rate", "Real"),
                SmtLib.declareConst("target_rate", "Real"),
                SmtLib.declareConst("improvement_factor", "Real"));
        List<String> axioms = List.of(
                "(= baseline_rate " + SmtLib.decimal(baselineRate) + ")",
                "(= target_rate " + SmtLib.decimal(targetRate) + ")",
                "(= improvement_factor " + SmtLib.decimal(improvementFactor) + ")");
        return new Obligation("pipeline_rates:" + steps, PropertyCategory.CORRECTNESS,
                "Pipeline success rate over " + steps + " steps", declarations, axioms,
                "(and (> target_rate baseline_rate) (> improvement_factor 1.0))");
    }

    /**
     * Propositional contract over boolean atoms, e.g. a layer guarantee or a composition edge.
     */
    public Obligation contract(String id, PropertyCategory category, String description,
                               Collection<String> atoms, List<String> facts, String goal) {
        List<String> declarations = new ArrayList<>(atoms.size());
        for (String atom : atoms) {
            declarations.add(SmtLib.declareConst(SmtLib.quote(atom), "Bool"));
        }
        return new Obligation(id, category, description, declarations, facts, goal);
    }
}
