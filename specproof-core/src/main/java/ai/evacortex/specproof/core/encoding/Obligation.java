/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.encoding;

import ai.evacortex.specproof.core.engine.SmtScript;
import ai.evacortex.specproof.core.environment.EnvironmentBuilder;
import ai.evacortex.specproof.core.model.PropertyCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A property to verify, stated positively.
 *
 * <p>{@code goal} is the desired property. The engine asserts {@code axioms} and the negation of
 * {@code goal}: an unsatisfiable script means the property holds under the axioms, a satisfiable one
 * yields a counterexample.</p>
 *
 * @param id           identifier, unique within a run
 * @param category     property family
 * @param description  human-readable description
 * @param declarations SMT-LIB declarations local to this obligation
 * @param axioms       background facts, each a boolean SMT-LIB term
 * @param goal         the property, a boolean SMT-LIB term
 */
public record Obligation(String id,
                         PropertyCategory category,
                         String description,
                         List<String> declarations,
                         List<String> axioms,
                         String goal) {

    public static final String GOAL_LABEL_SUFFIX = "#negated-goal";

    public Obligation {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(goal, "goal must not be null");
        description = description == null ? "" : description;
        declarations = declarations == null ? List.of() : List.copyOf(declarations);
        axioms = axioms == null ? List.of() : List.copyOf(axioms);
    }

    public String goalLabel() {
        return id + GOAL_LABEL_SUFFIX;
    }

    /**
     * Domain sort declarations, the obligation's declarations, asserted axioms and the asserted negated
     * goal, followed by {@code (check-sat)}. Valid on its own without a document environment.
     */
    public String negatedScript() {
        return standaloneScript().render();
    }

    /**
     * Tracked script on top of the domain sort declarations only.
     */
    public SmtScript standaloneScript() {
        return toScript(EnvironmentBuilder.domainPreamble());
    }

    /**
     * Builds the tracked script for this obligation on top of an environment preamble.
     */
    public SmtScript toScript(List<String> preamble) {
        List<String> commands = new ArrayList<>(preamble.size() + declarations.size());
        commands.addAll(preamble);
        commands.addAll(declarations);

        List<SmtScript.LabelledAssertion> tracked = new ArrayList<>(axioms.size() + 1);
        for (int i = 0; i < axioms.size(); i++) {
            tracked.add(new SmtScript.LabelledAssertion(id + "#axiom-" + i, axioms.get(i)));
        }
        tracked.add(new SmtScript.LabelledAssertion(goalLabel(), SmtLib.not(goal)));
        return new SmtScript(id, commands, tracked);
    }
}
