/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.engine;

import ai.evacortex.specproof.core.encoding.SmtLib;
import ai.evacortex.specproof.core.util.Fingerprints;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * SMT-LIB input for one satisfiability check.
 *
 * <p>{@code commands} hold declarations and any untracked assertions; {@code assertions} are tracked
 * under their label so that the backend can report them in an unsat core.</p>
 *
 * @param name       owner of the script, usually the property id
 * @param commands   declarations and raw commands, in order
 * @param assertions labelled assertions appended after the commands
 */
public record SmtScript(String name, List<String> commands, List<LabelledAssertion> assertions) {

    private static final Pattern SOLVER_COMMANDS =
            Pattern.compile("\\(\\s*(check-sat|get-model|get-proof|get-unsat-core|get-info[^)]*|exit)\\s*\\)");

    public record LabelledAssertion(String label, String formula) {
        public LabelledAssertion {
            Objects.requireNonNull(label, "label must not be null");
            Objects.requireNonNull(formula, "formula must not be null");
        }
    }

    public SmtScript {
        Objects.requireNonNull(name, "name must not be null");
        commands = commands == null ? List.of() : List.copyOf(commands);
        assertions = assertions == null ? List.of() : List.copyOf(assertions);
    }

    /**
     * Wraps caller-supplied SMT-LIB text. Solver commands such as {@code (check-sat)} are dropped;
     * assertions inside the text stay untracked.
     */
    public static SmtScript raw(String name, String text) {
        Objects.requireNonNull(text, "text must not be null");
        String body = SOLVER_COMMANDS.matcher(text).replaceAll("").strip();
        return new SmtScript(name, body.isEmpty() ? List.of() : List.of(body), List.of());
    }

    /**
     * Declarations and assertions only; the form handed to a parser.
     */
    public String body() {
        List<String> lines = new ArrayList<>(commands);
        for (LabelledAssertion assertion : assertions) {
            lines.add(SmtLib.assertion(assertion.formula()));
        }
        return String.join("\n", lines);
    }

    /**
     * Full script as a solver would receive it on the command line.
     */
    public String render() {
        String body = body();
        return body.isEmpty() ? "(check-sat)" : body + "\n(check-sat)";
    }

    public String fingerprint() {
        return Fingerprints.of(body());
    }
}
