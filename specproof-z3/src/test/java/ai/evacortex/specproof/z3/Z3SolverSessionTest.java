/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.z3;

import ai.evacortex.specproof.core.engine.SatStatus;
import ai.evacortex.specproof.core.engine.SmtScript;
import ai.evacortex.specproof.core.engine.SolverAnswer;
import ai.evacortex.specproof.core.engine.SolverSession;
import ai.evacortex.specproof.core.engine.VerificationConfig;
import ai.evacortex.specproof.core.exceptions.FormulaException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class Z3SolverSessionTest {

    private final Z3SessionProvider provider = new Z3SessionProvider();

    @BeforeEach
    void requireNativeZ3() {
        assumeTrue(Z3SessionProvider.nativeAvailable(), "Z3 native library not available");
    }

    private static SmtScript script(String name, String... labelledFormulas) {
        List<SmtScript.LabelledAssertion> tracked = new ArrayList<>();
        for (int i = 0; i < labelledFormulas.length; i += 2) {
            tracked.add(new SmtScript.LabelledAssertion(labelledFormulas[i], labelledFormulas[i + 1]));
        }
        return new SmtScript(name, List.of("(declare-const x Int)"), tracked);
    }

    @Test
    void contradictoryBounds_areUnsatWithProofAndCore() {
        try (SolverSession session = provider.open(VerificationConfig.defaults())) {
            SolverAnswer answer = session.check(script("bounds", "lower", "(> x 0)", "upper", "(< x 0)"));

            assertEquals(SatStatus.UNSAT, answer.status());
            assertNotNull(answer.proof(), "Proof expected when proofs are enabled");
            assertTrue(answer.proof().steps() > 0);
            assertTrue(answer.proof().concludesFalse());
            assertFalse(answer.proof().rules().isEmpty());
            assertTrue(answer.unsatCore().containsAll(List.of("lower", "upper")));
        }
    }

    @Test
    void satisfiableScript_yieldsModelWithoutTrackingLiterals() {
        try (SolverSession session = provider.open(VerificationConfig.defaults())) {
            SolverAnswer answer = session.check(script("positive", "lower", "(> x 41)"));

            assertEquals(SatStatus.SAT, answer.status());
            assertNotNull(answer.model());
            assertTrue(answer.model().constants().containsKey("x"));
            assertFalse(answer.model().constants().containsKey("lower"));
            assertNull(answer.proof());
        }
    }

    @Test
    void uninterpretedFunction_appearsInModel() {
        try (SolverSession session = provider.open(VerificationConfig.defaults())) {
            SmtScript s = new SmtScript("fn", List.of("(declare-fun f (Int) Int)"),
                    List.of(new SmtScript.LabelledAssertion("f1", "(= (f 1) 7)")));

            SolverAnswer answer = session.check(s);

            assertEquals(SatStatus.SAT, answer.status());
            assertTrue(answer.model().functions().containsKey("f"));
            assertEquals(List.of("Int"), answer.model().functions().get("f").domain());
        }
    }

    @Test
    void checks_doNotLeakAssertions() {
        try (SolverSession session = provider.open(VerificationConfig.defaults())) {
            assertEquals(SatStatus.UNSAT, session.check(script("a", "f", "false")).status());
            assertEquals(SatStatus.SAT, session.check(script("b", "t", "(= x 1)")).status());
        }
    }

    @Test
    void untrackedRawAssertions_areChecked() {
        try (SolverSession session = provider.open(VerificationConfig.defaults())) {
            SmtScript raw = SmtScript.raw("raw", "(declare-const y Real)\n(assert (> y 1.0))\n(assert (< y 0.5))\n(check-sat)");
            assertEquals(SatStatus.UNSAT, session.check(raw).status());
        }
    }

    @Test
    void undeclaredSymbol_isFormulaError() {
        try (SolverSession session = provider.open(VerificationConfig.defaults())) {
            SmtScript bad = new SmtScript("bad", List.of(),
                    List.of(new SmtScript.LabelledAssertion("g", "(> undeclared 0)")));
            FormulaException e = assertThrows(FormulaException.class, () -> session.check(bad));
            assertTrue(e.getMessage().startsWith("Invalid formula: bad"));
        }
    }

    @Test
    void nonIncrementalTacticPipeline_decidesWithoutArtifacts() {
        VerificationConfig config = VerificationConfig.builder()
                .incremental(false).generateProofs(false).generateUnsatCores(false).build();
        try (SolverSession session = provider.open(config)) {
            assertEquals(SatStatus.UNSAT, session.check(script("u", "a", "(> x 0)", "b", "(< x 0)")).status());
            assertEquals(SatStatus.SAT, session.check(script("s", "a", "(> x 0)")).status());
        }
    }

    @Test
    void nonIncrementalWithDefaultArtifacts_stillProvesWithProofAndCore() {
        VerificationConfig config = VerificationConfig.defaults().toBuilder().incremental(false).build();
        try (SolverSession session = provider.open(config)) {
            SolverAnswer answer = session.check(script("bounds", "lower", "(> x 0)", "upper", "(< x 0)"));

            assertEquals(SatStatus.UNSAT, answer.status(), "Got " + answer.status() + ": " + answer.reasonUnknown());
            assertNotNull(answer.proof());
            assertTrue(answer.unsatCore().containsAll(List.of("lower", "upper")));
            assertEquals(SatStatus.SAT, session.check(script("positive", "lower", "(> x 0)")).status());
        }
    }

    @Test
    void closedSession_rejectsChecks() {
        SolverSession session = provider.open(VerificationConfig.defaults());
        session.close();
        assertThrows(IllegalStateException.class, () -> session.check(script("late", "a", "true")));
        assertDoesNotThrow(session::close);
    }
}
