/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.engine;

import ai.evacortex.specproof.core.encoding.Obligation;
import ai.evacortex.specproof.core.encoding.PropertyEncoder;
import ai.evacortex.specproof.core.exceptions.FormulaException;
import ai.evacortex.specproof.core.model.CounterexampleModel;
import ai.evacortex.specproof.core.model.DiagnosticLevel;
import ai.evacortex.specproof.core.model.ProofCertificate;
import ai.evacortex.specproof.core.model.PropertyCategory;
import ai.evacortex.specproof.core.model.PropertyResult;
import ai.evacortex.specproof.core.model.UnsatCore;
import ai.evacortex.specproof.core.model.VerificationStatistics;
import ai.evacortex.specproof.core.model.VerifiedProperty;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VerificationEngineTest {

    private final PropertyEncoder encoder = new PropertyEncoder();

    private static VerificationEngine engine(ScriptedSolverSession session) {
        return new VerificationEngine(session, VerificationConfig.defaults());
    }

    @Test
    void unsatAnswer_provesAndRecordsCertificateAndCore() {
        ScriptedSolverSession session = ScriptedSolverSession.provingEverything();
        VerificationEngine engine = engine(session);
        Obligation obligation = encoder.ambiguityBound(0.01);

        VerifiedProperty property = engine.verify(obligation);

        assertTrue(property.result().is(PropertyResult.Kind.PROVEN));
        ProofCertificate certificate = property.certificateIfPresent().orElseThrow();
        assertEquals("cert-ambiguity_bound", certificate.id());
        assertEquals("scripted-proof", certificate.format());
        assertEquals(3, certificate.size());
        assertTrue(certificate.valid());
        assertEquals(obligation.standaloneScript().fingerprint(), certificate.formulaHash());
        assertTrue(certificate.explanation().contains("3 steps"));

        UnsatCore core = engine.unsatCores().get("ambiguity_bound");
        assertNotNull(core);
        assertEquals("core-ambiguity_bound", core.id());
        assertTrue(core.coreAssertions().contains(obligation.goalLabel()));
        assertTrue(core.suggestions().isEmpty());

        VerificationStatistics stats = engine.statistics();
        assertEquals(1, stats.smtQueries());
        assertEquals(1, stats.successfulProofs());
        assertEquals(0, stats.counterexamples());
        assertEquals("1", stats.solverStatistics().get("conflicts"));
    }

    @Test
    void formulaOfVerifiedProperty_isRenderedNegatedScript() {
        ScriptedSolverSession session = ScriptedSolverSession.provingEverything();
        VerifiedProperty property = engine(session).verify(encoder.ambiguityBound(0.01), List.of("(declare-sort Any 0)"));

        assertTrue(property.formula().startsWith("(declare-sort Any 0)"));
        assertTrue(property.formula().contains("(assert (not (< ambiguity 0.02)))"));
        assertTrue(property.formula().endsWith("(check-sat)"));
        assertEquals(6, session.checked().get(0).assertions().size());
    }

    @Test
    void satAnswer_disprovesAndRecordsCounterexample() {
        SolverAnswer.Model model = new SolverAnswer.Model(Map.of("ambiguity", "(/ 1.0 10.0)"), Map.of());
        VerificationEngine engine = engine(new ScriptedSolverSession(s -> SolverAnswer.sat(model, Map.of())));

        VerifiedProperty property = engine.verify(encoder.ambiguityBound(0.1));

        assertTrue(property.result().is(PropertyResult.Kind.DISPROVEN));
        assertNull(property.certificate());
        CounterexampleModel cex = engine.counterexamples().get("ambiguity_bound");
        assertEquals("cex-ambiguity_bound", cex.id());
        assertEquals("(/ 1.0 10.0)", cex.assignments().get("ambiguity"));
        assertFalse(cex.evaluation().isEmpty());
        assertEquals(1, engine.statistics().counterexamples());
        assertTrue(engine.proofs().isEmpty());
    }

    @Test
    void satWithoutModel_recordsEmptyCounterexample() {
        VerificationEngine engine = engine(new ScriptedSolverSession(s -> SolverAnswer.sat(null, Map.of())));

        engine.verify(encoder.ambiguityBound(0.5));

        assertTrue(engine.counterexamples().get("ambiguity_bound").isEmpty());
    }

    @Test
    void disabledArtifacts_areNotRecorded() {
        VerificationConfig config = VerificationConfig.builder()
                .generateProofs(false).generateModels(false).generateUnsatCores(false).build();
        VerificationEngine proving = new VerificationEngine(ScriptedSolverSession.provingEverything(), config);
        VerificationEngine refuting = new VerificationEngine(
                new ScriptedSolverSession(s -> SolverAnswer.sat(new SolverAnswer.Model(Map.of("x", "1"), Map.of()),
                        Map.of())), config);

        VerifiedProperty proven = proving.verify(encoder.ambiguityBound(0.01));
        refuting.verify(encoder.ambiguityBound(0.5));

        assertTrue(proven.result().is(PropertyResult.Kind.PROVEN));
        assertNull(proven.certificate());
        assertTrue(proving.proofs().isEmpty());
        assertTrue(proving.unsatCores().isEmpty());
        assertTrue(refuting.counterexamples().isEmpty());
    }

    @Test
    void missingProofObject_leavesInfoDiagnostic() {
        VerificationEngine engine = engine(new ScriptedSolverSession(
                s -> SolverAnswer.unsat(null, List.of(), Map.of())));

        VerifiedProperty property = engine.verify(encoder.ambiguityBound(0.01));

        assertTrue(property.result().is(PropertyResult.Kind.PROVEN));
        assertNull(property.certificate());
        assertEquals(DiagnosticLevel.INFO, engine.diagnostics().get(0).level());
    }

    @Test
    void unknownAnswer_countsTimeoutWithWarning() {
        VerificationEngine engine = engine(new ScriptedSolverSession(s -> SolverAnswer.unknown("timeout", Map.of())));

        PropertyResult result = engine.verify("(declare-const x Int) (assert (> x 0))", "p1");

        assertTrue(result.is(PropertyResult.Kind.UNKNOWN));
        assertEquals(1, engine.statistics().timeouts());
        assertEquals(DiagnosticLevel.WARNING, engine.diagnostics().get(0).level());
        assertTrue(engine.diagnostics().get(0).message().contains("timeout"));
        assertEquals("p1", engine.diagnostics().get(0).context());
    }

    @Test
    void rejectedFormula_isErrorAndBatchContinues() {
        ScriptedSolverSession session = new ScriptedSolverSession(s -> {
            if (s.name().equals("bad")) throw new FormulaException("unknown constant y");
            return ScriptedSolverSession.refute(s);
        });
        VerificationEngine engine = engine(session);

        PropertyResult bad = engine.verify("(assert (> y 0))", "bad");
        PropertyResult good = engine.verify("(assert false)", "good");

        assertTrue(bad.is(PropertyResult.Kind.ERROR));
        assertTrue(bad.reason().contains("unknown constant y"));
        assertTrue(good.is(PropertyResult.Kind.PROVEN));
        assertEquals(1, engine.statistics().errors());
        assertEquals(2, engine.statistics().smtQueries());
        assertEquals(DiagnosticLevel.ERROR, engine.diagnostics().get(0).level());
    }

    @Test
    void unexpectedSolverFailure_isReportedAsError() {
        VerificationEngine engine = engine(new ScriptedSolverSession(s -> {
            throw new IllegalStateException("native crash");
        }));

        PropertyResult result = engine.verify("(assert true)", "p");

        assertTrue(result.is(PropertyResult.Kind.ERROR));
        assertEquals("Solver failure: native crash", result.reason());
    }

    @Test
    void rawFormula_dropsSolverCommandsAndStaysUntracked() {
        ScriptedSolverSession session = ScriptedSolverSession.provingEverything();
        engine(session).verify("(declare-const x Int)\n(assert (> x x))\n(check-sat)\n(get-model)", "raw");

        SmtScript script = session.checked().get(0);
        assertTrue(script.assertions().isEmpty());
        assertFalse(script.body().contains("check-sat"));
        assertFalse(script.body().contains("get-model"));
        assertTrue(script.body().contains("(assert (> x x))"));
    }

    @Test
    void coreWithoutNegatedGoal_flagsVacuousProof() {
        VerificationEngine engine = engine(new ScriptedSolverSession(s ->
                SolverAnswer.unsat(null, List.of(s.assertions().get(0).label()), Map.of())));

        VerifiedProperty property = engine.verify(encoder.contract("vacuous",
                PropertyCategory.CORRECTNESS, "inconsistent axioms",
                List.of("a"), List.of("a", "(not a)"), "a"));

        assertTrue(property.result().is(PropertyResult.Kind.PROVEN));
        UnsatCore core = engine.unsatCores().get("vacuous");
        assertEquals(List.of("vacuous#axiom-0"), core.coreAssertions());
        assertFalse(core.suggestions().isEmpty());
        assertTrue(engine.diagnostics().stream()
                .anyMatch(d -> d.level() == DiagnosticLevel.WARNING && d.message().startsWith("Vacuous proof")));
    }

    @Test
    void expiredDeadline_leavesRemainingPropertiesUnknown() throws InterruptedException {
        ScriptedSolverSession session = ScriptedSolverSession.provingEverything();
        VerificationEngine engine = new VerificationEngine(session,
                VerificationConfig.builder().totalTimeoutMs(1).build());
        Thread.sleep(20);

        VerifiedProperty property = engine.verify(encoder.ambiguityBound(0.01));

        assertTrue(property.result().is(PropertyResult.Kind.UNKNOWN));
        assertTrue(session.checked().isEmpty());
        assertEquals(1, engine.statistics().timeouts());
        assertEquals(DiagnosticLevel.PERFORMANCE, engine.diagnostics().get(0).level());
    }

    @Test
    void repeatedId_replacesStaleArtifacts() {
        boolean[] prove = {true};
        VerificationEngine engine = engine(new ScriptedSolverSession(s -> prove[0]
                ? ScriptedSolverSession.refute(s)
                : SolverAnswer.sat(new SolverAnswer.Model(Map.of(), Map.of()), Map.of())));

        engine.verify(encoder.ambiguityBound(0.01));
        prove[0] = false;
        engine.verify(encoder.ambiguityBound(0.01));

        assertFalse(engine.proofs().containsKey("ambiguity_bound"));
        assertFalse(engine.unsatCores().containsKey("ambiguity_bound"));
        assertTrue(engine.counterexamples().containsKey("ambiguity_bound"));
    }

    @Test
    void resetStatistics_clearsEverythingAndResetsSession() {
        ScriptedSolverSession session = ScriptedSolverSession.provingEverything();
        VerificationEngine engine = engine(session);
        engine.verify(encoder.ambiguityBound(0.01));

        engine.resetStatistics();

        assertEquals(VerificationStatistics.empty().smtQueries(), engine.statistics().smtQueries());
        assertEquals(0, engine.statistics().successfulProofs());
        assertTrue(engine.proofs().isEmpty());
        assertTrue(engine.unsatCores().isEmpty());
        assertTrue(engine.diagnostics().isEmpty());
        assertTrue(engine.statistics().solverStatistics().isEmpty());
        assertEquals(1, session.resets());
    }

    @Test
    void close_closesSession() {
        ScriptedSolverSession session = ScriptedSolverSession.provingEverything();
        engine(session).close();
        assertTrue(session.isClosed());
    }
}
