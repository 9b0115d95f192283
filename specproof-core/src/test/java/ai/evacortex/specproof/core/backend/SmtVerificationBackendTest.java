/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.backend;

import ai.evacortex.specproof.core.ast.Document;
import ai.evacortex.specproof.core.ast.TypeDefinition;
import ai.evacortex.specproof.core.ast.TypeExpression;
import ai.evacortex.specproof.core.ast.TypesBlock;
import ai.evacortex.specproof.core.engine.ScriptedSolverSession;
import ai.evacortex.specproof.core.engine.SmtScript;
import ai.evacortex.specproof.core.engine.SolverAnswer;
import ai.evacortex.specproof.core.engine.VerificationConfig;
import ai.evacortex.specproof.core.environment.EnvironmentBuilder;
import ai.evacortex.specproof.core.exceptions.SetupException;
import ai.evacortex.specproof.core.model.VerificationReport;
import ai.evacortex.specproof.core.model.VerificationStatus;
import ai.evacortex.specproof.core.model.VerifiedProperty;
import ai.evacortex.specproof.core.trivector.OrthogonalityType;
import ai.evacortex.specproof.core.trivector.SafetyIsolationResult;
import ai.evacortex.specproof.core.trivector.TriVectorFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SmtVerificationBackend contract (scripted session)")
class SmtVerificationBackendTest extends VerificationBackendContractTest {

    @Override
    protected VerificationBackend backend() {
        return new SmtVerificationBackend(ScriptedSolverSession.provingEverything(), VerificationConfig.defaults());
    }

    @Test
    void nameComesFromSession() {
        VerificationBackend backend = backend();
        assertTrue(backend.isEnabled());
        assertEquals("scripted", backend.name());
    }

    @Test
    void emptyDocument_isIncomplete() {
        VerificationReport report = backend().verifyDocument(Document.of("empty"));
        assertTrue(report.status().is(VerificationStatus.Kind.INCOMPLETE));
        assertEquals(0, report.statistics().smtQueries());
    }

    @Test
    void triVectorDocument_provesAllObligationsInOrder() {
        ScriptedSolverSession session = ScriptedSolverSession.provingEverything();
        VerificationBackend backend = new SmtVerificationBackend(session, VerificationConfig.defaults());
        Document doc = Document.of("doc", TypesBlock.of(new TypeDefinition("Score", TypeExpression.real())));

        VerificationReport report = backend.verifyDocument(doc, TriVectorFixtures.isolatedStandard());

        assertTrue(report.status().is(VerificationStatus.Kind.ALL_VERIFIED));
        assertEquals(4, report.properties().size());
        assertEquals("safety_isolation", report.properties().get(2).id());
        assertEquals(4, report.proofs().size());
        assertEquals(4, report.unsatCores().size());
        assertEquals(4, report.statistics().smtQueries());
        assertEquals(4, report.statistics().successfulProofs());
        for (SmtScript script : session.checked()) {
            assertTrue(script.commands().contains("(define-sort Score () Real)"), "Environment preamble expected");
        }
    }

    @Test
    void violatedSafety_failsDocument() {
        VerificationBackend backend = new SmtVerificationBackend(new ScriptedSolverSession(s ->
                s.name().equals("safety_isolation")
                        ? SolverAnswer.sat(new SolverAnswer.Model(Map.of("inline", "Optimization!val!0"), Map.of()),
                        Map.of())
                        : ScriptedSolverSession.refute(s)), VerificationConfig.defaults());

        VerificationReport report = backend.verifyDocument(Document.of("doc"),
                TriVectorFixtures.withIsolation(SafetyIsolationResult.violatedBy("inline")));

        assertTrue(report.status().is(VerificationStatus.Kind.FAILED));
        assertEquals("Property 'safety_isolation' disproven", report.status().reason());
        assertTrue(report.counterexamples().containsKey("safety_isolation"));
        assertFalse(report.proofs().containsKey("safety_isolation"));
    }

    @Test
    void eachRun_startsFromCleanStatistics() {
        VerificationBackend backend = backend();
        backend.verifyDocument(Document.of("first"), TriVectorFixtures.isolatedStandard());
        VerificationReport second = backend.verifyDocument(Document.of("second"), TriVectorFixtures.isolatedStandard());
        assertEquals(4, second.statistics().smtQueries());
        assertEquals(4, second.proofs().size());
    }

    @Test
    void invalidEnvironment_propagatesSetupFailure() {
        Document doc = Document.of("bad", TypesBlock.of(new TypeDefinition("Int", TypeExpression.integer())));
        assertThrows(SetupException.class, () -> backend().verifyDocument(doc));
    }

    @Test
    void obligationWithEnvironment_prefixesPreamble() {
        ScriptedSolverSession session = ScriptedSolverSession.provingEverything();
        VerificationBackend backend = new SmtVerificationBackend(session, VerificationConfig.defaults());
        VerifiedProperty property = backend.verifyObligation(encoder.ambiguityBound(0.01),
                new EnvironmentBuilder().build(Document.of("d")));
        assertTrue(property.formula().startsWith("(declare-sort Vector 0)"));
    }

    @Test
    void typeCollidingWithObligationSort_failsBeforeAnyQuery() {
        ScriptedSolverSession session = ScriptedSolverSession.provingEverything();
        VerificationBackend backend = new SmtVerificationBackend(session, VerificationConfig.defaults());
        Document doc = Document.of("space", TypesBlock.of(new TypeDefinition("Space", TypeExpression.string())));

        assertThrows(SetupException.class, () -> backend.verifyDocument(doc, TriVectorFixtures.isolatedStandard()));
        assertTrue(session.checked().isEmpty());
    }

    @Test
    void obligationWithoutEnvironment_declaresDomainSorts() {
        ScriptedSolverSession session = ScriptedSolverSession.provingEverything();
        VerificationBackend backend = new SmtVerificationBackend(session, VerificationConfig.defaults());
        VerifiedProperty property = backend.verifyObligation(
                encoder.orthogonality("V_H", "V_S", OrthogonalityType.COMPLETELY_ORTHOGONAL));

        assertTrue(property.formula().startsWith("(declare-sort Vector 0)"));
        assertTrue(session.checked().get(0).commands().containsAll(EnvironmentBuilder.domainPreamble()));
    }
}
