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
import ai.evacortex.specproof.core.engine.SmtScript;
import ai.evacortex.specproof.core.model.PropertyCategory;
import ai.evacortex.specproof.core.trivector.OrthogonalityType;
import ai.evacortex.specproof.core.trivector.SafetyIsolationResult;
import ai.evacortex.specproof.core.trivector.TriVectorFixtures;
import ai.evacortex.specproof.core.trivector.TriVectorSignal;
import ai.evacortex.specproof.core.trivector.TriVectorValidationResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PropertyEncoderTest {

    private final PropertyEncoder encoder = new PropertyEncoder();

    @Test
    void orthogonalityFormula_quantifiesOverBothSpaces() {
        String formula = PropertyEncoder.orthogonalityFormula("V_H", "V_S");
        assertTrue(formula.startsWith("(forall ((v1 Vector) (v2 Vector))"));
        assertTrue(formula.contains("(in_space v1 V_H)"));
        assertTrue(formula.contains("(in_space v2 V_S)"));
        assertTrue(formula.contains("(= (dot_product v1 v2) 0.0)"));
    }

    @Test
    void completeOrthogonality_placesSpacesOnDistinctBlocks() {
        Obligation ob = encoder.orthogonality("V_H", "V_S", OrthogonalityType.COMPLETELY_ORTHOGONAL);

        assertEquals("orthogonality:V_H/V_S", ob.id());
        assertEquals(PropertyCategory.TRI_VECTOR_ORTHOGONALITY, ob.category());
        assertTrue(ob.declarations().contains("(declare-const V_H Space)"));
        assertTrue(ob.declarations().contains("(declare-fun dot_product (Vector Vector) Real)"));
        assertTrue(ob.axioms().contains("(distinct V_H V_S)"));
        assertEquals(PropertyEncoder.orthogonalityFormula("V_H", "V_S"), ob.goal());
    }

    @Test
    void orthogonalityTypes_differOnlyInPlacementFact() {
        Obligation partial = encoder.orthogonality("V_H", "V_L", OrthogonalityType.PARTIALLY_ORTHOGONAL);
        Obligation not = encoder.orthogonality("V_H", "V_L", OrthogonalityType.NOT_ORTHOGONAL);

        assertEquals(2, partial.axioms().size());
        assertEquals(3, not.axioms().size());
        assertEquals("(= V_H V_L)", not.axioms().get(2));
    }

    @Test
    void isolatedSafety_assertsNonInterference() {
        Obligation ob = encoder.safetyIsolation(SafetyIsolationResult.isolatedPreserving("invariants"));

        assertEquals("safety_isolation", ob.id());
        assertEquals(List.of(ob.goal()), ob.axioms());
        assertTrue(ob.goal().contains("(not (affects optimization safety_space))"));
    }

    @Test
    void violations_becomeGroundAffectsFacts() {
        Obligation ob = encoder.safetyIsolation(SafetyIsolationResult.violatedBy("loop unroll", "inline"));

        assertTrue(ob.declarations().contains("(declare-const |loop unroll| Optimization)"));
        assertTrue(ob.declarations().contains("(declare-const inline Optimization)"));
        assertEquals(List.of("(affects |loop unroll| safety_space)", "(affects inline safety_space)"), ob.axioms());
    }

    @Test
    void decomposition_namesTheThreeSpaces() {
        Obligation ob = encoder.decomposition(TriVectorSignal.standard());
        assertEquals("signal_decomposition", ob.id());
        assertTrue(ob.description().contains("V_H ⊕ V_L ⊕ V_S"));
        assertEquals(1, ob.axioms().size());
    }

    @Test
    void triVector_encodesPairsThenSafetyThenDecomposition() {
        List<Obligation> obligations = encoder.triVector(TriVectorFixtures.isolatedStandard());

        assertEquals(List.of("orthogonality:V_H ⊥ V_S", "orthogonality:V_L ⊥ V_S", "safety_isolation",
                "signal_decomposition"), obligations.stream().map(Obligation::id).toList());
    }

    @Test
    void triVectorWithoutSignal_encodesNothing() {
        assertTrue(encoder.triVector(null).isEmpty());
        assertTrue(encoder.triVector(new TriVectorValidationResult(null, null, null)).isEmpty());
        assertTrue(encoder.encodeDocument(Document.of("d"), null).isEmpty());
    }

    @Test
    void ambiguityBound_fixesMeasuredValue() {
        Obligation ob = encoder.ambiguityBound(0.015);
        assertEquals("(< ambiguity 0.02)", ob.goal());
        assertTrue(ob.axioms().contains("(= ambiguity 0.015)"));
    }

    @Test
    void pipelineRates_idCarriesStepCount() {
        Obligation ob = encoder.pipelineRates(10, 0.0084, 0.817, 97.3);
        assertEquals("pipeline_rates:10", ob.id());
        assertTrue(ob.axioms().contains("(= target_rate 0.817)"));
    }

    @Test
    void toScript_tracksAxiomsAndNegatedGoal() {
        Obligation ob = encoder.contract("c", PropertyCategory.CORRECTNESS, "", List.of("a", "b"),
                List.of("a", "(=> a b)"), "b");

        SmtScript script = ob.toScript(List.of("(declare-sort Any 0)"));

        assertEquals(List.of("(declare-sort Any 0)", "(declare-const a Bool)", "(declare-const b Bool)"),
                script.commands());
        assertEquals(List.of("c#axiom-0", "c#axiom-1", "c#negated-goal"),
                script.assertions().stream().map(SmtScript.LabelledAssertion::label).toList());
        assertEquals("(not b)", script.assertions().get(2).formula());
        assertTrue(ob.negatedScript().endsWith("(assert (not b))\n(check-sat)"));
    }

    @Test
    void negatedScript_declaresDomainSortsFirst() {
        String script = encoder.orthogonality("V_H", "V_S", OrthogonalityType.COMPLETELY_ORTHOGONAL).negatedScript();

        assertTrue(script.startsWith("(declare-sort Vector 0)\n(declare-sort Signal 0)\n(declare-sort Any 0)\n"));
        assertTrue(script.contains("(declare-sort Space 0)"));
    }

    @Test
    void triVectorDeclarations_useOnlyReservedNamesAndSpaces() {
        Set<String> spaces = Set.of("V_H", "V_L", "V_S");
        for (Obligation ob : encoder.triVector(TriVectorFixtures.isolatedStandard())) {
            for (String declaration : ob.declarations()) {
                String name = declaration.split(" ")[1];
                if (declaration.startsWith("(declare-sort")) {
                    assertTrue(PropertyEncoder.OBLIGATION_SORTS.contains(name), declaration);
                } else {
                    assertTrue(PropertyEncoder.OBLIGATION_SYMBOLS.contains(name) || spaces.contains(name), declaration);
                }
            }
        }
    }
}
