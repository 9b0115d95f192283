/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.trivector;

import java.util.LinkedHashMap;
import java.util.Map;

public final class TriVectorFixtures {

    private TriVectorFixtures() {
    }

    /**
     * Standard signal with both safety constraints fully orthogonal and the safety space isolated.
     */
    public static TriVectorValidationResult isolatedStandard() {
        return withIsolation(SafetyIsolationResult.isolatedPreserving("safety_invariants"));
    }

    public static TriVectorValidationResult withIsolation(SafetyIsolationResult isolation) {
        Map<String, OrthogonalityResult> pairs = new LinkedHashMap<>();
        pairs.put("V_H ⊥ V_S", new OrthogonalityResult("V_H", "V_S", OrthogonalityType.COMPLETELY_ORTHOGONAL, 1.0));
        pairs.put("V_L ⊥ V_S", new OrthogonalityResult("V_L", "V_S", OrthogonalityType.COMPLETELY_ORTHOGONAL, 1.0));
        return new TriVectorValidationResult(TriVectorSignal.standard(), pairs, isolation);
    }
}
