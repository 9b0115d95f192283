/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.compliance;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param results feature name to its result, in registry order
 */
public record FeatureComplianceResult(int implemented,
                                      int specified,
                                      double percentage,
                                      Map<String, FeatureVerificationResult> results) {

    public FeatureComplianceResult {
        results = results == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    static FeatureComplianceResult fallback(int specified) {
        return new FeatureComplianceResult(0, specified, 0.0, Map.of());
    }
}
