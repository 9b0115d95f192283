/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.compliance;

import java.util.List;

public record LayerCompositionResult(boolean layer0,
                                     boolean layer1,
                                     boolean layer2,
                                     List<CompositionProof> compositionProofs) {

    public LayerCompositionResult {
        compositionProofs = compositionProofs == null ? List.of() : List.copyOf(compositionProofs);
    }

    public int verifiedLayers() {
        return (layer0 ? 1 : 0) + (layer1 ? 1 : 0) + (layer2 ? 1 : 0);
    }

    static LayerCompositionResult fallback() {
        return new LayerCompositionResult(false, false, false, List.of());
    }
}
