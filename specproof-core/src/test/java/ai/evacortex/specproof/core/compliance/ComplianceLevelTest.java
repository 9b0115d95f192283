/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.compliance;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ComplianceLevelTest {

    @Test
    void tierBoundaries_areInclusive() {
        assertEquals(ComplianceLevel.PERFECT, ComplianceLevel.fromScore(1.0));
        assertEquals(ComplianceLevel.HIGH, ComplianceLevel.fromScore(0.85));
        assertEquals(ComplianceLevel.PARTIAL, ComplianceLevel.fromScore(0.60));
        assertEquals(ComplianceLevel.LOW, ComplianceLevel.fromScore(0.30));
    }

    @Test
    void scoresBetweenBoundaries_fallToLowerTier() {
        assertEquals(ComplianceLevel.HIGH, ComplianceLevel.fromScore(0.95));
        assertEquals(ComplianceLevel.HIGH, ComplianceLevel.fromScore(0.9));
        assertEquals(ComplianceLevel.PARTIAL, ComplianceLevel.fromScore(0.8499));
        assertEquals(ComplianceLevel.LOW, ComplianceLevel.fromScore(0.59));
        assertEquals(ComplianceLevel.FAILED, ComplianceLevel.fromScore(0.05));
        assertEquals(ComplianceLevel.FAILED, ComplianceLevel.fromScore(0.0));
    }
}
