/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.engine;

import ai.evacortex.specproof.core.model.PropertyCategory;
import ai.evacortex.specproof.core.model.PropertyResult;
import ai.evacortex.specproof.core.model.VerificationStatus;
import ai.evacortex.specproof.core.model.VerifiedProperty;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultAggregatorTest {

    private final ResultAggregator aggregator = new ResultAggregator();

    private static VerifiedProperty property(String id, PropertyResult result) {
        return new VerifiedProperty(id, PropertyCategory.CORRECTNESS, id, "", result, 0L, null);
    }

    @Test
    void noProperties_isIncomplete() {
        assertTrue(aggregator.aggregate(List.of()).is(VerificationStatus.Kind.INCOMPLETE));
    }

    @Test
    void allProven_isAllVerified() {
        VerificationStatus status = aggregator.aggregate(List.of(
                property("a", PropertyResult.proven()), property("b", PropertyResult.proven())));
        assertTrue(status.is(VerificationStatus.Kind.ALL_VERIFIED));
    }

    @Test
    void provenAndUnknown_isPartiallyVerified() {
        VerificationStatus status = aggregator.aggregate(List.of(
                property("a", PropertyResult.proven()), property("b", PropertyResult.unknown())));
        assertTrue(status.is(VerificationStatus.Kind.PARTIALLY_VERIFIED));
    }

    @Test
    void onlyUnknownAndUnsupported_isIncomplete() {
        VerificationStatus status = aggregator.aggregate(List.of(
                property("a", PropertyResult.unknown()), property("b", PropertyResult.unsupported())));
        assertTrue(status.is(VerificationStatus.Kind.INCOMPLETE));
    }

    @Test
    void anyDisproven_failsNamingTheProperty() {
        VerificationStatus status = aggregator.aggregate(List.of(
                property("a", PropertyResult.proven()), property("safety_isolation", PropertyResult.disproven())));
        assertTrue(status.is(VerificationStatus.Kind.FAILED));
        assertEquals("Property 'safety_isolation' disproven", status.reason());
    }

    @Test
    void errorTakesPrecedenceOverDisproven() {
        VerificationStatus status = aggregator.aggregate(List.of(
                property("a", PropertyResult.disproven()), property("b", PropertyResult.error("parse error"))));
        assertTrue(status.is(VerificationStatus.Kind.FAILED));
        assertEquals("Property 'b' errored: parse error", status.reason());
    }
}
