/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.compliance;

import ai.evacortex.specproof.core.ast.Document;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeatureRegistryTest {

    @Test
    void referenceRegistry_listsTwentyUniqueFeatures() {
        FeatureRegistry registry = ReferenceFeatures.registry();
        assertEquals(ReferenceFeatures.SPECIFIED, registry.size());
        assertEquals(20, new HashSet<>(registry.names()).size());
        assertEquals("TriVectorDecomposition", registry.names().get(0));
        assertEquals("Sigma512Glossary", registry.names().get(19));
    }

    @Test
    void referenceRegistry_hasOneMissingFeature() {
        Document doc = Document.of("d");
        long implemented = ReferenceFeatures.registry().checks().values().stream()
                .filter(c -> c.check(doc).implemented()).count();
        assertEquals(19, implemented);
        assertFalse(ReferenceFeatures.registry().checks().get("AntiDriftProtocol").check(doc).implemented());
        assertFalse(ReferenceFeatures.registry().checks().get("PocketArchitecture").check(doc).smtVerified());
    }

    @Test
    void duplicateName_isRejected() {
        FeatureRegistry.Builder builder = FeatureRegistry.builder()
                .register("SafetyGate", d -> FeatureCheck.Outcome.verified(""));
        assertThrows(IllegalArgumentException.class,
                () -> builder.register("SafetyGate", d -> FeatureCheck.Outcome.missing("")));
    }

    @Test
    void registrationOrder_isPreserved() {
        FeatureRegistry registry = FeatureRegistry.builder()
                .register("b", d -> FeatureCheck.Outcome.verified(""))
                .register("a", d -> FeatureCheck.Outcome.verified(""))
                .build();
        assertEquals(List.of("b", "a"), registry.names());
        assertEquals("FeatureRegistry[b, a]", registry.toString());
    }
}
