/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.compliance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered, immutable set of named {@link FeatureCheck}s. Names are unique; ids are 1-based positions.
 */
public final class FeatureRegistry {

    private final Map<String, FeatureCheck> checks;

    private FeatureRegistry(Map<String, FeatureCheck> checks) {
        this.checks = Collections.unmodifiableMap(new LinkedHashMap<>(checks));
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return checks.size();
    }

    public List<String> names() {
        return List.copyOf(checks.keySet());
    }

    public Map<String, FeatureCheck> checks() {
        return checks;
    }

    public static final class Builder {
        private final Map<String, FeatureCheck> checks = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(String name, FeatureCheck check) {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(check, "check must not be null");
            if (checks.putIfAbsent(name, check) != null) {
                throw new IllegalArgumentException("Feature already registered: " + name);
            }
            return this;
        }

        public FeatureRegistry build() {
            return new FeatureRegistry(checks);
        }
    }

    @Override
    public String toString() {
        return "FeatureRegistry" + new ArrayList<>(checks.keySet());
    }
}
