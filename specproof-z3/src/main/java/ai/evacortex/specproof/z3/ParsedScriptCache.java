/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.z3;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.microsoft.z3.BoolExpr;

import java.util.function.Function;

/**
 * Bounded cache of parsed SMT-LIB bodies. Parsed terms belong to one Z3 context, so each session owns
 * its own cache.
 */
final class ParsedScriptCache {

    static final int DEFAULT_MAXIMUM_SIZE = 256;

    private final Cache<String, BoolExpr[]> cache;

    ParsedScriptCache(int maximumSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    /**
     * Returns the cached terms for {@code body}, parsing on a miss. A parser failure is rethrown and
     * nothing is cached.
     */
    BoolExpr[] get(String body, Function<String, BoolExpr[]> parser) {
        return cache.get(body, parser);
    }

    long hitCount() {
        return cache.stats().hitCount();
    }

    void invalidateAll() {
        cache.invalidateAll();
        cache.cleanUp();
    }
}
