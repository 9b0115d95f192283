/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.environment;

import ai.evacortex.specproof.core.encoding.SmtLib;

import java.util.Objects;
import java.util.Optional;

/**
 * @param name   sort name as it appears in the document
 * @param symbol the rendered SMT-LIB symbol
 * @param kind   how the sort is introduced
 * @param target builtin sort an alias stands for, {@code null} otherwise
 */
public record SortDeclaration(String name, String symbol, SortKind kind, String target) {

    public SortDeclaration {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(symbol, "symbol must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == SortKind.ALIAS && target == null) {
            throw new IllegalArgumentException("alias sort requires a target: " + name);
        }
    }

    public static SortDeclaration builtin(String name) {
        return new SortDeclaration(name, name, SortKind.BUILTIN, null);
    }

    public static SortDeclaration alias(String name, String target) {
        return new SortDeclaration(name, SmtLib.symbol(name), SortKind.ALIAS, target);
    }

    public static SortDeclaration uninterpreted(String name) {
        return new SortDeclaration(name, SmtLib.symbol(name), SortKind.UNINTERPRETED, null);
    }

    /**
     * SMT-LIB command introducing this sort; empty for builtin sorts.
     */
    public Optional<String> render() {
        switch (kind) {
            case ALIAS:
                return Optional.of(SmtLib.defineSort(symbol, target));
            case UNINTERPRETED:
                return Optional.of(SmtLib.declareSort(symbol));
            default:
                return Optional.empty();
        }
    }
}
