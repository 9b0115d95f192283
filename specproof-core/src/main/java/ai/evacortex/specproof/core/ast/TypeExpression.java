/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.ast;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable type expression of the document type system.
 *
 * <p>Variants:</p>
 * <ul>
 *     <li>{@link Basic}: a primitive kind or a reference to a custom type by name</li>
 *     <li>{@link SetOf}: {@code 𝒫(T)}</li>
 *     <li>{@link Union}: {@code T₁ ∪ … ∪ Tₙ}</li>
 *     <li>{@link Product}: {@code T₁ × … × Tₙ}</li>
 *     <li>{@link FunctionType}: {@code (T₁, …, Tₙ) → R}</li>
 * </ul>
 */
public sealed interface TypeExpression
        permits TypeExpression.Basic, TypeExpression.SetOf, TypeExpression.Union,
                TypeExpression.Product, TypeExpression.FunctionType {

    enum BasicKind { NATURAL, INTEGER, REAL, BOOLEAN, STRING, SYMBOL, CUSTOM }

    /**
     * Collects every custom type name referenced by this expression, transitively.
     */
    default Set<String> referencedNames() {
        Set<String> names = new LinkedHashSet<>();
        collectNames(this, names);
        return names;
    }

    private static void collectNames(TypeExpression expr, Set<String> out) {
        if (expr instanceof Basic basic) {
            if (basic.kind() == BasicKind.CUSTOM) out.add(basic.customName());
        } else if (expr instanceof SetOf set) {
            collectNames(set.element(), out);
        } else if (expr instanceof Union union) {
            union.members().forEach(m -> collectNames(m, out));
        } else if (expr instanceof Product product) {
            product.components().forEach(c -> collectNames(c, out));
        } else if (expr instanceof FunctionType fn) {
            fn.params().forEach(p -> collectNames(p, out));
            collectNames(fn.returnType(), out);
        }
    }

    static Basic natural()  { return new Basic(BasicKind.NATURAL, null); }
    static Basic integer()  { return new Basic(BasicKind.INTEGER, null); }
    static Basic real()     { return new Basic(BasicKind.REAL, null); }
    static Basic bool()     { return new Basic(BasicKind.BOOLEAN, null); }
    static Basic string()   { return new Basic(BasicKind.STRING, null); }
    static Basic symbol()   { return new Basic(BasicKind.SYMBOL, null); }
    static Basic custom(String name) { return new Basic(BasicKind.CUSTOM, name); }

    record Basic(BasicKind kind, String customName) implements TypeExpression {
        public Basic {
            Objects.requireNonNull(kind, "kind must not be null");
            if (kind == BasicKind.CUSTOM && (customName == null || customName.isBlank())) {
                throw new IllegalArgumentException("custom type requires a name");
            }
            if (kind != BasicKind.CUSTOM) customName = null;
        }
    }

    record SetOf(TypeExpression element) implements TypeExpression {
        public SetOf {
            Objects.requireNonNull(element, "element must not be null");
        }
    }

    record Union(List<TypeExpression> members) implements TypeExpression {
        public Union {
            members = List.copyOf(members);
        }
    }

    record Product(List<TypeExpression> components) implements TypeExpression {
        public Product {
            components = List.copyOf(components);
        }
    }

    record FunctionType(List<TypeExpression> params, TypeExpression returnType) implements TypeExpression {
        public FunctionType {
            params = List.copyOf(params);
            Objects.requireNonNull(returnType, "returnType must not be null");
        }
    }
}
