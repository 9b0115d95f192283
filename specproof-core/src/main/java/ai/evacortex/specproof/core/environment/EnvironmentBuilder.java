/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.environment;

import ai.evacortex.specproof.core.ast.Document;
import ai.evacortex.specproof.core.ast.FunctionDefinition;
import ai.evacortex.specproof.core.ast.TypeDefinition;
import ai.evacortex.specproof.core.ast.TypeExpression;
import ai.evacortex.specproof.core.encoding.PropertyEncoder;
import ai.evacortex.specproof.core.encoding.SmtLib;
import ai.evacortex.specproof.core.exceptions.SetupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Translates the type and function declarations of a {@link Document} into a {@link SolverEnvironment}.
 *
 * <p>Mapping rules:</p>
 * <ul>
 *     <li>Natural and Integer definitions become aliases of {@code Int}, Real of {@code Real},
 *         Boolean of {@code Bool}</li>
 *     <li>String, Symbol, Custom and every composite definition become an uninterpreted sort named
 *         after the definition</li>
 *     <li>every function becomes {@code (declare-fun f (Any) Any)}; multi-argument signatures are
 *         not derived from the lambda text</li>
 * </ul>
 *
 * <p>The domain sorts {@code Vector}, {@code Signal} and the placeholder {@code Any} are always declared.
 * Names declared by {@link PropertyEncoder} obligations are reserved. The input document is never
 * modified.</p>
 */
public final class EnvironmentBuilder {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentBuilder.class);

    public static final String VECTOR = "Vector";
    public static final String SIGNAL = "Signal";
    public static final String ANY = "Any";

    private static final List<String> BUILTIN_SORTS = List.of("Int", "Real", "Bool");
    private static final List<String> DOMAIN_SORTS = List.of(VECTOR, SIGNAL, ANY);

    /** Sort names owned by SMT-LIB theories or by the fixed domain preamble. */
    private static final Set<String> RESERVED = Set.of(
            "Int", "Real", "Bool", "String", "RegLan", "Array", "BitVec", "FloatingPoint",
            "RoundingMode", "Float16", "Float32", "Float64", "Float128", "Seq", "Set",
            VECTOR, SIGNAL, ANY);

    /**
     * Declarations of the domain sorts alone, for obligations checked without a document environment.
     */
    public static List<String> domainPreamble() {
        List<String> lines = new ArrayList<>(DOMAIN_SORTS.size());
        for (String name : DOMAIN_SORTS) {
            SortDeclaration.uninterpreted(name).render().ifPresent(lines::add);
        }
        return List.copyOf(lines);
    }

    public SolverEnvironment build(Document document) {
        Objects.requireNonNull(document, "document must not be null");

        Map<String, SortDeclaration> sorts = new LinkedHashMap<>();
        BUILTIN_SORTS.forEach(name -> sorts.put(name, SortDeclaration.builtin(name)));
        DOMAIN_SORTS.forEach(name -> sorts.put(name, SortDeclaration.uninterpreted(name)));

        List<TypeDefinition> types = document.typeDefinitions();
        Set<String> documentTypes = new HashSet<>();
        for (TypeDefinition definition : types) {
            documentTypes.add(definition.name());
        }

        for (TypeDefinition definition : types) {
            String name = definition.name();
            if (RESERVED.contains(name) || PropertyEncoder.OBLIGATION_SORTS.contains(name)) {
                throw new SetupException("type name '" + name + "' collides with a reserved sort");
            }
            if (sorts.containsKey(name)) {
                throw new SetupException("type '" + name + "' is defined more than once");
            }
            for (String referenced : definition.typeExpr().referencedNames()) {
                if (!documentTypes.contains(referenced) && !sorts.containsKey(referenced)) {
                    throw new SetupException("type '" + name + "' references unknown type '" + referenced + "'");
                }
            }
            sorts.put(name, declareType(name, definition.typeExpr()));
        }

        Map<String, FunctionDeclaration> functions = new LinkedHashMap<>();
        for (FunctionDefinition function : document.functionDefinitions()) {
            String name = function.name();
            if (PropertyEncoder.OBLIGATION_SYMBOLS.contains(name)) {
                throw new SetupException("function name '" + name + "' collides with a reserved symbol");
            }
            if (functions.containsKey(name)) {
                throw new SetupException("function '" + name + "' is defined more than once");
            }
            functions.put(name, new FunctionDeclaration(name, render(name), List.of(ANY), ANY));
        }

        SolverEnvironment environment = new SolverEnvironment(sorts, functions);
        log.debug("Built environment for '{}': {} sorts, {} functions",
                document.header().name(), sorts.size(), functions.size());
        return environment;
    }

    private static SortDeclaration declareType(String name, TypeExpression expr) {
        render(name);
        if (expr instanceof TypeExpression.Basic basic) {
            switch (basic.kind()) {
                case NATURAL:
                case INTEGER:
                    return SortDeclaration.alias(name, "Int");
                case REAL:
                    return SortDeclaration.alias(name, "Real");
                case BOOLEAN:
                    return SortDeclaration.alias(name, "Bool");
                default:
                    return SortDeclaration.uninterpreted(name);
            }
        }
        return SortDeclaration.uninterpreted(name);
    }

    private static String render(String name) {
        try {
            return SmtLib.symbol(name);
        } catch (IllegalArgumentException e) {
            throw new SetupException("name '" + name + "' is not a valid SMT-LIB symbol", e);
        }
    }
}
