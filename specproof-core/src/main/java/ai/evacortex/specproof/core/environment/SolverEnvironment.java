/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.environment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sort and function registries derived from one document, in declaration order.
 *
 * <p>Instances are immutable and owned by the engine run that built them.</p>
 */
public final class SolverEnvironment {

    private final Map<String, SortDeclaration> sorts;
    private final Map<String, FunctionDeclaration> functions;

    SolverEnvironment(Map<String, SortDeclaration> sorts, Map<String, FunctionDeclaration> functions) {
        this.sorts = Collections.unmodifiableMap(new LinkedHashMap<>(sorts));
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
    }

    public Map<String, SortDeclaration> sorts() {
        return sorts;
    }

    public Map<String, FunctionDeclaration> functions() {
        return functions;
    }

    public boolean hasSort(String name) {
        return sorts.containsKey(name);
    }

    public Optional<SortDeclaration> sort(String name) {
        return Optional.ofNullable(sorts.get(name));
    }

    public Optional<FunctionDeclaration> function(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    /**
     * SMT-LIB commands declaring every non-builtin sort followed by every function.
     */
    public List<String> preamble() {
        List<String> lines = new ArrayList<>();
        for (SortDeclaration sort : sorts.values()) {
            sort.render().ifPresent(lines::add);
        }
        for (FunctionDeclaration function : functions.values()) {
            lines.add(function.render());
        }
        return List.copyOf(lines);
    }

    @Override
    public String toString() {
        return "SolverEnvironment{sorts=" + sorts.keySet() + ", functions=" + functions.keySet() + '}';
    }
}
