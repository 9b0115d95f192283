/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record TypesBlock(Map<String, TypeDefinition> definitions) implements Block {

    public TypesBlock {
        definitions = definitions == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
    }

    public static TypesBlock of(TypeDefinition... definitions) {
        return of(List.of(definitions));
    }

    public static TypesBlock of(List<TypeDefinition> definitions) {
        Map<String, TypeDefinition> byName = new LinkedHashMap<>();
        for (TypeDefinition def : definitions) {
            byName.put(def.name(), def);
        }
        return new TypesBlock(byName);
    }

    @Override
    public String blockType() {
        return "Types";
    }
}
