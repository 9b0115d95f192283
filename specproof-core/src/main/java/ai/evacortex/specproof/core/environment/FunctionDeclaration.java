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

import java.util.List;
import java.util.Objects;

public record FunctionDeclaration(String name, String symbol, List<String> domain, String codomain) {

    public FunctionDeclaration {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(symbol, "symbol must not be null");
        Objects.requireNonNull(codomain, "codomain must not be null");
        domain = List.copyOf(domain);
    }

    public String render() {
        return SmtLib.declareFun(symbol, domain, codomain);
    }
}
