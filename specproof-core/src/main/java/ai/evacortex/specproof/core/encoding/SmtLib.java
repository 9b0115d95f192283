/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.encoding;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Small helpers for producing SMT-LIB 2 text.
 */
public final class SmtLib {

    private static final Pattern SIMPLE_SYMBOL =
            Pattern.compile("[A-Za-z~!@$%^&*_+=<>.?/\\-][A-Za-z0-9~!@$%^&*_+=<>.?/\\-]*");

    private static final Set<String> RESERVED_WORDS = Set.of(
            "_", "!", "as", "let", "exists", "forall", "match", "par", "assert", "check-sat",
            "declare-sort", "define-sort", "declare-fun", "declare-const", "define-fun", "push", "pop",
            "BINARY", "DECIMAL", "HEXADECIMAL", "NUMERAL", "STRING", "true", "false");

    private SmtLib() {
    }

    public static boolean isSimpleSymbol(String name) {
        return name != null && SIMPLE_SYMBOL.matcher(name).matches() && !RESERVED_WORDS.contains(name);
    }

    /**
     * Renders {@code name} as an SMT-LIB symbol, quoting it with {@code |...|} when it is not a simple symbol.
     *
     * @throws IllegalArgumentException if the name is blank or contains {@code |} or {@code \}
     */
    public static String symbol(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("symbol must not be blank");
        }
        if (isSimpleSymbol(name)) return name;
        if (name.indexOf('|') >= 0 || name.indexOf('\\') >= 0) {
            throw new IllegalArgumentException("symbol cannot be quoted: " + name);
        }
        return "|" + name + "|";
    }

    /**
     * Lenient form of {@link #symbol(String)}: never throws, so a name that cannot be quoted surfaces as a
     * parse error of the formula that uses it.
     */
    public static String quote(String name) {
        return isSimpleSymbol(name) ? name : "|" + name + "|";
    }

    /**
     * Renders a finite double as an SMT-LIB decimal, e.g. {@code 0.0000704} or {@code (- 1.5)}.
     */
    public static String decimal(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("not a finite value: " + value);
        }
        BigDecimal abs = BigDecimal.valueOf(Math.abs(value));
        String plain = abs.toPlainString();
        if (plain.indexOf('.') < 0) plain = plain + ".0";
        return value < 0 ? "(- " + plain + ")" : plain;
    }

    public static String declareConst(String name, String sort) {
        return "(declare-const " + name + " " + sort + ")";
    }

    public static String declareFun(String name, Collection<String> domain, String codomain) {
        return "(declare-fun " + name + " (" + String.join(" ", domain) + ") " + codomain + ")";
    }

    public static String declareSort(String name) {
        return "(declare-sort " + name + " 0)";
    }

    public static String defineSort(String name, String target) {
        return "(define-sort " + name + " () " + target + ")";
    }

    public static String assertion(String formula) {
        return "(assert " + formula + ")";
    }

    public static String not(String formula) {
        return "(not " + formula + ")";
    }
}
