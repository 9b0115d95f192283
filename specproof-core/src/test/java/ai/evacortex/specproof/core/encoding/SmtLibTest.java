/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.encoding;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SmtLibTest {

    @Test
    void simpleSymbols_areKeptVerbatim() {
        assertEquals("V_H", SmtLib.symbol("V_H"));
        assertEquals("dot_product", SmtLib.symbol("dot_product"));
    }

    @Test
    void reservedWordsAndUnicode_areQuoted() {
        assertEquals("|assert|", SmtLib.symbol("assert"));
        assertEquals("|1st|", SmtLib.symbol("1st"));
        assertEquals("|ψ_g|", SmtLib.symbol("ψ_g"));
    }

    @Test
    void unquotableNames_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> SmtLib.symbol(" "));
        assertThrows(IllegalArgumentException.class, () -> SmtLib.symbol("a|b"));
        assertThrows(IllegalArgumentException.class, () -> SmtLib.symbol("a\\b"));
        assertEquals("|a|b|", SmtLib.quote("a|b"));
    }

    @Test
    void decimal_isPlainAndNeverScientific() {
        assertEquals("0.02", SmtLib.decimal(0.02));
        assertEquals("1.0", SmtLib.decimal(1));
        assertEquals("0.0000704", SmtLib.decimal(7.04e-5));
        assertEquals("(- 1.5)", SmtLib.decimal(-1.5));
        assertThrows(IllegalArgumentException.class, () -> SmtLib.decimal(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> SmtLib.decimal(Double.POSITIVE_INFINITY));
    }
}
