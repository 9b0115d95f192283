/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.z3;

import ai.evacortex.specproof.core.engine.SolverAnswer;
import ai.evacortex.specproof.core.model.FunctionInterpretation;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.FuncInterp;
import com.microsoft.z3.Model;
import com.microsoft.z3.Sort;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts a Z3 model into constant assignments and finite function interpretations, rendered as SMT-LIB
 * terms. Constants in {@code hidden} (assertion tracking literals) are left out.
 */
final class Z3ModelDecoder {

    private Z3ModelDecoder() {
    }

    static SolverAnswer.Model decode(Model model, Set<String> hidden) {
        Map<String, String> constants = new LinkedHashMap<>();
        for (FuncDecl<?> decl : model.getConstDecls()) {
            String name = decl.getName().toString();
            if (hidden.contains(name)) continue;
            Expr<?> value = model.getConstInterp(decl);
            constants.put(name, value == null ? "?" : value.toString());
        }

        Map<String, FunctionInterpretation> functions = new LinkedHashMap<>();
        for (FuncDecl<?> decl : model.getFuncDecls()) {
            FuncInterp<?> interp = model.getFuncInterp(decl);
            if (interp == null) continue;
            String name = decl.getName().toString();
            functions.put(name, new FunctionInterpretation(name, sortNames(decl.getDomain()),
                    decl.getRange().toString(), entries(interp), render(interp.getElse())));
        }
        return new SolverAnswer.Model(constants, functions);
    }

    private static List<FunctionInterpretation.Entry> entries(FuncInterp<?> interp) {
        List<FunctionInterpretation.Entry> out = new ArrayList<>();
        for (FuncInterp.Entry<?> entry : interp.getEntries()) {
            List<String> args = new ArrayList<>();
            for (Expr<?> arg : entry.getArgs()) {
                args.add(arg.toString());
            }
            out.add(new FunctionInterpretation.Entry(args, entry.getValue().toString()));
        }
        return out;
    }

    private static List<String> sortNames(Sort[] sorts) {
        List<String> names = new ArrayList<>(sorts.length);
        for (Sort sort : sorts) {
            names.add(sort.toString());
        }
        return names;
    }

    private static String render(Expr<?> expr) {
        return expr == null ? null : expr.toString();
    }
}
