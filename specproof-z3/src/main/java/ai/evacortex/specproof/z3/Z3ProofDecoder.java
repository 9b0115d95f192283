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
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.enumerations.Z3_decl_kind;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeMap;

/**
 * Walks a Z3 proof term as a DAG and summarises it: distinct inference steps, a histogram of rule names and
 * the asserted premises.
 */
final class Z3ProofDecoder {

    static final int MAX_CONTENT_CHARS = 1 << 16;

    private static final String PROOF_KIND_PREFIX = "Z3_OP_PR_";

    private Z3ProofDecoder() {
    }

    static SolverAnswer.Proof decode(Expr<?> proof) {
        TreeMap<String, Integer> rules = new TreeMap<>();
        Set<String> premises = new LinkedHashSet<>();
        Set<Integer> seen = new HashSet<>();
        Deque<Expr<?>> pending = new ArrayDeque<>();
        pending.push(proof);
        int steps = 0;

        while (!pending.isEmpty()) {
            Expr<?> node = pending.pop();
            if (!isProofStep(node) || !seen.add(node.getId())) {
                continue;
            }
            steps++;
            FuncDecl<?> decl = node.getFuncDecl();
            rules.merge(decl.getName().toString(), 1, Integer::sum);

            Expr<?>[] args = node.getArgs();
            if (args.length == 0) continue;
            if (decl.getDeclKind() == Z3_decl_kind.Z3_OP_PR_ASSERTED) {
                premises.add(args[args.length - 1].toString());
            }
            // the last argument is the conclusion, the others are sub-proofs
            for (int i = 0; i < args.length - 1; i++) {
                pending.push(args[i]);
            }
        }

        return new SolverAnswer.Proof(truncate(proof.toString()), steps, rules, premises.stream().toList(),
                concludesFalse(proof));
    }

    private static boolean isProofStep(Expr<?> node) {
        return node.isApp() && node.getFuncDecl().getDeclKind().name().startsWith(PROOF_KIND_PREFIX);
    }

    private static boolean concludesFalse(Expr<?> proof) {
        if (!isProofStep(proof)) return false;
        Expr<?>[] args = proof.getArgs();
        return args.length > 0 && args[args.length - 1].isFalse();
    }

    private static String truncate(String text) {
        return text.length() <= MAX_CONTENT_CHARS ? text : text.substring(0, MAX_CONTENT_CHARS) + "...";
    }
}
