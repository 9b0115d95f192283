/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.z3;

import ai.evacortex.specproof.core.engine.SmtScript;
import ai.evacortex.specproof.core.engine.SolverAnswer;
import ai.evacortex.specproof.core.engine.SolverSession;
import ai.evacortex.specproof.core.engine.VerificationConfig;
import ai.evacortex.specproof.core.exceptions.FormulaException;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Sort;
import com.microsoft.z3.Statistics;
import com.microsoft.z3.Status;
import com.microsoft.z3.Symbol;
import com.microsoft.z3.Tactic;
import com.microsoft.z3.Z3Exception;
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
 * {@link SolverSession} on a private Z3 {@link Context}.
 *
 * <p>In incremental mode one solver is reused and every check runs inside a push/pop scope. Otherwise a
 * fresh solver is built per check from the configured tactic pipeline, unless proofs or unsat cores are
 * requested: tactic solvers cannot produce both, so those checks run on a plain solver. Every assertion is
 * tracked under its label when unsat cores are enabled.</p>
 */
final class Z3SolverSession implements SolverSession {

    private static final Logger log = LoggerFactory.getLogger(Z3SolverSession.class);

    private static final Symbol[] NO_SYMBOLS = new Symbol[0];
    private static final Sort[] NO_SORTS = new Sort[0];
    private static final FuncDecl<?>[] NO_DECLS = new FuncDecl<?>[0];

    private final Context context;
    private final VerificationConfig config;
    private final ParsedScriptCache parsed = new ParsedScriptCache(ParsedScriptCache.DEFAULT_MAXIMUM_SIZE);
    private final Solver incrementalSolver;
    private boolean closed;

    Z3SolverSession(Context context, VerificationConfig config) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.incrementalSolver = config.incremental() ? configure(context.mkSolver()) : null;
    }

    @Override
    public String backendName() {
        return "z3";
    }

    @Override
    public SolverAnswer check(SmtScript script) {
        Objects.requireNonNull(script, "script must not be null");
        if (closed) throw new IllegalStateException("Z3 session is closed");

        BoolExpr[] assertions = parse(script);
        List<String> labels = labels(script, assertions.length);

        Solver solver = incrementalSolver != null ? incrementalSolver : configure(newTacticSolver());
        if (incrementalSolver != null) solver.push();
        try {
            for (int i = 0; i < assertions.length; i++) {
                if (config.generateUnsatCores()) {
                    solver.assertAndTrack(assertions[i], context.mkBoolConst(labels.get(i)));
                } else {
                    solver.add(assertions[i]);
                }
            }
            Status status = solver.check();
            Map<String, String> statistics = statistics(solver);
            log.debug("Z3 answered {} for '{}'", status, script.name());

            switch (status) {
                case UNSATISFIABLE:
                    return SolverAnswer.unsat(proof(solver, script), core(solver), statistics);
                case SATISFIABLE:
                    return SolverAnswer.sat(model(solver, script, labels), statistics);
                default:
                    return SolverAnswer.unknown(solver.getReasonUnknown(), statistics);
            }
        } finally {
            if (incrementalSolver != null) solver.pop();
        }
    }

    private BoolExpr[] parse(SmtScript script) {
        String body = script.body();
        if (body.isEmpty()) return new BoolExpr[0];
        try {
            return parsed.get(body, text -> context.parseSMTLIB2String(text, NO_SYMBOLS, NO_SORTS, NO_SYMBOLS, NO_DECLS));
        } catch (Z3Exception e) {
            throw new FormulaException(script.name() + ": " + e.getMessage(), e);
        }
    }

    private static List<String> labels(SmtScript script, int parsedCount) {
        int tracked = script.assertions().size();
        int untracked = parsedCount - tracked;
        if (untracked < 0) {
            throw new FormulaException(script.name() + ": expected " + tracked + " assertions, parsed " + parsedCount);
        }
        List<String> labels = new ArrayList<>(parsedCount);
        for (int i = 0; i < untracked; i++) {
            labels.add(script.name() + "#assert-" + i);
        }
        for (SmtScript.LabelledAssertion assertion : script.assertions()) {
            labels.add(assertion.label());
        }
        return labels;
    }

    private SolverAnswer.Proof proof(Solver solver, SmtScript script) {
        if (!config.generateProofs()) return null;
        try {
            Expr<?> proof = solver.getProof();
            return proof == null ? null : Z3ProofDecoder.decode(proof);
        } catch (Z3Exception e) {
            log.warn("Could not extract proof for '{}': {}", script.name(), e.getMessage());
            return null;
        }
    }

    private List<String> core(Solver solver) {
        if (!config.generateUnsatCores()) return List.of();
        List<String> names = new ArrayList<>();
        for (BoolExpr literal : solver.getUnsatCore()) {
            names.add(literal.getFuncDecl().getName().toString());
        }
        return names;
    }

    private SolverAnswer.Model model(Solver solver, SmtScript script, List<String> labels) {
        if (!config.generateModels()) return null;
        try {
            Set<String> hidden = config.generateUnsatCores() ? new HashSet<>(labels) : Set.of();
            return Z3ModelDecoder.decode(solver.getModel(), hidden);
        } catch (Z3Exception e) {
            log.warn("Could not extract model for '{}': {}", script.name(), e.getMessage());
            return null;
        }
    }

    private static Map<String, String> statistics(Solver solver) {
        Map<String, String> out = new LinkedHashMap<>();
        try {
            for (Statistics.Entry entry : solver.getStatistics().getEntries()) {
                out.put(entry.Key, entry.getValueString());
            }
        } catch (Z3Exception e) {
            log.debug("Z3 statistics unavailable: {}", e.getMessage());
        }
        return out;
    }

    private Solver newTacticSolver() {
        List<String> names = config.solverTactics();
        if (names.isEmpty()) return context.mkSolver();
        if (config.generateProofs() || config.generateUnsatCores()) {
            log.debug("Tactic pipeline {} skipped: proofs or unsat cores requested", names);
            return context.mkSolver();
        }
        if (names.size() == 1) return context.mkSolver(context.mkTactic(names.get(0)));
        Tactic[] rest = new Tactic[names.size() - 2];
        for (int i = 2; i < names.size(); i++) {
            rest[i - 2] = context.mkTactic(names.get(i));
        }
        return context.mkSolver(context.andThen(context.mkTactic(names.get(0)), context.mkTactic(names.get(1)), rest));
    }

    private Solver configure(Solver solver) {
        Params params = context.mkParams();
        params.add("timeout", (int) Math.min(Integer.MAX_VALUE, config.queryTimeoutMs()));
        solver.setParameters(params);
        if (config.randomSeed() != null) {
            Params seed = context.mkParams();
            seed.add("random_seed", (int) (config.randomSeed() & 0x7fffffffL));
            try {
                solver.setParameters(seed);
            } catch (Z3Exception e) {
                log.warn("Solver rejected random_seed, running unseeded: {}", e.getMessage());
            }
        }
        return solver;
    }

    @Override
    public void reset() {
        if (closed) return;
        parsed.invalidateAll();
        if (incrementalSolver != null) incrementalSolver.reset();
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        parsed.invalidateAll();
        context.close();
    }
}
