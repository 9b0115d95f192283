/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.engine;

/**
 * {@code SolverSession} is a stateful connection to one SMT solver instance.
 *
 * <p>A session is owned by exactly one {@link VerificationEngine} and must never be shared between
 * threads: solver state such as declarations and assertion scopes is mutated in place. Each call to
 * {@link #check(SmtScript)} is a blocking satisfiability query bounded by the configured per-query
 * timeout.</p>
 *
 * <p>Implementations are expected to:</p>
 * <ul>
 *     <li>leave no assertion behind between checks, so results never depend on submission history</li>
 *     <li>report a timeout or resource limit as {@link SatStatus#UNKNOWN}, never as an exception</li>
 *     <li>produce proofs, models and unsat cores only when the session was opened with them enabled</li>
 * </ul>
 *
 * @see SolverSessionProvider
 * @see SmtScript
 */
public interface SolverSession extends AutoCloseable {

    /**
     * Short backend identifier used in certificates and logs, e.g. {@code "z3"}.
     */
    String backendName();

    /**
     * Checks satisfiability of the conjunction of every assertion in {@code script}.
     *
     * @param script declarations and assertions to check
     * @return the three-valued answer with any requested artifacts
     * @throws ai.evacortex.specproof.core.exceptions.FormulaException if the script cannot be parsed
     * @throws NullPointerException if {@code script} is {@code null}
     */
    SolverAnswer check(SmtScript script);

    /**
     * Discards every assertion and scope held by the solver.
     */
    void reset();

    /**
     * Releases native resources. Further calls to {@link #check(SmtScript)} are undefined.
     */
    @Override
    void close();
}
