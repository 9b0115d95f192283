/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.backend;

import ai.evacortex.specproof.core.ast.Document;
import ai.evacortex.specproof.core.encoding.Obligation;
import ai.evacortex.specproof.core.environment.SolverEnvironment;
import ai.evacortex.specproof.core.model.PropertyResult;
import ai.evacortex.specproof.core.model.VerificationReport;
import ai.evacortex.specproof.core.model.VerificationStatistics;
import ai.evacortex.specproof.core.model.VerifiedProperty;
import ai.evacortex.specproof.core.trivector.TriVectorValidationResult;

/**
 * {@code VerificationBackend} is the single entry point for formal verification, independent of whether an
 * SMT solver is actually present at runtime.
 *
 * <p>Exactly two implementations exist:</p>
 * <ul>
 *     <li>{@link SmtVerificationBackend}: decides properties on a live solver session</li>
 *     <li>{@link DisabledVerificationBackend}: answers {@code UNSUPPORTED} per property and a
 *         {@code DISABLED} report per document without ever throwing</li>
 * </ul>
 *
 * <p>Callers obtain an instance through {@link VerificationBackends} and never branch on availability:
 * every method has the same return type in both cases. Instances are not thread-safe; use one per
 * thread.</p>
 *
 * @see VerificationBackends
 */
public interface VerificationBackend extends AutoCloseable {

    /**
     * @return {@code true} if this backend talks to a solver
     */
    boolean isEnabled();

    String name();

    /**
     * Checks raw SMT-LIB text whose satisfiability means the property is violated.
     *
     * @param formula    declarations and assertions; solver commands are ignored
     * @param propertyId identifier used in logs and artifacts
     * @return the decided result, {@code UNSUPPORTED} on a disabled backend
     */
    PropertyResult verifyFormula(String formula, String propertyId);

    /**
     * Decides one obligation without a document environment.
     */
    VerifiedProperty verifyObligation(Obligation obligation);

    /**
     * Decides one obligation on top of the declarations of {@code environment}.
     */
    VerifiedProperty verifyObligation(Obligation obligation, SolverEnvironment environment);

    /**
     * Verifies a document without tri-vector evidence.
     *
     * @throws ai.evacortex.specproof.core.exceptions.SetupException if the solver environment cannot be built
     */
    VerificationReport verifyDocument(Document document);

    /**
     * Builds the document environment, encodes every obligation and decides them in order.
     *
     * @param document  the document to verify, never modified
     * @param triVector tri-vector analysis result, or {@code null}
     * @return a complete report; artifacts cover this run only
     * @throws ai.evacortex.specproof.core.exceptions.SetupException if the solver environment cannot be built
     */
    VerificationReport verifyDocument(Document document, TriVectorValidationResult triVector);

    VerificationStatistics statistics();

    void resetStatistics();

    @Override
    void close();
}
