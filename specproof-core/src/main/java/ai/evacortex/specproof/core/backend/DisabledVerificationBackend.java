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
 * Stand-in used when no solver backend can be opened. Never throws and never touches a solver.
 */
public final class DisabledVerificationBackend implements VerificationBackend {

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public String name() {
        return "disabled";
    }

    @Override
    public PropertyResult verifyFormula(String formula, String propertyId) {
        return PropertyResult.unsupported();
    }

    @Override
    public VerifiedProperty verifyObligation(Obligation obligation) {
        return new VerifiedProperty(obligation.id(), obligation.category(), obligation.description(),
                obligation.negatedScript(), PropertyResult.unsupported(), 0L, null);
    }

    @Override
    public VerifiedProperty verifyObligation(Obligation obligation, SolverEnvironment environment) {
        return verifyObligation(obligation);
    }

    @Override
    public VerificationReport verifyDocument(Document document) {
        return VerificationReport.disabled();
    }

    @Override
    public VerificationReport verifyDocument(Document document, TriVectorValidationResult triVector) {
        return VerificationReport.disabled();
    }

    @Override
    public VerificationStatistics statistics() {
        return VerificationStatistics.empty();
    }

    @Override
    public void resetStatistics() {
    }

    @Override
    public void close() {
    }
}
