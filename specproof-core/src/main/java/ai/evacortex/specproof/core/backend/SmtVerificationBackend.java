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
import ai.evacortex.specproof.core.encoding.PropertyEncoder;
import ai.evacortex.specproof.core.engine.ResultAggregator;
import ai.evacortex.specproof.core.engine.SolverSession;
import ai.evacortex.specproof.core.engine.VerificationConfig;
import ai.evacortex.specproof.core.engine.VerificationEngine;
import ai.evacortex.specproof.core.environment.EnvironmentBuilder;
import ai.evacortex.specproof.core.environment.SolverEnvironment;
import ai.evacortex.specproof.core.model.PropertyResult;
import ai.evacortex.specproof.core.model.VerificationReport;
import ai.evacortex.specproof.core.model.VerificationStatistics;
import ai.evacortex.specproof.core.model.VerificationStatus;
import ai.evacortex.specproof.core.model.VerifiedProperty;
import ai.evacortex.specproof.core.trivector.TriVectorValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class SmtVerificationBackend implements VerificationBackend {

    private static final Logger log = LoggerFactory.getLogger(SmtVerificationBackend.class);

    private final String name;
    private final VerificationEngine engine;
    private final EnvironmentBuilder environmentBuilder = new EnvironmentBuilder();
    private final PropertyEncoder encoder = new PropertyEncoder();
    private final ResultAggregator aggregator = new ResultAggregator();

    public SmtVerificationBackend(SolverSession session, VerificationConfig config) {
        Objects.requireNonNull(session, "session must not be null");
        this.name = session.backendName();
        this.engine = new VerificationEngine(session, config);
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public PropertyResult verifyFormula(String formula, String propertyId) {
        return engine.verify(formula, propertyId);
    }

    @Override
    public VerifiedProperty verifyObligation(Obligation obligation) {
        return engine.verify(obligation);
    }

    @Override
    public VerifiedProperty verifyObligation(Obligation obligation, SolverEnvironment environment) {
        Objects.requireNonNull(environment, "environment must not be null");
        return engine.verify(obligation, environment.preamble());
    }

    @Override
    public VerificationReport verifyDocument(Document document) {
        return verifyDocument(document, null);
    }

    @Override
    public VerificationReport verifyDocument(Document document, TriVectorValidationResult triVector) {
        Objects.requireNonNull(document, "document must not be null");
        long start = System.nanoTime();
        engine.resetStatistics();
        engine.startRun();

        SolverEnvironment environment = environmentBuilder.build(document);
        List<String> preamble = environment.preamble();
        List<Obligation> obligations = encoder.encodeDocument(document, triVector);

        List<VerifiedProperty> properties = new ArrayList<>(obligations.size());
        for (Obligation obligation : obligations) {
            properties.add(engine.verify(obligation, preamble));
        }
        VerificationStatus status = aggregator.aggregate(properties);

        VerificationStatistics solver = engine.statistics();
        VerificationStatistics statistics = new VerificationStatistics(
                (System.nanoTime() - start) / 1_000_000L, solver.smtQueries(), solver.successfulProofs(),
                solver.counterexamples(), solver.timeouts(), solver.errors(), solver.peakMemoryBytes(),
                solver.solverStatistics());
        log.info("Verified '{}' on {}: {} properties, status {}",
                document.header().name(), name, properties.size(), status.kind());
        return new VerificationReport(status, properties, engine.proofs(), engine.counterexamples(),
                engine.unsatCores(), statistics, engine.diagnostics());
    }

    @Override
    public VerificationStatistics statistics() {
        return engine.statistics();
    }

    @Override
    public void resetStatistics() {
        engine.resetStatistics();
    }

    @Override
    public void close() {
        engine.close();
    }
}
