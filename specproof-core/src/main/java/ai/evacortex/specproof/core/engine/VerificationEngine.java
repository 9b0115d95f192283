/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.engine;

import ai.evacortex.specproof.core.encoding.Obligation;
import ai.evacortex.specproof.core.environment.EnvironmentBuilder;
import ai.evacortex.specproof.core.exceptions.FormulaException;
import ai.evacortex.specproof.core.model.CounterexampleModel;
import ai.evacortex.specproof.core.model.DiagnosticLevel;
import ai.evacortex.specproof.core.model.ProofCertificate;
import ai.evacortex.specproof.core.model.PropertyResult;
import ai.evacortex.specproof.core.model.SolverDiagnostic;
import ai.evacortex.specproof.core.model.UnsatCore;
import ai.evacortex.specproof.core.model.VerificationStatistics;
import ai.evacortex.specproof.core.model.VerifiedProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Decides properties by refutation on one {@link SolverSession}.
 *
 * <p>Decision rule for the negation of a property:</p>
 * <ul>
 *     <li>{@code UNSAT}: the property holds, {@code PROVEN}</li>
 *     <li>{@code SAT}: a counterexample exists, {@code DISPROVEN}</li>
 *     <li>{@code UNKNOWN}: timeout or resource limit, {@code UNKNOWN} (counted as a timeout)</li>
 *     <li>unparsable formula: {@code ERROR}, the batch continues</li>
 * </ul>
 *
 * <p>An engine is single-threaded. Its counters, artifacts and diagnostics belong to it alone and
 * accumulate until {@link #resetStatistics()}.</p>
 */
public final class VerificationEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(VerificationEngine.class);

    private final SolverSession session;
    private final VerificationConfig config;

    private final Map<String, ProofCertificate> proofs = new LinkedHashMap<>();
    private final Map<String, CounterexampleModel> counterexamples = new LinkedHashMap<>();
    private final Map<String, UnsatCore> unsatCores = new LinkedHashMap<>();
    private final List<SolverDiagnostic> diagnostics = new ArrayList<>();
    private final Map<String, String> solverStatistics = new TreeMap<>();

    private int queries;
    private int provenCount;
    private int counterexampleCount;
    private int timeouts;
    private int errors;
    private long solverNanos;
    private long peakMemoryBytes;
    private long deadlineNanos;

    public VerificationEngine(SolverSession session, VerificationConfig config) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        startRun();
    }

    public VerificationConfig config() {
        return config;
    }

    /**
     * Arms the run deadline from {@code totalTimeoutMs}. Counters are left untouched.
     */
    public void startRun() {
        deadlineNanos = config.hasDeadline()
                ? System.nanoTime() + config.totalTimeoutMs() * 1_000_000L
                : 0L;
    }

    /**
     * Checks raw SMT-LIB text whose satisfiability means the property is violated.
     */
    public PropertyResult verify(String formula, String propertyId) {
        Objects.requireNonNull(formula, "formula must not be null");
        Objects.requireNonNull(propertyId, "propertyId must not be null");
        return decide(propertyId, SmtScript.raw(propertyId, formula), null);
    }

    /**
     * Decides an obligation that needs no document environment, on top of the domain sorts.
     */
    public VerifiedProperty verify(Obligation obligation) {
        return verify(obligation, EnvironmentBuilder.domainPreamble());
    }

    /**
     * Asserts the obligation's axioms and negated goal on top of {@code preamble} and decides it.
     */
    public VerifiedProperty verify(Obligation obligation, List<String> preamble) {
        Objects.requireNonNull(obligation, "obligation must not be null");
        Objects.requireNonNull(preamble, "preamble must not be null");
        SmtScript script = obligation.toScript(preamble);
        long start = System.nanoTime();
        PropertyResult result = decide(obligation.id(), script, obligation.goalLabel());
        long elapsed = System.nanoTime() - start;
        ProofCertificate certificate = result.is(PropertyResult.Kind.PROVEN) ? proofs.get(obligation.id()) : null;
        return new VerifiedProperty(obligation.id(), obligation.category(), obligation.description(),
                script.render(), result, elapsed, certificate);
    }

    private PropertyResult decide(String id, SmtScript script, String goalLabel) {
        queries++;
        proofs.remove(id);
        counterexamples.remove(id);
        unsatCores.remove(id);
        if (deadlinePassed()) {
            timeouts++;
            log.warn("Run deadline reached, '{}' left unknown", id);
            diagnostics.add(SolverDiagnostic.of(DiagnosticLevel.PERFORMANCE,
                    "Total timeout of " + config.totalTimeoutMs() + " ms reached before check", id));
            return PropertyResult.unknown();
        }

        log.debug("Checking '{}' ({} assertions)", id, script.assertions().size());
        SolverAnswer answer;
        long start = System.nanoTime();
        try {
            answer = session.check(script);
        } catch (FormulaException e) {
            errors++;
            log.warn("Formula for '{}' rejected: {}", id, e.getMessage());
            diagnostics.add(SolverDiagnostic.of(DiagnosticLevel.ERROR, e.getMessage(), id));
            return PropertyResult.error(e.getMessage());
        } catch (RuntimeException e) {
            errors++;
            log.warn("Solver failed on '{}'", id, e);
            diagnostics.add(SolverDiagnostic.of(DiagnosticLevel.ERROR, "Solver failure: " + e.getMessage(), id));
            return PropertyResult.error("Solver failure: " + e.getMessage());
        } finally {
            solverNanos += System.nanoTime() - start;
            sampleMemory();
        }
        solverStatistics.putAll(answer.statistics());

        switch (answer.status()) {
            case UNSAT:
                provenCount++;
                onUnsat(id, script, goalLabel, answer);
                return PropertyResult.proven();
            case SAT:
                counterexampleCount++;
                onSat(id, script, answer);
                return PropertyResult.disproven();
            default:
                timeouts++;
                String reason = answer.reasonUnknown() == null ? "unknown" : answer.reasonUnknown();
                log.warn("Solver returned unknown for '{}': {}", id, reason);
                diagnostics.add(SolverDiagnostic.of(DiagnosticLevel.WARNING, "Solver returned unknown: " + reason, id));
                return PropertyResult.unknown();
        }
    }

    private void onUnsat(String id, SmtScript script, String goalLabel, SolverAnswer answer) {
        if (config.generateProofs()) {
            SolverAnswer.Proof proof = answer.proof();
            if (proof != null) {
                proofs.put(id, new ProofCertificate("cert-" + id, session.backendName() + "-proof",
                        proof.content(), proof.steps(), proof.rules(), proof.premises(), proof.concludesFalse(),
                        script.fingerprint(), explainProof(id, proof)));
            } else {
                diagnostics.add(SolverDiagnostic.of(DiagnosticLevel.INFO, "Backend produced no proof object", id));
            }
        }
        if (config.generateUnsatCores() && !answer.unsatCore().isEmpty()) {
            List<String> core = answer.unsatCore();
            List<String> suggestions = new ArrayList<>();
            if (goalLabel != null && !core.contains(goalLabel)) {
                log.warn("Proof of '{}' does not use the property itself; axioms are inconsistent", id);
                diagnostics.add(SolverDiagnostic.of(DiagnosticLevel.WARNING,
                        "Vacuous proof: axioms are unsatisfiable without the negated goal", id));
                suggestions.add("Review the axioms listed in the core; they contradict each other");
            }
            unsatCores.put(id, new UnsatCore("core-" + id, core,
                    core.size() + " of " + script.assertions().size() + " tracked assertions are jointly unsatisfiable",
                    suggestions));
        }
    }

    private void onSat(String id, SmtScript script, SolverAnswer answer) {
        if (!config.generateModels()) return;
        SolverAnswer.Model model = answer.model();
        if (model == null) {
            log.warn("No model extracted for disproven '{}'", id);
            counterexamples.put(id, CounterexampleModel.empty("cex-" + id, "Model could not be extracted"));
            return;
        }
        counterexamples.put(id, new CounterexampleModel("cex-" + id, model.constants(), model.functions(),
                script.fingerprint(), "Assignment satisfying the negation of " + id + " ("
                + model.constants().size() + " constants, " + model.functions().size() + " functions)"));
    }

    private static String explainProof(String id, SolverAnswer.Proof proof) {
        StringBuilder sb = new StringBuilder("Negation of ").append(id).append(" refuted in ")
                .append(proof.steps()).append(" steps");
        if (!proof.rules().isEmpty()) {
            sb.append(" using ").append(String.join(", ", proof.rules().keySet()));
        }
        return sb.toString();
    }

    private boolean deadlinePassed() {
        return deadlineNanos != 0L && System.nanoTime() - deadlineNanos >= 0;
    }

    private void sampleMemory() {
        Runtime rt = Runtime.getRuntime();
        peakMemoryBytes = Math.max(peakMemoryBytes, rt.totalMemory() - rt.freeMemory());
    }

    public Map<String, ProofCertificate> proofs() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(proofs));
    }

    public Map<String, CounterexampleModel> counterexamples() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(counterexamples));
    }

    public Map<String, UnsatCore> unsatCores() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(unsatCores));
    }

    public List<SolverDiagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }

    public VerificationStatistics statistics() {
        return new VerificationStatistics(solverNanos / 1_000_000L, queries, provenCount, counterexampleCount,
                timeouts, errors, peakMemoryBytes, solverStatistics);
    }

    /**
     * Clears counters, artifacts and diagnostics and resets the solver.
     */
    public void resetStatistics() {
        queries = 0;
        provenCount = 0;
        counterexampleCount = 0;
        timeouts = 0;
        errors = 0;
        solverNanos = 0L;
        peakMemoryBytes = 0L;
        proofs.clear();
        counterexamples.clear();
        unsatCores.clear();
        diagnostics.clear();
        solverStatistics.clear();
        session.reset();
    }

    @Override
    public void close() {
        session.close();
    }
}
