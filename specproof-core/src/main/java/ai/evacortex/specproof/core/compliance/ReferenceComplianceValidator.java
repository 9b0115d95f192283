/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.compliance;

import ai.evacortex.specproof.core.ast.Document;
import ai.evacortex.specproof.core.backend.VerificationBackend;
import ai.evacortex.specproof.core.backend.VerificationBackends;
import ai.evacortex.specproof.core.encoding.Obligation;
import ai.evacortex.specproof.core.encoding.PropertyEncoder;
import ai.evacortex.specproof.core.environment.EnvironmentBuilder;
import ai.evacortex.specproof.core.environment.SolverEnvironment;
import ai.evacortex.specproof.core.model.ProofCertificate;
import ai.evacortex.specproof.core.model.PropertyCategory;
import ai.evacortex.specproof.core.model.PropertyResult;
import ai.evacortex.specproof.core.model.VerifiedProperty;
import ai.evacortex.specproof.core.trivector.OrthogonalityResult;
import ai.evacortex.specproof.core.trivector.OrthogonalityType;
import ai.evacortex.specproof.core.trivector.TriVectorSignal;
import ai.evacortex.specproof.core.trivector.TriVectorValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Checks a document against the reference architecture in four independent phases:
 * <ol>
 *     <li>math foundations: ambiguity bound, pipeline success rates, token efficiency</li>
 *     <li>tri-vector orthogonality of the semantic and structural spaces against the safety space</li>
 *     <li>feature compliance over a {@link FeatureRegistry}</li>
 *     <li>layer contracts and the composition edges between them</li>
 * </ol>
 *
 * <p>A phase that throws is replaced by its conservative fallback and recorded in the issues list;
 * the other phases still run. Solver work goes through a {@link VerificationBackend}, so a disabled
 * backend lowers the score instead of failing the validation.</p>
 *
 * <p>{@link #close()} releases the backend only when the validator opened it; a backend passed in by the
 * caller stays open.</p>
 */
public final class ReferenceComplianceValidator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReferenceComplianceValidator.class);

    static final int[] PIPELINE_STEPS = {1, 5, 10, 20};
    static final double BASELINE_STEP_RATE = 0.62;
    static final double TARGET_STEP_RATE = 0.98;
    static final long MAX_EXECUTION_TOKENS = 10;

    static final String L0 = "L0_Signal";
    static final String L1 = "L1_Pocket";
    static final String L2 = "L2_Intelligence";
    private static final String L0_TO_L1_RULE = "(=> (and stable deterministic) integrity)";
    private static final String L1_TO_L2_RULE = "(=> (and integrity zero_copy) bounded)";
    private static final List<String> LAYER_ATOMS =
            List.of("stable", "deterministic", "integrity", "zero_copy", "bounded");

    private final VerificationBackend backend;
    private final boolean ownsBackend;
    private final FeatureRegistry registry;
    private final EnvironmentBuilder environmentBuilder = new EnvironmentBuilder();
    private final PropertyEncoder encoder = new PropertyEncoder();

    /**
     * Validator on its own backend from {@link VerificationBackends#create()}, released by {@link #close()}.
     */
    public ReferenceComplianceValidator() {
        this(VerificationBackends.create(), ReferenceFeatures.registry(), true);
    }

    public ReferenceComplianceValidator(VerificationBackend backend) {
        this(backend, ReferenceFeatures.registry());
    }

    public ReferenceComplianceValidator(VerificationBackend backend, FeatureRegistry registry) {
        this(backend, registry, false);
    }

    ReferenceComplianceValidator(VerificationBackend backend, FeatureRegistry registry, boolean ownsBackend) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.ownsBackend = ownsBackend;
    }

    @Override
    public void close() {
        if (ownsBackend) backend.close();
    }

    public ReferenceValidationResult validate(Document document, String source, double ambiguity) {
        return validate(document, source, ambiguity, null);
    }

    /**
     * @param document  the document to validate
     * @param source    the document's source text
     * @param ambiguity measured ambiguity {@code 1 - unique_parses/total_parses}
     * @param triVector tri-vector analysis for the orthogonality phase, or {@code null} to assume the
     *                  reference decomposition
     */
    public ReferenceValidationResult validate(Document document, String source, double ambiguity,
                                              TriVectorValidationResult triVector) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(source, "source must not be null");
        long start = System.nanoTime();
        List<String> issues = new ArrayList<>();

        MathFoundationResult math = phase("Math foundations", issues,
                () -> verifyMathFoundations(source, ambiguity), MathFoundationResult::fallback);
        TriVectorOrthogonalityResult orthogonality = phase("Tri-vector", issues,
                () -> verifyOrthogonality(document, triVector), TriVectorOrthogonalityResult::fallback);
        FeatureComplianceResult features = phase("Feature compliance", issues,
                () -> verifyFeatures(document), () -> FeatureComplianceResult.fallback(registry.size()));
        LayerCompositionResult layers = phase("Layer composition", issues,
                this::verifyLayers, LayerCompositionResult::fallback);

        double score = ComplianceScoring.score(math, orthogonality, features, layers);
        ComplianceLevel level = ComplianceScoring.level(score);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;
        log.info("Reference compliance of '{}': {} ({}), {} issues",
                document.header().name(), level, String.format("%.4f", score), issues.size());
        return new ReferenceValidationResult(level, score, math, orthogonality, features, layers, issues, elapsedMs);
    }

    private static <T> T phase(String name, List<String> issues, Supplier<T> body, Supplier<T> fallback) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            log.warn("{} phase failed, using fallback", name, e);
            issues.add(name + " error: " + e.getMessage());
            return fallback.get();
        }
    }

    MathFoundationResult verifyMathFoundations(String source, double ambiguity) {
        if (Double.isNaN(ambiguity)) {
            throw new IllegalArgumentException("ambiguity is not a number");
        }
        double calculated = Math.max(0.0, Math.min(1.0, ambiguity));
        boolean ambiguityVerified = proven(backend.verifyObligation(encoder.ambiguityBound(calculated)));

        List<PipelineProof> pipeline = new ArrayList<>(PIPELINE_STEPS.length);
        for (int steps : PIPELINE_STEPS) {
            pipeline.add(pipelineProof(steps));
        }
        return new MathFoundationResult(ambiguityVerified, calculated, pipeline, tokenEfficiency(source));
    }

    PipelineProof pipelineProof(int steps) {
        double baseline = Math.pow(BASELINE_STEP_RATE, steps);
        double target = Math.pow(TARGET_STEP_RATE, steps);
        double improvement = baseline > 0.0 ? target / baseline : Double.POSITIVE_INFINITY;
        boolean verified = Double.isFinite(improvement)
                && proven(backend.verifyObligation(encoder.pipelineRates(steps, baseline, target, improvement)));
        return new PipelineProof(steps, baseline, target, improvement, verified);
    }

    static TokenEfficiencyResult tokenEfficiency(String source) {
        long compilationTokens = source.getBytes(StandardCharsets.UTF_8).length / 4;
        long executionTokens = 0;
        Double ratio = executionTokens > 0 ? (double) compilationTokens / executionTokens : null;
        return new TokenEfficiencyResult(compilationTokens, executionTokens, ratio,
                executionTokens <= MAX_EXECUTION_TOKENS);
    }

    private TriVectorOrthogonalityResult verifyOrthogonality(Document document, TriVectorValidationResult triVector) {
        SolverEnvironment environment = environmentBuilder.build(document);
        TriVectorSignal signal = triVector != null && triVector.signal() != null
                ? triVector.signal() : TriVectorSignal.standard();
        String semantic = signal.semantic().name();
        String structural = signal.structural().name();
        String safety = signal.safety().name();

        List<ProofCertificate> certificates = new ArrayList<>();
        boolean semanticSafety = disjoint(environment, semantic, safety, triVector, certificates);
        boolean structuralSafety = disjoint(environment, structural, safety, triVector, certificates);
        return new TriVectorOrthogonalityResult(semanticSafety, structuralSafety, true, certificates);
    }

    private boolean disjoint(SolverEnvironment environment, String space1, String space2,
                             TriVectorValidationResult triVector, List<ProofCertificate> certificates) {
        Obligation obligation = encoder.orthogonality(space1, space2, observedType(triVector, space1, space2));
        VerifiedProperty property = backend.verifyObligation(obligation, environment);
        property.certificateIfPresent().ifPresent(certificates::add);
        return proven(property);
    }

    private static OrthogonalityType observedType(TriVectorValidationResult triVector, String space1, String space2) {
        if (triVector != null) {
            for (OrthogonalityResult r : triVector.orthogonalityResults().values()) {
                boolean same = r.space1().equals(space1) && r.space2().equals(space2);
                boolean swapped = r.space1().equals(space2) && r.space2().equals(space1);
                if (same || swapped) {
                    return r.type();
                }
            }
        }
        return OrthogonalityType.COMPLETELY_ORTHOGONAL;
    }

    private FeatureComplianceResult verifyFeatures(Document document) {
        Map<String, FeatureVerificationResult> results = new LinkedHashMap<>();
        int implemented = 0;
        int id = 0;
        for (Map.Entry<String, FeatureCheck> entry : registry.checks().entrySet()) {
            id++;
            FeatureCheck.Outcome outcome = Objects.requireNonNull(entry.getValue().check(document),
                    "feature check returned null: " + entry.getKey());
            if (outcome.implemented()) implemented++;
            results.put(entry.getKey(), new FeatureVerificationResult(id, entry.getKey(), outcome.implemented(),
                    outcome.smtVerified(), outcome.mathematicallyCorrect(), outcome.details()));
        }
        int specified = registry.size();
        double percentage = specified == 0 ? 0.0 : 100.0 * implemented / specified;
        return new FeatureComplianceResult(implemented, specified, percentage, results);
    }

    private LayerCompositionResult verifyLayers() {
        boolean layer0 = proven(backend.verifyObligation(layerContract(L0,
                List.of("stable", "deterministic"),
                "(and stable deterministic)")));
        boolean layer1 = proven(backend.verifyObligation(layerContract(L1,
                List.of("stable", "deterministic", "zero_copy", L0_TO_L1_RULE),
                "(and integrity zero_copy)")));
        boolean layer2 = proven(backend.verifyObligation(layerContract(L2,
                List.of("stable", "deterministic", "zero_copy", L0_TO_L1_RULE, L1_TO_L2_RULE),
                "bounded")));

        List<CompositionProof> edges = List.of(
                compositionEdge(L0, L1, "stable∧deterministic⇒integrity",
                        List.of("stable", "deterministic", L0_TO_L1_RULE), "integrity"),
                compositionEdge(L1, L2, "integrity∧zero_copy⇒bounded",
                        List.of("integrity", "zero_copy", L1_TO_L2_RULE), "bounded"));
        return new LayerCompositionResult(layer0, layer1, layer2, edges);
    }

    private Obligation layerContract(String layer, List<String> facts, String goal) {
        return encoder.contract("layer:" + layer, PropertyCategory.PROTOCOL_COMPLIANCE,
                layer + " contract holds", LAYER_ATOMS, facts, goal);
    }

    private CompositionProof compositionEdge(String from, String to, String enabled, List<String> facts,
                                             String goal) {
        Obligation obligation = encoder.contract("composition:" + from + "->" + to,
                PropertyCategory.PROTOCOL_COMPLIANCE, from + " enables " + enabled + " in " + to,
                LAYER_ATOMS, facts, goal);
        VerifiedProperty edge = backend.verifyObligation(obligation);
        return new CompositionProof(from, to, enabled, proven(edge), edge.certificate());
    }

    private static boolean proven(VerifiedProperty property) {
        return property.result().is(PropertyResult.Kind.PROVEN);
    }
}
