/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.engine;

import ai.evacortex.specproof.core.exceptions.SpecProofException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a {@link VerificationConfig} from JSON. Missing keys keep their defaults, unknown keys are ignored
 * and an explicit {@code null} seed disables seeding.
 */
public final class ConfigLoader {

    private final ObjectMapper mapper = new ObjectMapper();

    public VerificationConfig load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new SpecProofException("Failed to load verification config from " + path, e);
        }
    }

    public VerificationConfig load(InputStream in) {
        try {
            return fromTree(mapper.readTree(in));
        } catch (IOException e) {
            throw new SpecProofException("Failed to parse verification config", e);
        }
    }

    public VerificationConfig fromJson(String json) {
        try {
            return fromTree(mapper.readTree(json));
        } catch (IOException e) {
            throw new SpecProofException("Failed to parse verification config", e);
        }
    }

    private static VerificationConfig fromTree(JsonNode root) {
        VerificationConfig.Builder b = VerificationConfig.builder();
        if (root == null || root.isMissingNode() || root.isNull()) {
            return b.build();
        }
        if (!root.isObject()) {
            throw new SpecProofException("Verification config must be a JSON object");
        }
        if (root.has("queryTimeoutMs")) b.queryTimeoutMs(root.get("queryTimeoutMs").asLong());
        if (root.has("incremental")) b.incremental(root.get("incremental").asBoolean());
        if (root.has("generateProofs")) b.generateProofs(root.get("generateProofs").asBoolean());
        if (root.has("generateModels")) b.generateModels(root.get("generateModels").asBoolean());
        if (root.has("generateUnsatCores")) b.generateUnsatCores(root.get("generateUnsatCores").asBoolean());
        if (root.has("maxMemoryMb")) b.maxMemoryMb(root.get("maxMemoryMb").asInt());
        if (root.has("workerCount")) b.workerCount(root.get("workerCount").asInt());
        if (root.has("parallel")) b.parallel(root.get("parallel").asBoolean());
        if (root.has("totalTimeoutMs")) b.totalTimeoutMs(root.get("totalTimeoutMs").asLong());
        if (root.has("randomSeed")) {
            JsonNode seed = root.get("randomSeed");
            b.randomSeed(seed.isNull() ? null : seed.asLong());
        }
        JsonNode tactics = root.get("solverTactics");
        if (tactics != null && tactics.isArray()) {
            List<String> names = new ArrayList<>();
            tactics.forEach(t -> names.add(t.asText()));
            b.solverTactics(names);
        }
        try {
            return b.build();
        } catch (IllegalArgumentException e) {
            throw new SpecProofException("Invalid verification config: " + e.getMessage(), e);
        }
    }
}
