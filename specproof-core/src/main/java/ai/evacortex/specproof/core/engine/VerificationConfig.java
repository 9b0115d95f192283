/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.engine;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Configuration of a verification run.
 *
 * @param queryTimeoutMs     per-query solver timeout; a query that exceeds it yields {@code UNKNOWN}
 * @param incremental        reuse one solver with push/pop scopes instead of a tactic-built solver per query
 * @param generateProofs     request proof objects for unsatisfiable checks
 * @param generateModels     request models for satisfiable checks
 * @param generateUnsatCores request unsat cores for unsatisfiable checks
 * @param solverTactics      ordered tactic names composed with {@code and-then} in non-incremental mode
 * @param maxMemoryMb        solver memory cap
 * @param randomSeed         deterministic solver seed, {@code null} for the solver default
 * @param workerCount        batch runner thread count
 * @param parallel           whether the batch runner uses a thread pool
 * @param totalTimeoutMs     run deadline, {@code 0} for unbounded
 */
public record VerificationConfig(long queryTimeoutMs,
                                 boolean incremental,
                                 boolean generateProofs,
                                 boolean generateModels,
                                 boolean generateUnsatCores,
                                 List<String> solverTactics,
                                 int maxMemoryMb,
                                 Long randomSeed,
                                 int workerCount,
                                 boolean parallel,
                                 long totalTimeoutMs) {

    public static final long DEFAULT_QUERY_TIMEOUT_MS = 30_000L;
    public static final List<String> DEFAULT_TACTICS = List.of("simplify", "solve-eqs", "smt");
    public static final int DEFAULT_MAX_MEMORY_MB = 4096;
    public static final long DEFAULT_RANDOM_SEED = 42L;
    public static final int DEFAULT_WORKER_COUNT = 2;

    public VerificationConfig {
        if (queryTimeoutMs <= 0) throw new IllegalArgumentException("queryTimeoutMs must be > 0");
        if (maxMemoryMb <= 0) throw new IllegalArgumentException("maxMemoryMb must be > 0");
        if (workerCount <= 0) throw new IllegalArgumentException("workerCount must be > 0");
        if (totalTimeoutMs < 0) throw new IllegalArgumentException("totalTimeoutMs must be >= 0");
        solverTactics = solverTactics == null ? DEFAULT_TACTICS : List.copyOf(solverTactics);
        for (String tactic : solverTactics) {
            Objects.requireNonNull(tactic, "tactic must not be null");
        }
    }

    public static VerificationConfig defaults() {
        return builder().build();
    }

    /**
     * Defaults overridden by {@code specproof.*} system properties, e.g.
     * {@code -Dspecproof.queryTimeoutMs=5000 -Dspecproof.solverTactics=simplify,smt}.
     */
    public static VerificationConfig fromSystemProperties() {
        Builder b = builder()
                .queryTimeoutMs(Long.getLong("specproof.queryTimeoutMs", DEFAULT_QUERY_TIMEOUT_MS))
                .incremental(Boolean.parseBoolean(System.getProperty("specproof.incremental", "true")))
                .generateProofs(Boolean.parseBoolean(System.getProperty("specproof.generateProofs", "true")))
                .generateModels(Boolean.parseBoolean(System.getProperty("specproof.generateModels", "true")))
                .generateUnsatCores(Boolean.parseBoolean(System.getProperty("specproof.generateUnsatCores", "true")))
                .maxMemoryMb(Integer.getInteger("specproof.maxMemoryMb", DEFAULT_MAX_MEMORY_MB))
                .randomSeed(Long.getLong("specproof.randomSeed", DEFAULT_RANDOM_SEED))
                .workerCount(Integer.getInteger("specproof.workerCount", DEFAULT_WORKER_COUNT))
                .parallel(Boolean.parseBoolean(System.getProperty("specproof.parallel", "false")))
                .totalTimeoutMs(Long.getLong("specproof.totalTimeoutMs", 0L));
        String tactics = System.getProperty("specproof.solverTactics");
        if (tactics != null && !tactics.isBlank()) {
            b.solverTactics(Arrays.stream(tactics.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList());
        }
        return b.build();
    }

    public boolean hasDeadline() {
        return totalTimeoutMs > 0;
    }

    public Builder toBuilder() {
        return new Builder()
                .queryTimeoutMs(queryTimeoutMs)
                .incremental(incremental)
                .generateProofs(generateProofs)
                .generateModels(generateModels)
                .generateUnsatCores(generateUnsatCores)
                .solverTactics(solverTactics)
                .maxMemoryMb(maxMemoryMb)
                .randomSeed(randomSeed)
                .workerCount(workerCount)
                .parallel(parallel)
                .totalTimeoutMs(totalTimeoutMs);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long queryTimeoutMs = DEFAULT_QUERY_TIMEOUT_MS;
        private boolean incremental = true;
        private boolean generateProofs = true;
        private boolean generateModels = true;
        private boolean generateUnsatCores = true;
        private List<String> solverTactics = DEFAULT_TACTICS;
        private int maxMemoryMb = DEFAULT_MAX_MEMORY_MB;
        private Long randomSeed = DEFAULT_RANDOM_SEED;
        private int workerCount = DEFAULT_WORKER_COUNT;
        private boolean parallel = false;
        private long totalTimeoutMs = 0L;

        private Builder() {
        }

        public Builder queryTimeoutMs(long v) { this.queryTimeoutMs = v; return this; }
        public Builder incremental(boolean v) { this.incremental = v; return this; }
        public Builder generateProofs(boolean v) { this.generateProofs = v; return this; }
        public Builder generateModels(boolean v) { this.generateModels = v; return this; }
        public Builder generateUnsatCores(boolean v) { this.generateUnsatCores = v; return this; }
        public Builder solverTactics(List<String> v) { this.solverTactics = v; return this; }
        public Builder maxMemoryMb(int v) { this.maxMemoryMb = v; return this; }
        public Builder randomSeed(Long v) { this.randomSeed = v; return this; }
        public Builder workerCount(int v) { this.workerCount = v; return this; }
        public Builder parallel(boolean v) { this.parallel = v; return this; }
        public Builder totalTimeoutMs(long v) { this.totalTimeoutMs = v; return this; }

        public VerificationConfig build() {
            return new VerificationConfig(queryTimeoutMs, incremental, generateProofs, generateModels,
                    generateUnsatCores, solverTactics, maxMemoryMb, randomSeed, workerCount, parallel,
                    totalTimeoutMs);
        }
    }
}
