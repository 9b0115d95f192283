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
 * Service-provider interface for SMT backends, discovered through {@link java.util.ServiceLoader}.
 *
 * <p>A provider describes a backend that may or may not be usable at runtime, e.g. because its native
 * library is missing. {@link #isAvailable()} must be a side-effect free capability query that never
 * throws.</p>
 */
public interface SolverSessionProvider {

    String name();

    /**
     * @return {@code true} if {@link #open(VerificationConfig)} is expected to succeed
     */
    boolean isAvailable();

    /**
     * Opens a new session configured from {@code config}.
     *
     * @throws ai.evacortex.specproof.core.exceptions.BackendUnavailableException if the backend cannot be initialised
     */
    SolverSession open(VerificationConfig config);
}
