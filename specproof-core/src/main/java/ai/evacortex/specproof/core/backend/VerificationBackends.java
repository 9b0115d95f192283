/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.core.backend;

import ai.evacortex.specproof.core.engine.SolverSession;
import ai.evacortex.specproof.core.engine.SolverSessionProvider;
import ai.evacortex.specproof.core.engine.VerificationConfig;
import ai.evacortex.specproof.core.exceptions.BackendUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Factory hiding solver availability. Providers are discovered with {@link ServiceLoader}; the first one
 * reporting itself available is used.
 */
public final class VerificationBackends {

    private static final Logger log = LoggerFactory.getLogger(VerificationBackends.class);

    private VerificationBackends() {
    }

    /**
     * Pure capability query: whether any registered provider can open a session.
     */
    public static boolean isAvailable() {
        return availableProvider().isPresent();
    }

    public static VerificationBackend create() {
        return create(VerificationConfig.defaults());
    }

    /**
     * Working backend when a provider is available and opens successfully, the disabled stand-in otherwise.
     */
    public static VerificationBackend create(VerificationConfig config) {
        Optional<SolverSessionProvider> provider = availableProvider();
        if (provider.isEmpty()) {
            log.info("No SMT backend available, verification disabled");
            return createDisabled();
        }
        return create(config, provider.get());
    }

    public static VerificationBackend create(VerificationConfig config, SolverSessionProvider provider) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(provider, "provider must not be null");
        if (!provider.isAvailable()) {
            log.info("SMT backend '{}' is not available, verification disabled", provider.name());
            return createDisabled();
        }
        try {
            SolverSession session = provider.open(config);
            log.info("Using SMT backend '{}'", provider.name());
            return new SmtVerificationBackend(session, config);
        } catch (BackendUnavailableException e) {
            log.warn("SMT backend '{}' could not be opened, verification disabled", provider.name(), e);
            return createDisabled();
        }
    }

    public static VerificationBackend createDisabled() {
        return new DisabledVerificationBackend();
    }

    private static Optional<SolverSessionProvider> availableProvider() {
        try {
            for (SolverSessionProvider provider : ServiceLoader.load(SolverSessionProvider.class)) {
                if (provider.isAvailable()) {
                    return Optional.of(provider);
                }
            }
        } catch (ServiceConfigurationError e) {
            log.warn("Failed to load SMT backend providers", e);
        }
        return Optional.empty();
    }
}
