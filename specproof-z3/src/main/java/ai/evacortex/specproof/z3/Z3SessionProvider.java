/*
 * SpecProof — Formal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.specproof.z3;

import ai.evacortex.specproof.core.engine.SolverSession;
import ai.evacortex.specproof.core.engine.SolverSessionProvider;
import ai.evacortex.specproof.core.engine.VerificationConfig;
import ai.evacortex.specproof.core.exceptions.BackendUnavailableException;
import com.microsoft.z3.Context;
import com.microsoft.z3.Global;
import com.microsoft.z3.Version;
import com.microsoft.z3.Z3Exception;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Z3 backend, registered in {@code META-INF/services}. Available when the Z3 native library loads.
 */
public final class Z3SessionProvider implements SolverSessionProvider {

    private static final Logger log = LoggerFactory.getLogger(Z3SessionProvider.class);

    private static final class NativeProbe {
        static final boolean AVAILABLE = probe();

        private static boolean probe() {
            try (Context ignored = new Context()) {
                log.debug("Z3 native library loaded: {}", Version.getFullVersion());
                return true;
            } catch (LinkageError | Z3Exception e) {
                log.info("Z3 native library unavailable: {}", e.toString());
                return false;
            }
        }
    }

    /**
     * Whether the Z3 native library can be loaded in this JVM. Probed once.
     */
    public static boolean nativeAvailable() {
        return NativeProbe.AVAILABLE;
    }

    @Override
    public String name() {
        return "z3";
    }

    @Override
    public boolean isAvailable() {
        return nativeAvailable();
    }

    @Override
    public SolverSession open(VerificationConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        if (!nativeAvailable()) {
            throw new BackendUnavailableException("Z3 native library could not be loaded");
        }
        Map<String, String> settings = new HashMap<>();
        settings.put("proof", Boolean.toString(config.generateProofs()));
        settings.put("model", Boolean.toString(config.generateModels()));
        settings.put("unsat_core", Boolean.toString(config.generateUnsatCores()));
        settings.put("timeout", Long.toString(config.queryTimeoutMs()));

        Context context = null;
        try {
            // memory_max_size is a process-wide Z3 parameter
            Global.setParameter("memory_max_size", Integer.toString(config.maxMemoryMb()));
            context = new Context(settings);
            return new Z3SolverSession(context, config);
        } catch (Z3Exception | LinkageError e) {
            if (context != null) context.close();
            throw new BackendUnavailableException("Z3 session could not be opened: " + e.getMessage(), e);
        }
    }
}
