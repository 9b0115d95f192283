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
import ai.evacortex.specproof.core.engine.VerificationConfig;
import ai.evacortex.specproof.core.model.DiagnosticLevel;
import ai.evacortex.specproof.core.model.SolverDiagnostic;
import ai.evacortex.specproof.core.model.VerificationReport;
import ai.evacortex.specproof.core.model.VerificationStatus;
import ai.evacortex.specproof.core.trivector.TriVectorValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Verifies independent documents, each on its own backend instance.
 *
 * <p>Reports are returned in input order. A document whose environment cannot be built, or whose backend
 * fails, yields a {@code FAILED} report; a document not finished before the total timeout yields an
 * {@code INCOMPLETE} one. Other documents are unaffected.</p>
 */
public final class ParallelVerificationRunner {

    private static final Logger log = LoggerFactory.getLogger(ParallelVerificationRunner.class);

    public record Job(Document document, TriVectorValidationResult triVector) {
        public Job {
            Objects.requireNonNull(document, "document must not be null");
        }
    }

    private final VerificationConfig config;
    private final Supplier<VerificationBackend> backendFactory;

    public ParallelVerificationRunner(VerificationConfig config, Supplier<VerificationBackend> backendFactory) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.backendFactory = Objects.requireNonNull(backendFactory, "backendFactory must not be null");
    }

    public List<VerificationReport> verifyDocuments(List<Document> documents) {
        List<Job> jobs = new ArrayList<>(documents.size());
        documents.forEach(d -> jobs.add(new Job(d, null)));
        return verifyAll(jobs);
    }

    public List<VerificationReport> verifyAll(List<Job> jobs) {
        Objects.requireNonNull(jobs, "jobs must not be null");
        long deadline = config.hasDeadline() ? System.nanoTime() + config.totalTimeoutMs() * 1_000_000L : 0L;
        return config.parallel() && jobs.size() > 1 ? runPooled(jobs, deadline) : runSequential(jobs, deadline);
    }

    private List<VerificationReport> runSequential(List<Job> jobs, long deadline) {
        List<VerificationReport> reports = new ArrayList<>(jobs.size());
        for (Job job : jobs) {
            if (deadline != 0L && System.nanoTime() - deadline >= 0) {
                reports.add(timedOut(job));
            } else {
                reports.add(runOne(job));
            }
        }
        return reports;
    }

    private List<VerificationReport> runPooled(List<Job> jobs, long deadline) {
        ExecutorService pool = Executors.newFixedThreadPool(config.workerCount(), new WorkerThreadFactory());
        try {
            List<Future<VerificationReport>> futures = new ArrayList<>(jobs.size());
            for (Job job : jobs) {
                futures.add(pool.submit(() -> runOne(job)));
            }
            List<VerificationReport> reports = new ArrayList<>(jobs.size());
            for (int i = 0; i < jobs.size(); i++) {
                reports.add(await(jobs.get(i), futures.get(i), deadline));
            }
            return reports;
        } finally {
            pool.shutdownNow();
        }
    }

    private VerificationReport await(Job job, Future<VerificationReport> future, long deadline) {
        try {
            if (deadline == 0L) {
                return future.get();
            }
            long remaining = Math.max(0L, deadline - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return timedOut(job);
        } catch (ExecutionException e) {
            return failed(job, e.getCause() == null ? e : e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return failed(job, e);
        }
    }

    private VerificationReport runOne(Job job) {
        try (VerificationBackend backend = backendFactory.get()) {
            return backend.verifyDocument(job.document(), job.triVector());
        } catch (RuntimeException e) {
            return failed(job, e);
        }
    }

    private static VerificationReport failed(Job job, Throwable cause) {
        String name = job.document().header().name();
        log.warn("Verification of '{}' failed", name, cause);
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return VerificationReport.aborted(VerificationStatus.failed(message),
                SolverDiagnostic.of(DiagnosticLevel.ERROR, message, name));
    }

    private VerificationReport timedOut(Job job) {
        String name = job.document().header().name();
        log.warn("Verification of '{}' not finished within {} ms", name, config.totalTimeoutMs());
        return VerificationReport.aborted(VerificationStatus.incomplete(),
                SolverDiagnostic.of(DiagnosticLevel.ERROR,
                        "Total timeout of " + config.totalTimeoutMs() + " ms reached", name));
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "specproof-verifier-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
