package bigo.conductor.service;

import bigo.conductor.classifier.Classifier;
import bigo.conductor.model.Backend;
import bigo.conductor.model.ClassificationResult;
import bigo.conductor.model.Execution;
import bigo.conductor.model.ExecutionResult;
import bigo.conductor.model.ExecutionStatus;
import bigo.conductor.model.RunResult;
import bigo.conductor.model.Task;
import bigo.conductor.model.TaskStatus;
import bigo.conductor.model.Tier;
import bigo.conductor.model.TierConfig;
import bigo.conductor.policy.TierPolicy;
import bigo.conductor.worker.ExecutionContext;
import bigo.conductor.worker.FallbackResolver;
import bigo.conductor.worker.Worker;
import bigo.conductor.worker.WorkerException;
import bigo.conductor.worker.WorkerLease;
import bigo.conductor.worker.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs a task through the pipeline: classify, record, pick a worker, execute,
 * record the attempt, and settle the task status.
 *
 * <pre>
 * pending -> working -> done
 *                    -> validating   (tier needs validators)
 *                    -> failed
 * </pre>
 *
 * A run that finds no worker leaves its task pending.
 */
public class Conductor {

    private static final Logger log = LoggerFactory.getLogger(Conductor.class);

    public static final String MDC_TASK_ID = "taskId";
    static final String NO_WORKER = "no available worker for this task tier";
    static final String CANCELLED = "run cancelled before execution";

    private final TierPolicy policy;
    private final LedgerService ledger;
    private final Classifier classifier;
    private final WorkerRegistry registry;
    private final FallbackResolver resolver;

    public Conductor(TierPolicy policy, LedgerService ledger, Classifier classifier,
            WorkerRegistry registry, FallbackResolver resolver) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public void registerWorker(Worker worker) {
        registry.register(worker);
    }

    public Classifier classifier() {
        return classifier;
    }

    public WorkerRegistry registry() {
        return registry;
    }

    public TierPolicy policy() {
        return policy;
    }

    public RunResult run(ExecutionContext ctx, String title, String description) {
        return run(ctx, title, description, null);
    }

    /**
     * Execute a task end to end.
     *
     * @param forcedTier operator override of the classified tier, or null
     * @return the outcome; worker and business failures are reported here, not thrown
     * @throws bigo.conductor.exception.LedgerException if the ledger cannot be written
     */
    public RunResult run(ExecutionContext ctx, String title, String description, Tier forcedTier) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title is required");
        }
        Instant startedAt = Instant.now();
        ClassificationResult classification = classify(title, description, forcedTier);

        Task task = ledger.createTask(Task.builder()
                .id(LedgerService.newTaskId())
                .title(title)
                .description(description)
                .tier(classification.tier())
                .status(TaskStatus.PENDING)
                .backend(classification.recommendedBackend())
                .build());

        MDC.put(MDC_TASK_ID, task.id());
        try {
            log.info("Classified as {} (confidence {}), recommended {}",
                    classification.tier().label(), String.format("%.2f", classification.confidence()),
                    classification.recommendedBackend());

            RunResult.Builder result = RunResult.builder()
                    .taskId(task.id())
                    .classification(classification)
                    .startedAt(startedAt);

            Optional<WorkerLease> acquired = acquire(classification);
            if (acquired.isEmpty()) {
                log.warn("No worker available for tier {}, task left pending", classification.tier().label());
                return result.status(TaskStatus.FAILED)
                        .error(NO_WORKER)
                        .finishedAt(Instant.now())
                        .build();
            }

            Backend backend;
            Attempt attempt;
            try (WorkerLease lease = acquired.get()) {
                backend = lease.backend();
                result.actualBackend(backend);

                if (ctx.isCancelled()) {
                    ledger.updateTaskStatus(task.id(), TaskStatus.FAILED);
                    log.info("Run cancelled before execution");
                    return result.status(TaskStatus.FAILED)
                            .error(CANCELLED)
                            .finishedAt(Instant.now())
                            .build();
                }

                ledger.updateTaskStatus(task.id(), TaskStatus.WORKING);
                log.debug("Executing on {}", backend);
                attempt = execute(lease, ctx, task.toBuilder().backend(backend).status(TaskStatus.WORKING).build());
            }

            recordExecution(task, backend, attempt);
            result.execution(attempt.result());

            if (attempt.failed()) {
                ledger.updateTaskStatus(task.id(), TaskStatus.FAILED);
                log.warn("Execution on {} failed: {}", backend, attempt.error());
                return result.status(TaskStatus.FAILED)
                        .error(attempt.error())
                        .finishedAt(Instant.now())
                        .build();
            }

            TierConfig tierConfig = policy.config(classification.tier());
            result.validation(tierConfig);
            TaskStatus finalStatus;
            if (tierConfig.requiresValidation()) {
                // validator dispatch is not implemented: the task waits in validating
                finalStatus = TaskStatus.VALIDATING;
                result.validationPending(true);
            } else {
                finalStatus = TaskStatus.DONE;
            }
            ledger.updateTaskStatus(task.id(), finalStatus);

            log.info("Run finished on {}: {} in {} ms, cost ${}", backend, finalStatus,
                    attempt.durationMs(), String.format("%.4f", attempt.result().costUsd()));
            return result.status(finalStatus)
                    .finishedAt(Instant.now())
                    .build();
        } finally {
            MDC.remove(MDC_TASK_ID);
        }
    }

    public RunResult dryRun(String title, String description) {
        return dryRun(title, description, null);
    }

    /**
     * Classification and routing preview. Writes nothing to the ledger and takes no worker.
     */
    public RunResult dryRun(String title, String description, Tier forcedTier) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title is required");
        }
        Instant now = Instant.now();
        ClassificationResult classification = classify(title, description, forcedTier);
        Backend recommended = classification.recommendedBackend();

        boolean available = registry.available(recommended);
        Backend fallback = available
                ? null
                : resolver.preview(classification.tier(), registry).orElse(null);

        return RunResult.builder()
                .classification(classification)
                .actualBackend(recommended)
                .fallbackBackend(fallback)
                .workerAvailable(available)
                .validation(policy.config(classification.tier()))
                .dryRun(true)
                .startedAt(now)
                .finishedAt(Instant.now())
                .build();
    }

    private ClassificationResult classify(String title, String description, Tier forcedTier) {
        ClassificationResult classification = classifier.classify(title, description);
        if (forcedTier != null) {
            classification = classifier.forceTier(classification, forcedTier);
        }
        return classification;
    }

    private Optional<WorkerLease> acquire(ClassificationResult classification) {
        Optional<WorkerLease> lease = registry.tryAcquire(classification.recommendedBackend());
        if (lease.isPresent()) {
            return lease;
        }
        return resolver.resolve(classification.tier(), registry);
    }

    private record Attempt(ExecutionResult result, String error, long durationMs) {
        boolean failed() {
            return error != null;
        }
    }

    private Attempt execute(WorkerLease lease, ExecutionContext ctx, Task task) {
        long start = System.nanoTime();
        try {
            ExecutionResult result = lease.execute(ctx, task);
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            if (result == null) {
                return new Attempt(null, "worker returned no result", durationMs);
            }
            if (!result.success()) {
                String error = result.error() == null || result.error().isBlank()
                        ? "execution failed on " + lease.backend()
                        : result.error();
                return new Attempt(result, error, durationMs);
            }
            return new Attempt(result, null, durationMs);
        } catch (WorkerException e) {
            return new Attempt(null, e.getMessage(), (System.nanoTime() - start) / 1_000_000);
        } catch (RuntimeException e) {
            log.error("Worker {} failed unexpectedly", lease.backend(), e);
            return new Attempt(null, "worker error: " + e, (System.nanoTime() - start) / 1_000_000);
        }
    }

    private void recordExecution(Task task, Backend backend, Attempt attempt) {
        ExecutionResult r = attempt.result();
        boolean completed = !attempt.failed();
        ledger.createExecution(new Execution(
                LedgerService.newExecutionId(),
                task.id(),
                backend.id(),
                backend.id(),
                inputHash(task),
                r != null ? r.output() : null,
                r != null ? r.tokensUsed() : 0,
                r != null ? r.costUsd() : 0.0,
                attempt.durationMs(),
                completed ? ExecutionStatus.COMPLETED : ExecutionStatus.FAILED,
                attempt.error(),
                Instant.now()));
    }

    static String inputHash(Task task) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((task.title() + "\n" + task.description()).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
