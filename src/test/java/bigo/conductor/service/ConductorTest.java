package bigo.conductor.service;

import bigo.conductor.classifier.Classifier;
import bigo.conductor.model.Backend;
import bigo.conductor.model.Execution;
import bigo.conductor.model.ExecutionStatus;
import bigo.conductor.model.RunResult;
import bigo.conductor.model.Task;
import bigo.conductor.model.TaskStatus;
import bigo.conductor.model.Tier;
import bigo.conductor.policy.TierPolicy;
import bigo.conductor.store.Database;
import bigo.conductor.store.JdbcExecutionRepository;
import bigo.conductor.store.JdbcTaskRepository;
import bigo.conductor.worker.ExecutionContext;
import bigo.conductor.worker.FakeWorker;
import bigo.conductor.worker.FallbackResolver;
import bigo.conductor.worker.WorkerException;
import bigo.conductor.worker.WorkerRegistry;
import org.junit.jupiter.api.*;
import org.slf4j.MDC;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConductorTest {

    private static final String TYPO = "fix the typo in the word recieve";
    private static final String PAYMENTS = "implement authentication for the payment API";
    private static final String REFACTOR = "refactor the widget to use new component pattern, across multiple files";

    private static Database db;
    private static LedgerService ledger;

    private WorkerRegistry registry;
    private Conductor conductor;

    @BeforeAll
    static void setupDb() {
        db = new Database("jdbc:h2:mem:test-conductor;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        ledger = new LedgerService(new JdbcTaskRepository(db), new JdbcExecutionRepository(db), 0.05);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void setup() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM executions");
            st.execute("DELETE FROM tasks");
            conn.commit();
        }
        TierPolicy policy = TierPolicy.defaults();
        registry = new WorkerRegistry();
        conductor = new Conductor(policy, ledger, new Classifier(policy), registry, new FallbackResolver(policy));
    }

    private FakeWorker register(Backend backend) {
        FakeWorker worker = new FakeWorker(backend);
        conductor.registerWorker(worker);
        return worker;
    }

    private Task stored(RunResult result) {
        return ledger.getTask(result.taskId()).orElseThrow();
    }

    @Test
    @DisplayName("Trivial task runs locally and finishes done")
    void trivialTaskRunsLocally() {
        FakeWorker local = register(Backend.OLLAMA_FAST).returns("fixed", 12, 0.0);

        RunResult result = conductor.run(ExecutionContext.background(), TYPO, "");

        assertEquals(TaskStatus.DONE, result.status());
        assertFalse(result.hasError());
        assertEquals(Backend.OLLAMA_FAST, result.actualBackend());
        assertEquals(Tier.TRIVIAL, result.classification().tier());
        assertFalse(result.validationRequired());
        assertEquals("fixed", result.execution().output());
        assertEquals(0.0, result.execution().costUsd());
        assertEquals(1, local.executeCalls());

        Task task = stored(result);
        assertEquals(TaskStatus.DONE, task.status());
        assertEquals(Tier.TRIVIAL, task.tier());
        assertEquals(Backend.OLLAMA_FAST, task.backend());

        List<Execution> executions = ledger.findExecutions(result.taskId());
        assertEquals(1, executions.size());
        Execution e = executions.get(0);
        assertEquals(ExecutionStatus.COMPLETED, e.status());
        assertEquals("ollama:fast", e.backend());
        assertEquals("fixed", e.output());
        assertEquals(12, e.tokensUsed());
        assertEquals(64, e.inputHash().length());
    }

    @Test
    @DisplayName("Critical task waits in validating")
    void criticalTaskAwaitsValidation() {
        register(Backend.CLAUDE_OPUS).returns("secured", 900, 0.3);

        RunResult result = conductor.run(ExecutionContext.background(), PAYMENTS, "");

        assertEquals(TaskStatus.VALIDATING, result.status());
        assertEquals(Backend.CLAUDE_OPUS, result.actualBackend());
        assertTrue(result.validationRequired());
        assertTrue(result.validationPending());
        assertEquals(5, result.requiredValidators());
        assertEquals(4, result.requiredApprovals());
        assertEquals(TaskStatus.VALIDATING, stored(result).status());
    }

    @Test
    @DisplayName("No worker: task stays pending and no attempt is recorded")
    void noWorkerLeavesTaskPending() {
        register(Backend.OLLAMA_DEFAULT);

        RunResult result = conductor.run(ExecutionContext.background(), PAYMENTS, "");

        assertEquals(TaskStatus.FAILED, result.status());
        assertEquals(Conductor.NO_WORKER, result.error());
        assertNull(result.actualBackend());
        assertEquals(TaskStatus.PENDING, stored(result).status());
        assertTrue(ledger.findExecutions(result.taskId()).isEmpty());
    }

    @Test
    void busyPrimaryFallsBackAlongTheChain() {
        register(Backend.CLAUDE_SONNET);
        FakeWorker haiku = register(Backend.CLAUDE_HAIKU);

        // standard: sonnet, then ollama:reasoning (unregistered), then haiku
        try (var held = registry.tryAcquire(Backend.CLAUDE_SONNET).orElseThrow()) {
            RunResult result = conductor.run(ExecutionContext.background(), REFACTOR, "");

            assertEquals(Backend.CLAUDE_HAIKU, result.actualBackend());
            assertEquals(Backend.CLAUDE_SONNET, result.classification().recommendedBackend());
            assertEquals(1, haiku.executeCalls());
            assertEquals(Backend.CLAUDE_HAIKU, haiku.received().get(0).backend());
            assertEquals(TaskStatus.VALIDATING, result.status());
        }
    }

    @Test
    void transportFailureIsRecordedAsFailedAttempt() {
        register(Backend.OLLAMA_FAST).throwsOnExecute(new WorkerException("connection refused"));

        RunResult result = conductor.run(ExecutionContext.background(), TYPO, "");

        assertEquals(TaskStatus.FAILED, result.status());
        assertEquals("connection refused", result.error());
        assertEquals(TaskStatus.FAILED, stored(result).status());

        Execution e = ledger.findExecutions(result.taskId()).get(0);
        assertEquals(ExecutionStatus.FAILED, e.status());
        assertEquals("connection refused", e.errorMessage());
        assertNull(e.output());
    }

    @Test
    void businessFailureIsRecordedAsFailedAttempt() {
        register(Backend.OLLAMA_FAST).failsWith("Ollama returned status 500: boom");

        RunResult result = conductor.run(ExecutionContext.background(), TYPO, "");

        assertEquals(TaskStatus.FAILED, result.status());
        assertEquals("Ollama returned status 500: boom", result.error());
        Execution e = ledger.findExecutions(result.taskId()).get(0);
        assertEquals(ExecutionStatus.FAILED, e.status());
        assertEquals("Ollama returned status 500: boom", e.errorMessage());
    }

    @Test
    @DisplayName("Very long worker error still ends the run failed")
    void longBusinessFailureIsStoredInFull() {
        String error = "x".repeat(5000);
        register(Backend.OLLAMA_FAST).failsWith(error);

        RunResult result = conductor.run(ExecutionContext.background(), TYPO, "");

        assertEquals(TaskStatus.FAILED, result.status());
        assertEquals(TaskStatus.FAILED, stored(result).status());
        Execution e = ledger.findExecutions(result.taskId()).get(0);
        assertEquals(ExecutionStatus.FAILED, e.status());
        assertEquals(error, e.errorMessage());
    }

    @Test
    void cancelledRunNeverReachesTheWorker() {
        FakeWorker local = register(Backend.OLLAMA_FAST);
        ExecutionContext ctx = ExecutionContext.background();
        ctx.cancel();

        RunResult result = conductor.run(ctx, TYPO, "");

        assertEquals(TaskStatus.FAILED, result.status());
        assertEquals(Conductor.CANCELLED, result.error());
        assertEquals(0, local.executeCalls());
        assertEquals(TaskStatus.FAILED, stored(result).status());
        assertTrue(ledger.findExecutions(result.taskId()).isEmpty());
        assertTrue(registry.available(Backend.OLLAMA_FAST));
    }

    @Test
    void leaseIsReleasedAfterEveryRun() {
        register(Backend.OLLAMA_FAST).throwsOnExecute(new WorkerException("down"));

        conductor.run(ExecutionContext.background(), TYPO, "");

        assertTrue(registry.available(Backend.OLLAMA_FAST));
    }

    @Test
    void forcedTierOverridesClassification() {
        FakeWorker opus = register(Backend.CLAUDE_OPUS);

        RunResult result = conductor.run(ExecutionContext.background(), TYPO, "", Tier.CRITICAL);

        assertEquals(Tier.CRITICAL, result.classification().tier());
        assertEquals(Backend.CLAUDE_OPUS, result.actualBackend());
        assertEquals(1, opus.executeCalls());
        assertEquals(Tier.CRITICAL, stored(result).tier());
    }

    @Test
    void taskIdIsInTheMdcOnlyDuringTheRun() {
        FakeWorker local = register(Backend.OLLAMA_FAST);

        RunResult result = conductor.run(ExecutionContext.background(), TYPO, "");

        assertEquals(result.taskId(), local.mdcTaskId());
        assertNull(MDC.get(Conductor.MDC_TASK_ID));
    }

    @Test
    void blankTitleIsRejectedBeforeAnyWrite() {
        assertThrows(IllegalArgumentException.class,
                () -> conductor.run(ExecutionContext.background(), " ", "x"));
        assertEquals(0, ledger.getStats().totalTasks());
    }

    @Test
    @DisplayName("Dry run previews routing without touching the ledger")
    void dryRunWritesNothing() {
        register(Backend.CLAUDE_HAIKU);

        RunResult result = conductor.dryRun(REFACTOR, "");

        assertTrue(result.dryRun());
        assertNull(result.taskId());
        assertNull(result.status());
        assertEquals(Backend.CLAUDE_SONNET, result.actualBackend());
        assertFalse(result.workerAvailable());
        assertEquals(Backend.CLAUDE_HAIKU, result.fallbackBackend());
        assertEquals(2, result.requiredValidators());
        assertEquals(0, ledger.getStats().totalTasks());
        assertTrue(registry.available(Backend.CLAUDE_HAIKU));
    }

    @Test
    void dryRunWithFreePrimaryHasNoFallback() {
        register(Backend.OLLAMA_FAST);

        RunResult result = conductor.dryRun(TYPO, "");

        assertTrue(result.workerAvailable());
        assertNull(result.fallbackBackend());
    }

    @Test
    void inputHashIsStable() {
        Task a = Task.builder().id("a").title("t").description("d").build();
        Task b = Task.builder().id("b").title("t").description("d").build();
        assertEquals(Conductor.inputHash(a), Conductor.inputHash(b));
        assertNotEquals(Conductor.inputHash(a),
                Conductor.inputHash(Task.builder().id("c").title("t").description("e").build()));
    }
}
