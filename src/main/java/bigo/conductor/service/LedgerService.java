package bigo.conductor.service;

import bigo.conductor.exception.InvalidStateTransitionException;
import bigo.conductor.exception.NotFoundException;
import bigo.conductor.model.BackendClass;
import bigo.conductor.model.Execution;
import bigo.conductor.model.LedgerStats;
import bigo.conductor.model.Task;
import bigo.conductor.model.TaskStatus;
import bigo.conductor.repository.ExecutionRepository;
import bigo.conductor.repository.ExecutionRepository.BackendUsage;
import bigo.conductor.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * The ledger: durable record of tasks, execution attempts and cost.
 * Every write commits on its own; failures surface as
 * {@link bigo.conductor.exception.LedgerException}.
 */
public class LedgerService {

    private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

    static final int MAX_LIST_LIMIT = 500;

    private final TaskRepository taskRepository;
    private final ExecutionRepository executionRepository;
    private final double assumedHostedTaskCostUsd;

    public LedgerService(TaskRepository taskRepository, ExecutionRepository executionRepository,
            double assumedHostedTaskCostUsd) {
        this.taskRepository = taskRepository;
        this.executionRepository = executionRepository;
        this.assumedHostedTaskCostUsd = assumedHostedTaskCostUsd;
    }

    public static String newTaskId() {
        return "task-" + UUID.randomUUID();
    }

    public static String newExecutionId() {
        return "exec-" + UUID.randomUUID();
    }

    public Task createTask(Task task) {
        if (task.title().isBlank()) {
            throw new IllegalArgumentException("title is required");
        }
        taskRepository.save(task);
        log.debug("Created task {} (tier={}, backend={})", task.id(), task.tier().label(), task.backend());
        return task;
    }

    public Optional<Task> getTask(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        return taskRepository.findById(taskId);
    }

    /**
     * Move a task forward.
     *
     * @throws NotFoundException                if the task does not exist
     * @throws InvalidStateTransitionException if the task's current status cannot move to the target
     */
    public void updateTaskStatus(String taskId, TaskStatus target) {
        Set<TaskStatus> predecessors = TaskStatus.predecessorsOf(target);
        if (taskRepository.updateStatus(taskId, predecessors, target)) {
            return;
        }
        Task current = taskRepository.findById(taskId)
                .orElseThrow(() -> new NotFoundException("Task", taskId));
        throw new InvalidStateTransitionException(taskId, current.status(), target);
    }

    public void createExecution(Execution execution) {
        executionRepository.save(execution);
        log.debug("Recorded execution {} of task {} on {} ({})",
                execution.id(), execution.taskId(), execution.backend(), execution.status());
    }

    public List<Task> findRecentTasks(int limit) {
        if (limit <= 0 || limit > MAX_LIST_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIST_LIMIT);
        }
        return taskRepository.findRecent(limit);
    }

    public List<Execution> findExecutions(String taskId) {
        return executionRepository.findByTaskId(taskId);
    }

    /**
     * Aggregate counts and cost. Savings compare local and Gemini executions
     * against a flat hosted cost per task.
     */
    public LedgerStats getStats() {
        int totalTasks = taskRepository.count();
        int pendingTasks = taskRepository.countByStatuses(TaskStatus.nonTerminal());
        int completedTasks = taskRepository.countByStatuses(EnumSet.of(TaskStatus.DONE));
        int totalExecutions = executionRepository.count();

        BackendUsage local = executionRepository.usageOf(BackendClass.LOCAL);
        BackendUsage claude = executionRepository.usageOf(BackendClass.CLAUDE);
        BackendUsage gemini = executionRepository.usageOf(BackendClass.GEMINI);

        int nonClaude = local.executions() + gemini.executions();
        double savings = nonClaude * assumedHostedTaskCostUsd - gemini.costUsd();
        double hostedEquivalent = claude.costUsd() + gemini.costUsd() + savings;
        double savingsPercent = hostedEquivalent > 0 ? savings / hostedEquivalent * 100 : 0.0;

        return new LedgerStats(
                totalTasks,
                pendingTasks,
                completedTasks,
                totalExecutions,
                local.executions(),
                local.costUsd(),
                claude.executions(),
                claude.costUsd(),
                gemini.executions(),
                gemini.costUsd(),
                savings,
                savingsPercent);
    }
}
