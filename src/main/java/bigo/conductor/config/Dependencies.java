package bigo.conductor.config;

import bigo.conductor.api.v1.ClassifyController;
import bigo.conductor.api.v1.HealthController;
import bigo.conductor.api.v1.StatsController;
import bigo.conductor.api.v1.TaskController;
import bigo.conductor.api.v1.WorkerController;
import bigo.conductor.classifier.Classifier;
import bigo.conductor.policy.RoutingConfigLoader;
import bigo.conductor.policy.TierPolicy;
import bigo.conductor.repository.ExecutionRepository;
import bigo.conductor.repository.TaskRepository;
import bigo.conductor.server.RouterHandler;
import bigo.conductor.service.Conductor;
import bigo.conductor.service.LedgerService;
import bigo.conductor.store.Database;
import bigo.conductor.store.JdbcExecutionRepository;
import bigo.conductor.store.JdbcTaskRepository;
import bigo.conductor.worker.FallbackResolver;
import bigo.conductor.worker.Worker;
import bigo.conductor.worker.WorkerBootstrap;
import bigo.conductor.worker.WorkerFactory;
import bigo.conductor.worker.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Manual dependency injection container.
 *
 * <pre>
 * Dependencies deps = Dependencies.create(ConductorConfig.fromEnv());
 * deps.registerWorkers(); // probe and register backend adapters
 * Conductor conductor = deps.conductor();
 * // ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final ConductorConfig config;
    private final Database database;
    private final TaskRepository taskRepository;
    private final ExecutionRepository executionRepository;
    private final LedgerService ledgerService;
    private final TierPolicy policy;
    private final Classifier classifier;
    private final WorkerRegistry workerRegistry;
    private final Conductor conductor;
    private final WorkerBootstrap workerBootstrap;

    // Controllers
    private final HealthController healthController;
    private final TaskController taskController;
    private final ClassifyController classifyController;
    private final StatsController statsController;
    private final WorkerController workerController;

    private RouterHandler routerHandler;

    private Dependencies(ConductorConfig config, WorkerFactory workerFactory) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        this.database = new Database(config);
        this.taskRepository = new JdbcTaskRepository(database);
        this.executionRepository = new JdbcExecutionRepository(database);
        this.ledgerService = new LedgerService(taskRepository, executionRepository,
                config.assumedHostedTaskCostUsd());

        this.policy = config.routingFile() != null
                ? RoutingConfigLoader.load(config.routingFile())
                : TierPolicy.defaults();
        this.classifier = new Classifier(policy);
        this.workerRegistry = new WorkerRegistry();
        this.conductor = new Conductor(policy, ledgerService, classifier, workerRegistry,
                new FallbackResolver(policy));
        this.workerBootstrap = new WorkerBootstrap(config, workerFactory);

        this.healthController = new HealthController(database, ledgerService, workerRegistry);
        this.taskController = new TaskController(conductor, ledgerService, config.runTimeout());
        this.classifyController = new ClassifyController(classifier, policy);
        this.statsController = new StatsController(ledgerService);
        this.workerController = new WorkerController(workerRegistry);

        log.info("Dependencies initialized successfully");
    }

    public static Dependencies create(ConductorConfig config) {
        return new Dependencies(config, new WorkerFactory());
    }

    public static Dependencies create(ConductorConfig config, WorkerFactory workerFactory) {
        return new Dependencies(config, workerFactory);
    }

    public static Dependencies create() {
        return create(ConductorConfig.fromEnv());
    }

    public ConductorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public LedgerService ledgerService() {
        return ledgerService;
    }

    public TierPolicy policy() {
        return policy;
    }

    public Classifier classifier() {
        return classifier;
    }

    public WorkerRegistry workerRegistry() {
        return workerRegistry;
    }

    public Conductor conductor() {
        return conductor;
    }

    /**
     * Probe every enabled backend once and register the adapters that answer.
     */
    public List<Worker> registerWorkers() {
        return workerBootstrap.registerAll(workerRegistry);
    }

    /**
     * RouterHandler with every controller registered. Health goes first.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(classifyController)
                    .registerController(taskController)
                    .registerController(statsController)
                    .registerController(workerController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }
        log.info("Dependencies closed");
    }
}
