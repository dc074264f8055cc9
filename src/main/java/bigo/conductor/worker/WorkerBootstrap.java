package bigo.conductor.worker;

import bigo.conductor.config.BackendSettings;
import bigo.conductor.config.ConductorConfig;
import bigo.conductor.model.BackendClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Startup pre-flight: builds the adapters of every enabled backend class,
 * probes each once and registers the ones that pass.
 * A quota failure disables the whole backend class for the rest of the process.
 */
public class WorkerBootstrap {

    private static final Logger log = LoggerFactory.getLogger(WorkerBootstrap.class);

    private final ConductorConfig config;
    private final WorkerFactory factory;

    public WorkerBootstrap(ConductorConfig config, WorkerFactory factory) {
        this.config = config;
        this.factory = factory;
    }

    /**
     * @return the workers that were registered
     */
    public List<Worker> registerAll(WorkerRegistry registry) {
        List<Worker> registered = new ArrayList<>();
        for (BackendClass backendClass : BackendClass.values()) {
            BackendSettings settings = config.backend(backendClass);
            if (!settings.enabled()) {
                log.info("Backend {} disabled, skipping", backendClass.prefix());
                continue;
            }
            for (Worker worker : factory.create(settings)) {
                if (!config.isBackendEnabled(backendClass)) {
                    break;
                }
                if (probe(worker)) {
                    registry.register(worker);
                    registered.add(worker);
                }
            }
        }
        log.info("Registered {} worker(s): {}", registered.size(), registry.backends());
        return registered;
    }

    private boolean probe(Worker worker) {
        try {
            worker.checkQuota(ExecutionContext.withTimeout(config.probeTimeout()));
            return true;
        } catch (QuotaExceededException e) {
            log.warn("Backend {} is out of quota, disabling it: {}",
                    worker.backend().backendClass().prefix(), e.getMessage());
            config.disableBackend(worker.backend().backendClass());
            return false;
        } catch (WorkerException e) {
            log.warn("Worker {} failed its pre-flight check, not registering: {}", worker.backend(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("Unexpected error probing worker {}", worker.backend(), e);
            return false;
        }
    }
}
