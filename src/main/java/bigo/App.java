package bigo;

import bigo.conductor.config.ConductorConfig;
import bigo.conductor.config.Dependencies;
import bigo.conductor.server.ConductorHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Conductor entry point: wires dependencies, registers backend workers and serves the API
 * until the process is stopped.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        ConductorConfig config = ConductorConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);

        if (deps.registerWorkers().isEmpty()) {
            log.warn("No backend worker registered; runs will fail until one becomes available");
        }

        ConductorHttpServer server = new ConductorHttpServer(
                deps.routerHandler(), config.serverHost(), config.executorThreads());
        if (!server.start(config.serverPort())) {
            deps.close();
            System.exit(1);
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "bigo-shutdown"));

        stopped.await();
    }
}
