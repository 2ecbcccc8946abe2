package geoflow;

import geoflow.coordinator.config.CoordinatorConfig;
import geoflow.coordinator.config.Dependencies;
import geoflow.coordinator.server.CoordinatorNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Coordinator entry point.
 *
 * Wires dependencies, starts the HTTP server, then the background scheduler.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        CoordinatorConfig config = CoordinatorConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        CoordinatorNettyServer server = new CoordinatorNettyServer(deps.routerHandler());

        log.info("Starting coordinator on port {}...", config.serverPort());
        if (!server.start(config.serverHost(), config.serverPort())) {
            deps.close();
            System.exit(1);
        }
        deps.startScheduler();
        // pick up READY discovery items left over from a previous run
        deps.serviceInvokers().kickDirectServices();

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down coordinator...");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "geoflow-shutdown"));

        stopped.await();
    }
}
