package prism;

import prism.coordinator.config.CoordinatorConfig;
import prism.coordinator.config.Dependencies;
import prism.worker.WorkerAgent;
import prism.worker.client.ControlPlane;
import prism.worker.client.HttpControlPlane;
import prism.worker.client.LocalControlPlane;
import prism.worker.collect.AdbTraceCollector;
import prism.worker.config.WorkerConfig;
import prism.worker.device.AdbDeviceBridge;
import prism.worker.device.DeviceBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;

/**
 * Command line entry point.
 *
 * <pre>
 * java -jar prism.jar coordinator [prism.ini]
 * java -jar prism.jar worker [prism.ini]
 * java -jar prism.jar standalone [prism.ini]
 * </pre>
 *
 * Standalone runs the coordinator and a worker in one JVM, the worker calling
 * the services directly.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        if (args.length == 0) {
            System.err.println("usage: prism <coordinator|worker|standalone> [config.ini]");
            System.exit(2);
        }
        String mode = args[0].toLowerCase(Locale.ROOT);
        Path ini = args.length > 1 ? Path.of(args[1]) : null;

        switch (mode) {
            case "coordinator" -> runCoordinator(ini);
            case "worker" -> runWorker(ini);
            case "standalone" -> runStandalone(ini);
            default -> {
                System.err.println("unknown mode: " + args[0]);
                System.exit(2);
            }
        }
    }

    private static void runCoordinator(Path ini) throws IOException, InterruptedException {
        Dependencies deps = Dependencies.create(coordinatorConfig(ini));
        Runtime.getRuntime().addShutdownHook(new Thread(deps::close, "prism-shutdown"));

        deps.server().start();
        deps.startScheduler();
        log.info("Coordinator listening on port {}", deps.server().boundPort());
        deps.server().awaitTermination();
    }

    private static void runWorker(Path ini) throws IOException, InterruptedException {
        WorkerConfig config = workerConfig(ini);
        log.info("Starting worker: {}", config);
        WorkerAgent agent = newAgent(config, new HttpControlPlane(config));
        awaitShutdown(agent);
    }

    private static void runStandalone(Path ini) throws IOException, InterruptedException {
        Dependencies deps = Dependencies.create(coordinatorConfig(ini));
        WorkerConfig workerConfig = workerConfig(ini);

        deps.server().start();
        deps.startScheduler();
        log.info("Standalone coordinator listening on port {}", deps.server().boundPort());

        WorkerAgent agent = newAgent(workerConfig, new LocalControlPlane(workerConfig.hostName(), deps));
        Runtime.getRuntime().addShutdownHook(new Thread(deps::close, "prism-coordinator-shutdown"));
        awaitShutdown(agent);
    }

    private static WorkerAgent newAgent(WorkerConfig config, ControlPlane controlPlane) {
        DeviceBridge bridge = new AdbDeviceBridge(config.adbPath());
        return new WorkerAgent(config, controlPlane, bridge,
                new AdbTraceCollector(bridge, config.workDir(), config.collectSlack()));
    }

    private static void awaitShutdown(WorkerAgent agent) throws InterruptedException {
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            agent.stop();
            stopped.countDown();
        }, "prism-worker-shutdown"));
        agent.start();
        stopped.await();
    }

    private static CoordinatorConfig coordinatorConfig(Path ini) throws IOException {
        return ini != null ? CoordinatorConfig.fromIni(ini) : CoordinatorConfig.fromEnv();
    }

    private static WorkerConfig workerConfig(Path ini) throws IOException {
        return ini != null ? WorkerConfig.fromIni(ini) : WorkerConfig.fromEnv();
    }
}
