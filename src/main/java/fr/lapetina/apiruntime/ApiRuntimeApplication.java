package fr.lapetina.apiruntime;

import fr.lapetina.apiruntime.api.HttpServer;
import fr.lapetina.apiruntime.infrastructure.config.ApiServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the API runtime.
 */
public class ApiRuntimeApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ApiRuntimeApplication.class);

    private final RuntimeFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public ApiRuntimeApplication(RuntimeFactory factory) throws Exception {
        log.info("Starting API runtime...");

        this.factory = factory.start();

        ApiServerConfig config = factory.getConfig();
        ApiServerConfig.ServerConfig server = config.server();
        this.httpServer = new HttpServer(
                server.host(),
                server.port(),
                server.backlog(),
                factory.getState(),
                factory.getLimiter(),
                factory.getReloadLoop(),
                factory.getMetricsRegistry(),
                config.metrics().enabled()
        );

        log.info("API runtime initialized");
    }

    public ApiRuntimeApplication(String configPath) throws Exception {
        this(RuntimeFactory.create(configPath));
    }

    public void start() {
        httpServer.start();
        log.info("API runtime started on port {}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public RuntimeFactory getFactory() {
        return factory;
    }

    public HttpServer getHttpServer() {
        return httpServer;
    }

    @Override
    public void close() {
        log.info("Shutting down API runtime...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing runtime", e);
        }

        log.info("API runtime shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            ApiRuntimeApplication app = new ApiRuntimeApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start API runtime", e);
            System.exit(1);
        }
    }
}
