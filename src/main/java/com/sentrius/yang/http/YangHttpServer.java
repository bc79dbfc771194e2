package com.sentrius.yang.http;

import com.sentrius.yang.YangDocumentService;
import com.sentrius.yang.YangExplorerConfiguration;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Serves the parse endpoints on the JDK HTTP server.
 */
public class YangHttpServer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(YangHttpServer.class);

    private final YangExplorerConfiguration configuration;
    private final YangDocumentService service;
    private HttpServer server;
    private ExecutorService executor;

    public YangHttpServer(YangExplorerConfiguration configuration, YangDocumentService service) {
        this.configuration = configuration;
        this.service = service;
    }

    public void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("Server already started");
        }
        server = HttpServer.create(new InetSocketAddress(configuration.getHttpPort()), 0);
        YangApiHandler apiHandler = new YangApiHandler(service, configuration.getHttpMaxBodyBytes());
        server.createContext(YangApiHandler.PARSE_PATH, apiHandler);
        server.createContext(YangApiHandler.PARSE_MULTIPLE_PATH, apiHandler);
        server.createContext("/api/health", new HealthHandler());

        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        logger.info("YANG parse API listening on port {}", getPort());
    }

    public int getPort() {
        if (server == null) {
            throw new IllegalStateException("Server not started");
        }
        return server.getAddress().getPort();
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            executor.shutdown();
            server = null;
            logger.info("YANG parse API stopped");
        }
    }

    @Override
    public void close() {
        stop();
    }
}
