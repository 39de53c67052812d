package com.pricegate;

import com.pricegate.adapter.in.web.HttpServerVerticle;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Main application entry point
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        log.info("Starting Price Gateway...");

        Vertx vertx = Vertx.vertx();
        JsonObject config = loadConfig();

        vertx.deployVerticle(new HttpServerVerticle(), new DeploymentOptions()
                        .setConfig(config)
                        .setInstances(1))
                .onSuccess(deploymentId -> {
                    log.info("HTTP Server Verticle deployed successfully: {}", deploymentId);

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        log.info("Shutting down Price Gateway...");
                        vertx.close();
                    }));

                    int port = config.getJsonObject("http", new JsonObject()).getInteger("port", 8080);
                    log.info("Price Gateway is ready!");
                    log.info("Metal prices: http://localhost:{}/api/prices/metals?currency=USD", port);
                    log.info("Health Check: http://localhost:{}/health", port);
                })
                .onFailure(error -> {
                    log.error("Failed to deploy HTTP Server Verticle", error);
                    vertx.close();
                });
    }

    static JsonObject loadConfig() {
        try (InputStream is = Main.class.getClassLoader().getResourceAsStream("application.json")) {
            if (is == null) {
                log.warn("application.json not found in classpath, using defaults");
                return new JsonObject();
            }
            JsonObject config = new JsonObject(new String(is.readAllBytes(), StandardCharsets.UTF_8));
            log.info("Loaded configuration from application.json");
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Configuration error: cannot read application.json", e);
        }
    }
}
