package com.ptl;

import com.ptl.adapter.in.web.HttpServerVerticle;
import io.vertx.config.ConfigRetriever;
import io.vertx.config.ConfigRetrieverOptions;
import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main application entry point
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        log.info("Starting Pooled Tranche Ledger...");

        Vertx vertx = Vertx.vertx();

        // Precedence: system properties > environment > application.yml
        ConfigRetriever retriever = ConfigRetriever.create(vertx, configOptions());

        retriever.getConfig()
                .compose(config -> vertx.deployVerticle(new HttpServerVerticle(),
                        new DeploymentOptions().setConfig(config)))
                .onSuccess(deploymentId -> {
                    log.info("HTTP Server Verticle deployed successfully: {}", deploymentId);

                    // Add shutdown hook
                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        log.info("Shutting down Pooled Tranche Ledger...");
                        vertx.close();
                    }));

                    log.info("Pooled Tranche Ledger is ready!");
                })
                .onFailure(error -> {
                    log.error("Failed to start Pooled Tranche Ledger", error);
                    vertx.close();
                });
    }

    static ConfigRetrieverOptions configOptions() {
        ConfigStoreOptions fileStore = new ConfigStoreOptions()
                .setType("file")
                .setFormat("yaml")
                .setConfig(new JsonObject().put("path", "application.yml"));

        ConfigStoreOptions envStore = new ConfigStoreOptions()
                .setType("env")
                .setOptional(true);

        ConfigStoreOptions sysPropsStore = new ConfigStoreOptions()
                .setType("sys")
                .setConfig(new JsonObject().put("cache", false));

        return new ConfigRetrieverOptions()
                .setScanPeriod(0)
                .addStore(fileStore)
                .addStore(envStore)
                .addStore(sysPropsStore);
    }
}
