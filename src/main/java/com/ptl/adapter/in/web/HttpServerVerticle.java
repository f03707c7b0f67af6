package com.ptl.adapter.in.web;

import com.ptl.adapter.in.scheduler.EpochCloseScheduler;
import com.ptl.adapter.in.web.cover.FirstLossCoverHandler;
import com.ptl.adapter.in.web.epoch.EpochHandler;
import com.ptl.adapter.in.web.pnl.PnlDistributionHandler;
import com.ptl.adapter.in.web.pnl.PnlDistributionHandler.PnlEvent;
import com.ptl.adapter.in.web.pool.PoolStateHandler;
import com.ptl.adapter.in.web.tranche.DepositHandler;
import com.ptl.adapter.in.web.tranche.RedemptionHandler;
import com.ptl.config.PoolAssembly;
import com.ptl.config.PoolConfig;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.LoggerHandler;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * HTTP Server Verticle - handles all HTTP requests
 * Owns the pool: every ledger call runs on this verticle's event loop, one at a time.
 */
@Slf4j
public class HttpServerVerticle extends AbstractVerticle {

    private final Clock clock;
    private PoolConfig poolConfig;
    private PoolAssembly pool;
    private EpochCloseScheduler scheduler;
    private HttpServer server;

    public HttpServerVerticle() {
        this(Clock.systemUTC());
    }

    public HttpServerVerticle(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting HTTP Server Verticle...");

        initializeServices()
                .compose(v -> {
                    log.info("All services initialized successfully");
                    return startHttpServer();
                })
                .onSuccess(v -> {
                    log.info("HTTP Server Verticle started successfully on port {}", server.actualPort());
                    startPromise.complete();
                })
                .onFailure(error -> {
                    log.error("Failed to start HTTP Server Verticle", error);
                    startPromise.fail(error);
                });
    }

    @Override
    public void stop() {
        if (scheduler != null) {
            scheduler.stop();
        }
        log.info("HTTP Server Verticle stopped");
    }

    public int actualPort() {
        return server == null ? -1 : server.actualPort();
    }

    private Future<Void> initializeServices() {
        try {
            poolConfig = PoolConfig.from(config());
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
        pool = new PoolAssembly(poolConfig, clock);

        long interval = poolConfig.pool().epochCloseIntervalMs();
        if (interval > 0) {
            scheduler = new EpochCloseScheduler(vertx, pool.getEpochSettlementUseCase(), interval);
            scheduler.start();
        }

        log.info("Services wired up (Hexagonal Architecture)");
        return Future.succeededFuture();
    }

    private Future<Void> startHttpServer() {
        Router router = Router.router(vertx);

        // Global handlers
        router.route().handler(LoggerHandler.create());
        router.route().handler(BodyHandler.create());

        // Input adapters (handlers)
        WebRouter.builder()
                .router(router)
                .profitHandler(new PnlDistributionHandler(pool.getPnlDistributionUseCase(), PnlEvent.PROFIT))
                .lossHandler(new PnlDistributionHandler(pool.getPnlDistributionUseCase(), PnlEvent.LOSS))
                .recoveryHandler(new PnlDistributionHandler(pool.getPnlDistributionUseCase(), PnlEvent.RECOVERY))
                .epochHandler(new EpochHandler(pool.getEpochSettlementUseCase()))
                .depositHandler(new DepositHandler(pool.getTrancheDepositUseCase()))
                .redemptionHandler(new RedemptionHandler(pool.getRedemptionUseCase()))
                .coverHandler(new FirstLossCoverHandler(pool.getFirstLossCoverUseCase()))
                .poolStateHandler(new PoolStateHandler(pool.getPoolQueryUseCase()))
                .build()
                .setupRoutes();

        // Default route - 404
        router.route().handler(ctx -> {
            ctx.response()
                    .setStatusCode(404)
                    .putHeader("Content-Type", "application/json")
                    .end(new JsonObject()
                            .put("status", "error")
                            .put("message", "Endpoint not found")
                            .encode()
                    );
        });

        int port = poolConfig.httpPort();

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(port)
                .onSuccess(httpServer -> {
                    server = httpServer;
                    log.info("HTTP server listening on port {}", httpServer.actualPort());
                })
                .mapEmpty();
    }
}
