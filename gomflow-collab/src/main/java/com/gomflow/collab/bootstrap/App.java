package com.gomflow.collab.bootstrap;

import com.gomflow.collab.application.port.output.ActivityFeedRepository;
import com.gomflow.collab.application.port.output.OrderLockRepository;
import com.gomflow.collab.application.port.output.WorkspaceMemberRepository;
import com.gomflow.collab.application.service.ActivityRecorder;
import com.gomflow.collab.application.service.ChatRelay;
import com.gomflow.collab.application.service.ConnectionRegistry;
import com.gomflow.collab.application.service.EditCoordinator;
import com.gomflow.collab.application.service.HeartbeatSweeper;
import com.gomflow.collab.application.service.KeyedExecutor;
import com.gomflow.collab.application.service.OrderLockManager;
import com.gomflow.collab.application.service.PresenceTracker;
import com.gomflow.collab.application.service.RoomBroadcaster;
import com.gomflow.collab.application.service.WorkspaceStateAssembler;
import com.gomflow.collab.auth.JwtService;
import com.gomflow.collab.auth.SessionAuthenticator;
import com.gomflow.collab.config.CollabConfig;
import com.gomflow.collab.infrastructure.metrics.CollabMetrics;
import com.gomflow.collab.infrastructure.metrics.CollabMetricsHandler;
import com.gomflow.collab.infrastructure.persistence.PostgresActivityFeedRepository;
import com.gomflow.collab.infrastructure.persistence.PostgresChatMessageRepository;
import com.gomflow.collab.infrastructure.persistence.PostgresEditRepository;
import com.gomflow.collab.infrastructure.persistence.PostgresOrderLockRepository;
import com.gomflow.collab.infrastructure.persistence.PostgresPresenceRepository;
import com.gomflow.collab.infrastructure.persistence.PostgresUserRepository;
import com.gomflow.collab.infrastructure.persistence.PostgresWorkspaceMemberRepository;
import com.gomflow.collab.security.InputValidator;
import com.gomflow.collab.transport.http.HealthHandler;
import com.gomflow.collab.transport.ws.CollaborationEventRouter;
import com.gomflow.collab.transport.ws.WsHub;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * GoMFlow collaboration coordinator.
 *
 * Wires by hand:
 * - HikariCP pool over PostgreSQL
 * - Postgres repositories
 * - Lock, presence, edit and chat services on keyed lanes
 * - Undertow with /ws, /health and /metrics
 * - Heartbeat sweeper
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== GoMFlow Collaboration Coordinator Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        CollabConfig config = CollabConfig.fromEnv();
        StartupConfigValidator.validate(config);

        Clock clock = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource(config);

        WorkspaceMemberRepository memberRepo = new PostgresWorkspaceMemberRepository(dataSource);
        OrderLockRepository lockRepo = new PostgresOrderLockRepository(dataSource);
        ActivityFeedRepository activityRepo = new PostgresActivityFeedRepository(dataSource);

        // ═══════════════════════════════════════════════════════════════
        // Metrics
        // ═══════════════════════════════════════════════════════════════
        CollabMetrics metrics = new CollabMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Lanes
        // ═══════════════════════════════════════════════════════════════
        KeyedExecutor connectionLanes = new KeyedExecutor("conn", config.partitions());
        KeyedExecutor orderLanes = new KeyedExecutor("order", config.partitions());
        KeyedExecutor presenceLanes = new KeyedExecutor("presence", config.partitions());
        ExecutorService activityExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "activity-writer");
            t.setDaemon(true);
            return t;
        });

        // ═══════════════════════════════════════════════════════════════
        // Services
        // ═══════════════════════════════════════════════════════════════
        ConnectionRegistry registry = new ConnectionRegistry(memberRepo);
        RoomBroadcaster broadcaster = new RoomBroadcaster(registry, metrics, clock);
        ActivityRecorder activityRecorder =
            new ActivityRecorder(activityRepo, activityExecutor);

        OrderLockManager lockManager = new OrderLockManager(lockRepo, broadcaster, orderLanes, metrics, clock,
            config.lockDefaultMinutes(), config.lockMaxMinutes());
        lockManager.restore(lockRepo.findLiveLocks(clock.instant()));

        WorkspaceStateAssembler stateAssembler = new WorkspaceStateAssembler(memberRepo,
            activityRepo, registry, lockManager, clock, config.recentActivityLimit());
        PresenceTracker presenceTracker = new PresenceTracker(registry, new PostgresPresenceRepository(dataSource),
            broadcaster, stateAssembler, lockManager, presenceLanes, clock);
        EditCoordinator editCoordinator = new EditCoordinator(new PostgresEditRepository(dataSource), lockManager,
            broadcaster, activityRecorder, orderLanes, metrics, clock, config.editRequiresLock());
        ChatRelay chatRelay = new ChatRelay(new PostgresChatMessageRepository(dataSource), broadcaster,
            activityRecorder, clock);

        HeartbeatSweeper sweeper = new HeartbeatSweeper(lockManager, broadcaster, config.heartbeatInterval(), clock);
        log.info("✓ Collaboration services initialized (partitions={}, editRequiresLock={})",
            config.partitions(), config.editRequiresLock());

        // ═══════════════════════════════════════════════════════════════
        // Transport
        // ═══════════════════════════════════════════════════════════════
        JwtService jwtService = new JwtService(config.jwtSecret(), clock);
        SessionAuthenticator authenticator =
            new SessionAuthenticator(jwtService, new PostgresUserRepository(dataSource));
        CollaborationEventRouter router = new CollaborationEventRouter(registry, presenceTracker, lockManager,
            editCoordinator, chatRelay, broadcaster, connectionLanes, new InputValidator(), metrics, clock);
        WsHub wsHub = new WsHub(authenticator, router);

        RoutingHandler routes = Handlers.routing()
            .get("/ws", wsHub.websocketHandler())
            .get("/health", new HealthHandler(registry, lockManager, clock))
            .get("/metrics", new CollabMetricsHandler(metrics.getRegistry()))
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "GoMFlow collaboration coordinator\n\n" +
                    "WS:      ws://" + config.bindHost() + ":" + config.port() + "/ws?token=<jwt>\n" +
                    "Health:  GET /health\n" +
                    "Metrics: GET /metrics\n"
                );
            });

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), config.bindHost())
            .setHandler(routes)
            .build();

        server.start();
        sweeper.start();
        log.info("✓ Collaboration coordinator listening on {}:{}", config.bindHost(), config.port());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            sweeper.stop();
            server.stop();
            connectionLanes.shutdown();
            orderLanes.shutdown();
            presenceLanes.shutdown();
            activityExecutor.shutdown();
            try {
                if (!activityExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    activityExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                activityExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            dataSource.close();
            log.info("Shutdown complete");
        }, "shutdown-hook"));
    }

    private static HikariDataSource createDataSource(CollabConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.dbUrl());
        hikari.setUsername(config.dbUser());
        hikari.setPassword(config.dbPass());
        hikari.setMaximumPoolSize(config.dbPoolSize());
        hikari.setMinimumIdle(2);
        hikari.setConnectionTimeout(5000);
        hikari.setPoolName("gomflow-collab-hikari");

        log.info("DB: url={}, user={}, pool={}", config.dbUrl(), config.dbUser(), config.dbPoolSize());
        return new HikariDataSource(hikari);
    }

    private App() {}
}
