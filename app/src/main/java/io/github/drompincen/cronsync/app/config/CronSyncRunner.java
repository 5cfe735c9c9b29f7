package io.github.drompincen.cronsync.app.config;

import io.github.drompincen.cronsync.app.transport.GatewayConnection;
import io.github.drompincen.cronsync.runtime.sync.CronSyncEngine;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.springframework.stereotype.Component;

/**
 * Opens the gateway connection and starts syncing with the application; stops both on shutdown.
 */
@Component
public class CronSyncRunner {

    private final GatewayConnection connection;
    private final CronSyncEngine engine;

    public CronSyncRunner(GatewayConnection connection, CronSyncEngine engine) {
        this.connection = connection;
        this.engine = engine;
    }

    @PostConstruct
    public void start() {
        connection.connect();
        engine.start();
    }

    @PreDestroy
    public void stop() {
        engine.stop();
        connection.close();
    }
}
