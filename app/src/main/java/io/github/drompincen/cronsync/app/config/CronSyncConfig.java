package io.github.drompincen.cronsync.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.cronsync.app.transport.GatewayConnection;
import io.github.drompincen.cronsync.app.transport.GatewayFrameCodec;
import io.github.drompincen.cronsync.runtime.sync.CronSyncEngine;
import io.github.drompincen.cronsync.runtime.sync.CronSyncSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class CronSyncConfig {

    @Bean
    CronSyncSettings cronSyncSettings(
            @Value("${cronsync.poll-interval-ms:30000}") long pollIntervalMs,
            @Value("${cronsync.debounce.jobs-ms:250}") long jobsDebounceMs,
            @Value("${cronsync.debounce.runs-ms:200}") long runsDebounceMs,
            @Value("${cronsync.debounce.gap-ms:250}") long gapDebounceMs,
            @Value("${cronsync.request-timeout-ms:10000}") long requestTimeoutMs,
            @Value("${cronsync.run-timeout-ms:20000}") long runTimeoutMs,
            @Value("${cronsync.run-log-limit:200}") int runLogLimit) {
        return new CronSyncSettings(
                Duration.ofMillis(pollIntervalMs),
                Duration.ofMillis(jobsDebounceMs),
                Duration.ofMillis(runsDebounceMs),
                Duration.ofMillis(gapDebounceMs),
                Duration.ofMillis(requestTimeoutMs),
                Duration.ofMillis(runTimeoutMs),
                runLogLimit);
    }

    @Bean
    GatewayConnection gatewayConnection(@Value("${cronsync.gateway.url:ws://localhost:18789/ws}") String url,
                                        ObjectMapper objectMapper) {
        return new GatewayConnection(URI.create(url), HttpClient.newHttpClient(),
                new GatewayFrameCodec(objectMapper));
    }

    @Bean
    CronSyncEngine cronSyncEngine(GatewayConnection gatewayConnection,
                                  ThreadPoolTaskScheduler cronSyncScheduler,
                                  CronSyncSettings cronSyncSettings,
                                  ObjectMapper objectMapper) {
        return new CronSyncEngine(gatewayConnection, gatewayConnection,
                cronSyncScheduler.getScheduledExecutor(), cronSyncSettings, objectMapper);
    }
}
