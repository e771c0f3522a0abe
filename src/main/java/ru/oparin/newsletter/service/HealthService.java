package ru.oparin.newsletter.service;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@Service
public class HealthService {

    private final DatabaseClient databaseClient;
    private final Clock clock;

    public HealthService(DatabaseClient databaseClient, Clock clock) {
        this.databaseClient = databaseClient;
        this.clock = clock;
    }

    public Map<String, Object> getBasicHealth() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("timestamp", LocalDateTime.now(clock));
        health.put("service", "newsletter-subscriber");
        return health;
    }

    public Mono<Map<String, Object>> getDatabaseHealth() {
        Map<String, Object> health = new HashMap<>();

        return databaseClient.sql("SELECT 1")
                .fetch()
                .first()
                .map(result -> {
                    health.put("status", "CONNECTED");
                    return health;
                })
                .onErrorResume(e -> {
                    health.put("status", "ERROR");
                    health.put("error", e.getMessage());
                    return Mono.just(health);
                });
    }
}
