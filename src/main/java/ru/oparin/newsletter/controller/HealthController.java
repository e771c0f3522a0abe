package ru.oparin.newsletter.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import ru.oparin.newsletter.service.HealthService;

import java.util.Map;

@RestController
@RequiredArgsConstructor
@RequestMapping("/health")
public class HealthController {

    private final HealthService healthService;

    @GetMapping
    public Mono<ResponseEntity<Map<String, Object>>> healthCheck() {
        return Mono.just(ResponseEntity.ok(healthService.getBasicHealth()));
    }

    @GetMapping("/database")
    public Mono<ResponseEntity<Map<String, Object>>> databaseHealth() {
        return healthService.getDatabaseHealth()
                .map(dbHealth -> "ERROR".equals(dbHealth.get("status"))
                        ? ResponseEntity.status(503).body(dbHealth)
                        : ResponseEntity.ok(dbHealth));
    }
}
