package ru.oparin.newsletter.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import ru.oparin.newsletter.model.enums.DeliveryOutcome;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Кеш идемпотентности на Caffeine.
 * Атомарность обеспечивается через compute на ConcurrentMap-представлении кеша;
 * просроченная запись считается отсутствующей, даже если Caffeine еще не успел ее вытеснить.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CaffeineIdempotencyCache implements IdempotencyCache {

    private final Cache<String, DeliveryRecord> deliveryRecordsCache;
    private final Clock clock;

    @Override
    public Mono<LeaseResult> tryBegin(String fingerprint, Duration leaseTtl) {
        return Mono.fromSupplier(() -> {
            Instant now = clock.instant();
            AtomicReference<LeaseResult> result = new AtomicReference<>();

            deliveryRecordsCache.asMap().compute(fingerprint, (key, existing) -> {
                if (existing == null || existing.isExpiredAt(now)) {
                    result.set(LeaseResult.granted());
                    return DeliveryRecord.inFlight(now, leaseTtl);
                }
                result.set(existing.toLeaseResult());
                return existing;
            });

            log.debug("Захват отправки {}: {}", fingerprint, result.get().getState());
            return result.get();
        });
    }

    @Override
    public Mono<Void> settle(String fingerprint, DeliveryOutcome outcome, Duration ttl) {
        return Mono.fromRunnable(() -> {
            deliveryRecordsCache.put(fingerprint, DeliveryRecord.settled(outcome, clock.instant(), ttl));
            log.debug("Отправка {} завершена с итогом {}", fingerprint, outcome);
        });
    }

    @Override
    public Mono<Void> release(String fingerprint) {
        return Mono.fromRunnable(() ->
                deliveryRecordsCache.asMap().computeIfPresent(fingerprint,
                        (key, existing) -> existing.isInFlight() ? null : existing));
    }
}
