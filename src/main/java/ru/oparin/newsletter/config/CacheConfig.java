package ru.oparin.newsletter.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.oparin.newsletter.service.cache.DeliveryRecord;

import java.time.Clock;
import java.time.Duration;

/**
 * Конфигурация кеширования для приложения.
 */
@Configuration
public class CacheConfig {

    /**
     * Кеш записей о доставке писем (ключ - отпечаток отправки).
     * Каждая запись живет столько, сколько указано в ней самой: маркер отправки - время аренды,
     * итог доставки - свой срок хранения.
     */
    @Bean
    public Cache<String, DeliveryRecord> deliveryRecordsCache(Clock clock) {
        return Caffeine.newBuilder()
                .maximumSize(1_000_000)
                .expireAfter(new Expiry<String, DeliveryRecord>() {
                    @Override
                    public long expireAfterCreate(String key, DeliveryRecord value, long currentTime) {
                        return remainingNanos(value, clock);
                    }

                    @Override
                    public long expireAfterUpdate(String key, DeliveryRecord value, long currentTime, long currentDuration) {
                        return remainingNanos(value, clock);
                    }

                    @Override
                    public long expireAfterRead(String key, DeliveryRecord value, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    private static long remainingNanos(DeliveryRecord record, Clock clock) {
        Duration remaining = Duration.between(clock.instant(), record.getExpiresAt());
        return remaining.isNegative() ? 0 : remaining.toNanos();
    }
}
