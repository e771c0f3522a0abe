package ru.oparin.newsletter.config;

import io.r2dbc.spi.R2dbcTransientException;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

@Configuration
@EnableR2dbcRepositories(basePackages = "ru.oparin.newsletter.repository")
public class DatabaseConfig {

    /**
     * Обертка для Mono с retry логикой при потере связи с БД.
     * Нарушения ограничений и прочие ошибки данных не повторяются.
     */
    public static <T> Mono<T> withRetry(Mono<T> mono) {
        return mono.retryWhen(Retry.backoff(3, Duration.ofSeconds(1))
                .maxBackoff(Duration.ofSeconds(5))
                .jitter(0.1)
                .filter(DatabaseConfig::isTransient));
    }

    static boolean isTransient(Throwable error) {
        return error instanceof TransientDataAccessException
                || error instanceof DataAccessResourceFailureException
                || error instanceof R2dbcTransientException;
    }
}
