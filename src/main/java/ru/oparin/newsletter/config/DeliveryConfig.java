package ru.oparin.newsletter.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.publisher.Mono;
import ru.oparin.newsletter.config.properties.NewsletterProperties;
import ru.oparin.newsletter.service.delivery.BackoffPolicy;
import ru.oparin.newsletter.service.delivery.Sleeper;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Источники времени, случайности и ожидания для ядра.
 * Вынесены в бины, чтобы в тестах их можно было подменить.
 */
@Configuration
public class DeliveryConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BackoffPolicy backoffPolicy(NewsletterProperties properties) {
        return new BackoffPolicy(
                properties.getBackoffBase(),
                properties.getBackoffCap(),
                properties.getBackoffJitter(),
                () -> ThreadLocalRandom.current().nextDouble()
        );
    }

    @Bean
    public Sleeper sleeper() {
        return delay -> Mono.delay(delay).then();
    }
}
