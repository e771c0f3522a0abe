package ru.oparin.newsletter.service.delivery;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Неблокирующее ожидание между попытками отправки.
 */
@FunctionalInterface
public interface Sleeper {

    Mono<Void> sleep(Duration delay);
}
