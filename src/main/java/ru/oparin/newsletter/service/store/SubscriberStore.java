package ru.oparin.newsletter.service.store;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.newsletter.model.entity.Subscriber;

import java.util.UUID;

/**
 * Хранилище подписчиков.
 * Уникальность email и однократность подтверждения гарантируются самим хранилищем,
 * а не проверками на стороне приложения.
 */
public interface SubscriberStore {

    /**
     * Атомарно создает подписчика в статусе PENDING_CONFIRMATION.
     * При нарушении уникальности email завершается ошибкой DuplicateEmailException.
     *
     * @param email нормализованный email
     * @param name  нормализованное имя
     */
    Mono<Subscriber> insertPending(String email, String name);

    /**
     * Условно переводит подписчика в CONFIRMED.
     *
     * @return true, если статус изменился; false, если подписка уже была подтверждена.
     * Для отсутствующего подписчика - ошибка SubscriberNotFoundException
     */
    Mono<Boolean> markConfirmed(UUID subscriberId);

    /**
     * Ленивая постраничная выборка подтвержденных подписчиков.
     * Повторная подписка на результат начинает обход заново.
     */
    Flux<Subscriber> listConfirmed();

    Mono<Subscriber> findById(UUID subscriberId);

    Mono<Subscriber> findByEmail(String email);
}
