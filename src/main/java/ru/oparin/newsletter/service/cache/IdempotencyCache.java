package ru.oparin.newsletter.service.cache;

import reactor.core.publisher.Mono;
import ru.oparin.newsletter.model.enums.DeliveryOutcome;

import java.time.Duration;

/**
 * Хранилище ключ-значение для дедупликации отправок.
 * Защищает от повторной отправки при повторных запросах, перезапуске процесса посреди отправки
 * и параллельной работе нескольких обработчиков рассылки.
 */
public interface IdempotencyCache {

    /**
     * Атомарная проверка с захватом: право на отправку получает только один вызывающий,
     * пока отправка не завершена или не истекла аренда.
     *
     * @param fingerprint отпечаток отправки
     * @param leaseTtl    время жизни маркера отправки
     */
    Mono<LeaseResult> tryBegin(String fingerprint, Duration leaseTtl);

    /**
     * Фиксирует итог отправки вместо маркера.
     */
    Mono<Void> settle(String fingerprint, DeliveryOutcome outcome, Duration ttl);

    /**
     * Снимает маркер после временной ошибки, чтобы повторная попытка могла захватить его до истечения аренды.
     * Зафиксированный итог не трогает.
     */
    Mono<Void> release(String fingerprint);
}
