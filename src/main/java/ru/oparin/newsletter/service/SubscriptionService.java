package ru.oparin.newsletter.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.newsletter.config.properties.NewsletterProperties;
import ru.oparin.newsletter.exception.SubscriberNotFoundException;
import ru.oparin.newsletter.model.dto.subscription.ConfirmationResponse;
import ru.oparin.newsletter.model.dto.subscription.SubscriptionResponse;
import ru.oparin.newsletter.model.entity.Subscriber;
import ru.oparin.newsletter.model.enums.SubscriptionStatus;
import ru.oparin.newsletter.service.delivery.DeliveryPipeline;
import ru.oparin.newsletter.service.store.SubscriberStore;
import ru.oparin.newsletter.service.token.ConfirmationToken;
import ru.oparin.newsletter.service.token.TokenCodec;
import ru.oparin.newsletter.util.SubscriberValidator;

import java.util.UUID;

/**
 * Жизненный цикл подписки: PENDING_CONFIRMATION -> CONFIRMED.
 * Изменение в хранилище и отправка письма не выполняются атомарно:
 * если письмо не доставлено, подписчик остается неподтвержденным и может запросить письмо повторно.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionService {

    private final SubscriberStore subscriberStore;
    private final TokenCodec tokenCodec;
    private final DeliveryPipeline deliveryPipeline;
    private final NewsletterProperties properties;

    /**
     * Оформляет подписку и отправляет письмо подтверждения.
     *
     * @throws jakarta.validation.ValidationException                 некорректные email или имя
     * @throws ru.oparin.newsletter.exception.DuplicateEmailException  email уже подписан
     * @throws ru.oparin.newsletter.exception.DeliveryFailedException  письмо подтверждения не доставлено
     */
    public Mono<SubscriptionResponse> subscribe(String email, String name) {
        return Mono.defer(() -> subscriberStore.insertPending(
                        SubscriberValidator.normalizeEmail(email),
                        SubscriberValidator.normalizeName(name)))
                .flatMap(this::sendConfirmation);
    }

    /**
     * Подтверждает подписку по токену из письма.
     * Повторный переход по действующей ссылке тоже считается успешным.
     *
     * @throws ru.oparin.newsletter.exception.InvalidTokenException      токен поврежден, подделан или истек
     * @throws SubscriberNotFoundException                               подписчика из токена нет в хранилище
     */
    public Mono<ConfirmationResponse> confirm(String token) {
        return Mono.fromCallable(() -> tokenCodec.verify(token))
                .flatMap(subscriberId -> subscriberStore.markConfirmed(subscriberId)
                        .onErrorMap(SubscriberNotFoundException.class, e -> {
                            log.warn("Токен подтверждения указывает на несуществующего подписчика {}", subscriberId);
                            return new SubscriberNotFoundException(e.getMessage(), HttpStatus.UNAUTHORIZED);
                        })
                        .map(transitioned -> buildConfirmationResponse(subscriberId, transitioned)));
    }

    /**
     * Повторно отправляет письмо подтверждения с новым токеном.
     * Для уже подтвержденной подписки ничего не отправляет.
     *
     * @throws SubscriberNotFoundException подписка с таким email не найдена
     */
    public Mono<SubscriptionResponse> resendConfirmation(String email) {
        return Mono.fromCallable(() -> SubscriberValidator.normalizeEmail(email))
                .flatMap(normalized -> subscriberStore.findByEmail(normalized)
                        .switchIfEmpty(Mono.error(new SubscriberNotFoundException("Подписка с таким email не найдена"))))
                .flatMap(subscriber -> {
                    if (subscriber.isConfirmed()) {
                        log.info("Подписка {} уже подтверждена, письмо не отправляется", subscriber.getId());
                        return Mono.just(SubscriptionResponse.builder()
                                .subscriberId(subscriber.getId())
                                .email(subscriber.getEmail())
                                .status(SubscriptionStatus.CONFIRMED)
                                .build());
                    }
                    log.info("Повторная отправка письма подтверждения подписчику {}", subscriber.getId());
                    return sendConfirmation(subscriber);
                });
    }

    private Mono<SubscriptionResponse> sendConfirmation(Subscriber subscriber) {
        ConfirmationToken token = tokenCodec.issue(subscriber.getId(), properties.getTokenTtl());
        return deliveryPipeline.sendConfirmation(subscriber, token)
                .map(outcome -> SubscriptionResponse.builder()
                        .subscriberId(subscriber.getId())
                        .email(subscriber.getEmail())
                        .status(subscriber.getStatus())
                        .confirmationDelivery(outcome)
                        .build());
    }

    private ConfirmationResponse buildConfirmationResponse(UUID subscriberId, boolean transitioned) {
        return ConfirmationResponse.builder()
                .subscriberId(subscriberId)
                .alreadyConfirmed(!transitioned)
                .message(transitioned ? "Подписка подтверждена" : "Подписка уже была подтверждена ранее")
                .build();
    }
}
