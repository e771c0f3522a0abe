package ru.oparin.newsletter.service.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.newsletter.config.properties.NewsletterProperties;
import ru.oparin.newsletter.exception.DuplicateEmailException;
import ru.oparin.newsletter.exception.SubscriberNotFoundException;
import ru.oparin.newsletter.model.entity.Subscriber;
import ru.oparin.newsletter.model.enums.SubscriptionStatus;
import ru.oparin.newsletter.repository.SubscriberRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;

import static ru.oparin.newsletter.config.DatabaseConfig.withRetry;

@Slf4j
@Service
@RequiredArgsConstructor
public class R2dbcSubscriberStore implements SubscriberStore {

    private final SubscriberRepository subscriberRepository;
    private final R2dbcEntityTemplate r2dbcEntityTemplate;
    private final NewsletterProperties properties;
    private final Clock clock;

    @Override
    public Mono<Subscriber> insertPending(String email, String name) {
        return Mono.defer(() -> {
                    Subscriber subscriber = Subscriber.builder()
                            .id(UUID.randomUUID())
                            .email(email)
                            .name(name)
                            .status(SubscriptionStatus.PENDING_CONFIRMATION)
                            .subscribedAt(LocalDateTime.now(clock))
                            .build();
                    return withRetry(r2dbcEntityTemplate.insert(subscriber))
                            .onErrorResume(DataIntegrityViolationException.class,
                                    e -> resolveConflict(subscriber, e));
                })
                .doOnSuccess(saved -> log.info("Создан подписчик {} со статусом {}", saved.getId(), saved.getStatus()));
    }

    /**
     * Конфликт уникальности после повтора вставки может означать, что первая попытка
     * зафиксировалась до обрыва соединения. Тогда запись с тем же id считается успешной вставкой.
     */
    private Mono<Subscriber> resolveConflict(Subscriber subscriber, DataIntegrityViolationException e) {
        return withRetry(subscriberRepository.findByEmail(subscriber.getEmail()))
                .filter(existing -> subscriber.getId().equals(existing.getId()))
                .doOnNext(existing -> log.warn("Вставка подписчика {} уже была зафиксирована до повтора", existing.getId()))
                .switchIfEmpty(Mono.defer(() -> {
                    log.info("Попытка повторной подписки на существующий email");
                    return Mono.error(new DuplicateEmailException(subscriber.getEmail(), e));
                }));
    }

    @Override
    public Mono<Boolean> markConfirmed(UUID subscriberId) {
        return withRetry(subscriberRepository.confirmIfPending(subscriberId))
                .flatMap(updated -> {
                    if (updated > 0) {
                        log.info("Подписка {} подтверждена", subscriberId);
                        return Mono.just(true);
                    }
                    return withRetry(subscriberRepository.existsById(subscriberId))
                            .flatMap(exists -> exists
                                    ? Mono.just(false)
                                    : Mono.error(new SubscriberNotFoundException("Подписчик не найден: " + subscriberId)));
                });
    }

    @Override
    public Flux<Subscriber> listConfirmed() {
        int pageSize = properties.getStorePageSize();
        return fetchPage(null, pageSize)
                .expand(page -> page.size() < pageSize
                        ? Mono.empty()
                        : fetchPage(page.get(page.size() - 1).getId(), pageSize))
                .flatMapIterable(Function.identity());
    }

    @Override
    public Mono<Subscriber> findById(UUID subscriberId) {
        return withRetry(subscriberRepository.findById(subscriberId));
    }

    @Override
    public Mono<Subscriber> findByEmail(String email) {
        return withRetry(subscriberRepository.findByEmail(email));
    }

    private Mono<List<Subscriber>> fetchPage(UUID after, int pageSize) {
        Flux<Subscriber> page = after == null
                ? subscriberRepository.findFirstConfirmed(pageSize)
                : subscriberRepository.findConfirmedAfter(after, pageSize);
        return withRetry(page.collectList())
                .doOnNext(subscribers -> log.debug("Загружена страница подтвержденных подписчиков: {} записей", subscribers.size()));
    }
}
