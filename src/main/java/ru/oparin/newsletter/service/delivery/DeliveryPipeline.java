package ru.oparin.newsletter.service.delivery;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import ru.oparin.newsletter.config.properties.NewsletterProperties;
import ru.oparin.newsletter.exception.DeliveryFailedException;
import ru.oparin.newsletter.exception.EmailTransportException;
import ru.oparin.newsletter.model.dto.newsletter.BroadcastReport;
import ru.oparin.newsletter.model.dto.newsletter.FailedDelivery;
import ru.oparin.newsletter.model.entity.Subscriber;
import ru.oparin.newsletter.model.enums.DeliveryOutcome;
import ru.oparin.newsletter.service.cache.IdempotencyCache;
import ru.oparin.newsletter.service.cache.LeaseResult;
import ru.oparin.newsletter.service.store.SubscriberStore;
import ru.oparin.newsletter.service.token.ConfirmationToken;
import ru.oparin.newsletter.service.transport.EmailTransport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Конвейер доставки писем.
 * Каждое письмо отправляется не более одного раза на отпечаток: перед вызовом транспорта
 * захватывается аренда в кеше идемпотентности, после отправки фиксируется итог.
 * Временные ошибки транспорта повторяются с экспоненциальной задержкой,
 * постоянные и исчерпанные попытки фиксируются как PERMANENTLY_FAILED.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeliveryPipeline {

    private static final String PREVIOUSLY_FAILED = "предыдущая попытка доставки завершилась неудачей";
    private static final String STILL_IN_FLIGHT = "письмо все еще отправляется другим обработчиком";

    private final EmailTransport emailTransport;
    private final IdempotencyCache idempotencyCache;
    private final SubscriberStore subscriberStore;
    private final EmailContentBuilder emailContentBuilder;
    private final BackoffPolicy backoffPolicy;
    private final Sleeper sleeper;
    private final NewsletterProperties properties;

    private final Sinks.One<Boolean> shutdownSignal = Sinks.one();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    /**
     * Отправляет письмо подтверждения подписки.
     * Повторный вызов с тем же токеном не приводит к повторной отправке.
     */
    public Mono<DeliveryOutcome> sendConfirmation(Subscriber subscriber, ConfirmationToken token) {
        return Mono.defer(() -> deliver(emailContentBuilder.confirmation(subscriber, token)));
    }

    /**
     * Рассылает выпуск всем подтвержденным подписчикам.
     * Ошибка доставки одному подписчику не прерывает рассылку, а попадает в отчет.
     */
    public Mono<BroadcastReport> broadcastIssue(NewsletterIssue issue) {
        return Mono.defer(() -> {
            BroadcastTally tally = new BroadcastTally(issue.getContentVersion());
            log.info("Начата рассылка выпуска {}", issue.getContentVersion());

            return subscriberStore.listConfirmed()
                    .takeUntilOther(shutdownSignal.asMono())
                    .flatMap(subscriber -> deliverToRecipient(subscriber, issue, tally),
                            properties.getBroadcastConcurrency())
                    .then(Mono.fromSupplier(() -> tally.toReport(shuttingDown.get())))
                    .doOnNext(report -> log.info("Рассылка выпуска {} завершена: доставлено {}, ошибок {}, прервана: {}",
                            report.getContentVersion(), report.getSent(), report.getFailed().size(), report.isInterrupted()));
        });
    }

    /**
     * Доставляет одно письмо с учетом кеша идемпотентности.
     * Если письмо уже доставлено, транспорт не вызывается; если доставка уже завершилась неудачей,
     * возвращается та же ошибка.
     */
    public Mono<DeliveryOutcome> deliver(DeliveryRequest request) {
        return Mono.defer(() -> attempt(request, request.fingerprint(), 1));
    }

    /**
     * Прекращает выборку новых получателей в идущих рассылках.
     * Уже начатые отправки завершаются и фиксируют свой итог.
     */
    @PreDestroy
    public void shutdown() {
        if (shuttingDown.compareAndSet(false, true)) {
            log.info("Остановка конвейера доставки: новые получатели рассылок не выбираются");
            shutdownSignal.tryEmitValue(Boolean.TRUE);
        }
    }

    private Mono<Void> deliverToRecipient(Subscriber subscriber, NewsletterIssue issue, BroadcastTally tally) {
        return deliver(emailContentBuilder.issue(subscriber, issue))
                .doOnNext(outcome -> tally.recordSent())
                .onErrorResume(error -> {
                    String reason = error instanceof DeliveryFailedException deliveryFailed
                            ? deliveryFailed.getReason()
                            : describe(error);
                    tally.recordFailure(subscriber.getId(), reason);
                    return Mono.empty();
                })
                .then();
    }

    private Mono<DeliveryOutcome> attempt(DeliveryRequest request, String fingerprint, int attempt) {
        return acquire(request, fingerprint, 0)
                .flatMap(lease -> {
                    if (lease.getState() == LeaseResult.State.GRANTED) {
                        return detached(transmit(request, fingerprint, attempt));
                    }
                    if (lease.getOutcome() == DeliveryOutcome.SENT) {
                        log.debug("Письмо {} подписчику {} уже доставлено", request.getKind(), request.getSubscriberId());
                        return Mono.just(DeliveryOutcome.SENT);
                    }
                    return Mono.error(new DeliveryFailedException(
                            request.getSubscriberId(), request.getKind(), PREVIOUSLY_FAILED));
                });
    }

    /**
     * Запускает отправку с захваченной арендой в собственной подписке конвейера.
     * Отмена со стороны вызывающего не прерывает отправку: она завершается и фиксирует итог в кеше.
     */
    private Mono<DeliveryOutcome> detached(Mono<DeliveryOutcome> send) {
        Sinks.One<DeliveryOutcome> result = Sinks.one();
        send.subscribe(result::tryEmitValue, result::tryEmitError);
        return result.asMono();
    }

    /**
     * Захватывает аренду; пока отправку выполняет другой обработчик, опрашивает кеш.
     * Возвращает GRANTED или SETTLED.
     */
    private Mono<LeaseResult> acquire(DeliveryRequest request, String fingerprint, int polls) {
        return idempotencyCache.tryBegin(fingerprint, properties.getLeaseTtl())
                .flatMap(lease -> {
                    if (lease.getState() != LeaseResult.State.IN_FLIGHT) {
                        return Mono.just(lease);
                    }
                    if (polls >= maxPolls()) {
                        log.warn("Не дождались завершения чужой отправки письма {} подписчику {}",
                                request.getKind(), request.getSubscriberId());
                        return Mono.error(new DeliveryFailedException(
                                request.getSubscriberId(), request.getKind(), STILL_IN_FLIGHT));
                    }
                    return sleeper.sleep(properties.getInFlightPollInterval())
                            .then(Mono.defer(() -> acquire(request, fingerprint, polls + 1)));
                });
    }

    private Mono<DeliveryOutcome> transmit(DeliveryRequest request, String fingerprint, int attempt) {
        return emailTransport.send(request.getRecipient(), request.getSubject(),
                        request.getHtmlContent(), request.getTextContent())
                .timeout(properties.getSendTimeout())
                .then(Mono.<Throwable>empty())
                .onErrorResume(Mono::just)
                .flatMap(error -> handleFailure(request, fingerprint, attempt, error))
                .switchIfEmpty(Mono.defer(() -> idempotencyCache
                        .settle(fingerprint, DeliveryOutcome.SENT, properties.getSentTtl())
                        .doOnSuccess(v -> log.info("Письмо {} доставлено подписчику {} с попытки {}",
                                request.getKind(), request.getSubscriberId(), attempt))
                        .thenReturn(DeliveryOutcome.SENT)));
    }

    private Mono<DeliveryOutcome> handleFailure(DeliveryRequest request, String fingerprint, int attempt, Throwable error) {
        boolean transientFailure = isTransient(error);
        int maxAttempts = properties.getMaxSendRetries();

        if (transientFailure && attempt < maxAttempts) {
            Duration delay = backoffPolicy.delayFor(attempt);
            log.warn("Временная ошибка отправки письма {} подписчику {} (попытка {} из {}), повтор через {} мс: {}",
                    request.getKind(), request.getSubscriberId(), attempt, maxAttempts, delay.toMillis(), describe(error));
            return idempotencyCache.release(fingerprint)
                    .then(sleeper.sleep(delay))
                    .then(Mono.defer(() -> attempt(request, fingerprint, attempt + 1)));
        }

        String reason = transientFailure
                ? String.format("исчерпаны попытки отправки (%d): %s", attempt, describe(error))
                : describe(error);
        log.error("Не удалось доставить письмо {} подписчику {}: {}", request.getKind(), request.getSubscriberId(), reason);
        return idempotencyCache.settle(fingerprint, DeliveryOutcome.PERMANENTLY_FAILED, properties.getFailedTtl())
                .then(Mono.error(new DeliveryFailedException(request.getSubscriberId(), request.getKind(), reason, error)));
    }

    private int maxPolls() {
        long pollMillis = Math.max(1, properties.getInFlightPollInterval().toMillis());
        return (int) Math.max(1, properties.getInFlightMaxWait().toMillis() / pollMillis);
    }

    static boolean isTransient(Throwable error) {
        if (error instanceof EmailTransportException transportError) {
            return transportError.isTransientFailure();
        }
        return error instanceof TimeoutException;
    }

    private static String describe(Throwable error) {
        if (error instanceof TimeoutException) {
            return "превышено время ожидания почтового сервиса";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private static class BroadcastTally {

        private final String contentVersion;
        private final AtomicInteger sent = new AtomicInteger();
        private final ConcurrentLinkedQueue<FailedDelivery> failed = new ConcurrentLinkedQueue<>();

        BroadcastTally(String contentVersion) {
            this.contentVersion = contentVersion;
        }

        void recordSent() {
            sent.incrementAndGet();
        }

        void recordFailure(UUID subscriberId, String reason) {
            failed.add(new FailedDelivery(subscriberId, reason));
        }

        BroadcastReport toReport(boolean interrupted) {
            return BroadcastReport.builder()
                    .contentVersion(contentVersion)
                    .sent(sent.get())
                    .failed(new ArrayList<>(failed))
                    .interrupted(interrupted)
                    .build();
        }
    }
}
