package ru.oparin.newsletter.service.delivery;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;
import ru.oparin.newsletter.config.CacheConfig;
import ru.oparin.newsletter.config.properties.NewsletterProperties;
import ru.oparin.newsletter.exception.DeliveryFailedException;
import ru.oparin.newsletter.exception.EmailTransportException;
import ru.oparin.newsletter.model.dto.newsletter.BroadcastReport;
import ru.oparin.newsletter.model.dto.newsletter.FailedDelivery;
import ru.oparin.newsletter.model.entity.Subscriber;
import ru.oparin.newsletter.model.enums.DeliveryKind;
import ru.oparin.newsletter.model.enums.DeliveryOutcome;
import ru.oparin.newsletter.model.enums.SubscriptionStatus;
import ru.oparin.newsletter.service.cache.CaffeineIdempotencyCache;
import ru.oparin.newsletter.service.cache.LeaseResult;
import ru.oparin.newsletter.service.store.SubscriberStore;
import ru.oparin.newsletter.service.token.ConfirmationToken;
import ru.oparin.newsletter.service.transport.EmailTransport;
import ru.oparin.newsletter.support.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class DeliveryPipelineTest {

    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    @Mock
    private EmailTransport emailTransport;

    @Mock
    private SubscriberStore subscriberStore;

    private MutableClock clock;
    private CaffeineIdempotencyCache idempotencyCache;
    private NewsletterProperties properties;
    private List<Duration> sleeps;
    private DeliveryPipeline pipeline;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);

        clock = new MutableClock(START);
        idempotencyCache = new CaffeineIdempotencyCache(new CacheConfig().deliveryRecordsCache(clock), clock);
        sleeps = new CopyOnWriteArrayList<>();

        properties = new NewsletterProperties();
        properties.setBaseUrl("https://news.example.com");
        properties.setMaxSendRetries(3);
        properties.setSendTimeout(Duration.ofSeconds(2));
        properties.setBroadcastConcurrency(4);

        BackoffPolicy backoffPolicy = new BackoffPolicy(Duration.ofMillis(500), Duration.ofSeconds(30), 0.2, () -> 0.0);
        Sleeper sleeper = delay -> {
            sleeps.add(delay);
            return Mono.delay(Duration.ofMillis(5)).then();
        };

        pipeline = new DeliveryPipeline(emailTransport, idempotencyCache, subscriberStore,
                new EmailContentBuilder(properties), backoffPolicy, sleeper, properties);
    }

    @Test
    @DisplayName("Письмо подтверждения отправляется один раз, повторный вызов не обращается к транспорту")
    void confirmationSentOnce() {
        // Given
        Subscriber subscriber = subscriber("ursula@example.com");
        ConfirmationToken token = token(subscriber.getId());
        when(emailTransport.send(anyString(), anyString(), anyString(), anyString())).thenReturn(Mono.empty());

        // When / Then
        StepVerifier.create(pipeline.sendConfirmation(subscriber, token))
                .expectNext(DeliveryOutcome.SENT)
                .verifyComplete();
        StepVerifier.create(pipeline.sendConfirmation(subscriber, token))
                .expectNext(DeliveryOutcome.SENT)
                .verifyComplete();

        verify(emailTransport, times(1)).send(eq("ursula@example.com"), anyString(),
                argThat(html -> html.contains("https://news.example.com/subscriptions/confirm?token=" + token.encode())),
                argThat(text -> text.contains(token.encode())));
    }

    @Test
    @DisplayName("Временные ошибки повторяются с экспоненциальной задержкой")
    void transientErrorsAreRetried() {
        // Given
        when(emailTransport.send(anyString(), anyString(), anyString(), anyString()))
                .thenReturn(Mono.error(EmailTransportException.transientFailure("503", null)))
                .thenReturn(Mono.error(EmailTransportException.transientFailure("503", null)))
                .thenReturn(Mono.empty());

        // When / Then
        StepVerifier.create(pipeline.deliver(request(UUID.randomUUID(), "v1")))
                .expectNext(DeliveryOutcome.SENT)
                .verifyComplete();

        verify(emailTransport, times(3)).send(anyString(), anyString(), anyString(), anyString());
        assertThat(sleeps).containsExactly(Duration.ofMillis(500), Duration.ofMillis(1000));
    }

    @Test
    @DisplayName("После исчерпания попыток доставка фиксируется как неудачная, повтор возвращает ту же ошибку")
    void exhaustedRetriesSettleAsFailed() {
        // Given
        UUID subscriberId = UUID.randomUUID();
        DeliveryRequest request = request(subscriberId, "v1");
        when(emailTransport.send(anyString(), anyString(), anyString(), anyString()))
                .thenReturn(Mono.error(EmailTransportException.transientFailure("connection reset", null)));

        // When / Then
        StepVerifier.create(pipeline.deliver(request))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(DeliveryFailedException.class);
                    DeliveryFailedException failed = (DeliveryFailedException) error;
                    assertThat(failed.getSubscriberId()).isEqualTo(subscriberId);
                    assertThat(failed.getKind()).isEqualTo(DeliveryKind.NEWSLETTER_ISSUE);
                    assertThat(failed.getReason()).contains("connection reset");
                })
                .verify();
        verify(emailTransport, times(3)).send(anyString(), anyString(), anyString(), anyString());

        StepVerifier.create(pipeline.deliver(request))
                .expectError(DeliveryFailedException.class)
                .verify();
        verify(emailTransport, times(3)).send(anyString(), anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("Постоянная ошибка не повторяется")
    void permanentErrorIsNotRetried() {
        when(emailTransport.send(anyString(), anyString(), anyString(), anyString()))
                .thenReturn(Mono.error(EmailTransportException.permanentFailure("422 invalid recipient", null)));

        StepVerifier.create(pipeline.deliver(request(UUID.randomUUID(), "v1")))
                .expectErrorMatches(error -> error instanceof DeliveryFailedException
                        && ((DeliveryFailedException) error).getReason().contains("422"))
                .verify();

        verify(emailTransport, times(1)).send(anyString(), anyString(), anyString(), anyString());
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("Превышение таймаута отправки считается временной ошибкой")
    void timeoutIsTransient() {
        properties.setSendTimeout(Duration.ofMillis(50));
        when(emailTransport.send(anyString(), anyString(), anyString(), anyString()))
                .thenReturn(Mono.never())
                .thenReturn(Mono.empty());

        StepVerifier.create(pipeline.deliver(request(UUID.randomUUID(), "v1")))
                .expectNext(DeliveryOutcome.SENT)
                .verifyComplete();

        verify(emailTransport, times(2)).send(anyString(), anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("Параллельные одинаковые отправки приводят к одному вызову транспорта и одинаковому итогу")
    void concurrentIdenticalDeliveriesSendOnce() {
        // Given
        when(emailTransport.send(anyString(), anyString(), anyString(), anyString()))
                .thenReturn(Mono.delay(Duration.ofMillis(100)).then());
        DeliveryRequest request = request(UUID.randomUUID(), "v1");

        // When / Then
        StepVerifier.create(Mono.zip(pipeline.deliver(request), pipeline.deliver(request)))
                .assertNext(outcomes -> {
                    assertThat(outcomes.getT1()).isEqualTo(DeliveryOutcome.SENT);
                    assertThat(outcomes.getT2()).isEqualTo(DeliveryOutcome.SENT);
                })
                .verifyComplete();

        verify(emailTransport, times(1)).send(anyString(), anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("Отмена ожидающего не прерывает начатую отправку, итог фиксируется в кеше")
    void cancelledDeliverySettlesLease() {
        // Given
        Sinks.Empty<Void> transportReply = Sinks.empty();
        when(emailTransport.send(anyString(), anyString(), anyString(), anyString())).thenReturn(transportReply.asMono());
        DeliveryRequest request = request(UUID.randomUUID(), "v1");

        // When
        Disposable subscription = pipeline.deliver(request).subscribe();
        subscription.dispose();
        transportReply.tryEmitEmpty();

        // Then
        StepVerifier.create(idempotencyCache.tryBegin(request.fingerprint(), Duration.ofMinutes(1)))
                .assertNext(lease -> {
                    assertThat(lease.getState()).isEqualTo(LeaseResult.State.SETTLED);
                    assertThat(lease.getOutcome()).isEqualTo(DeliveryOutcome.SENT);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Прерванная клиентом рассылка не приводит к повторной отправке при новой публикации")
    void cancelledBroadcastDoesNotResend() {
        // Given
        Subscriber subscriber = subscriber("reader@example.com");
        when(subscriberStore.listConfirmed()).thenAnswer(invocation -> Flux.just(subscriber));
        when(emailTransport.send(anyString(), anyString(), anyString(), anyString()))
                .thenReturn(Mono.delay(Duration.ofMillis(300)).then());
        NewsletterIssue issue = NewsletterIssue.of("issue-4", "Выпуск 4", "текст", "<p>текст</p>");

        // When
        Disposable firstPublish = pipeline.broadcastIssue(issue).subscribe();
        Mono.delay(Duration.ofMillis(100)).block();
        firstPublish.dispose();
        BroadcastReport second = pipeline.broadcastIssue(issue).block(Duration.ofSeconds(5));

        // Then
        assertThat(second).isNotNull();
        assertThat(second.getSent()).isEqualTo(1);
        assertThat(second.getFailed()).isEmpty();
        verify(emailTransport, times(1)).send(anyString(), anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("Рассылка на N подписчиков с K постоянными ошибками дает отчет N-K / K")
    void broadcastReportsPartialFailures() {
        // Given
        List<Subscriber> subscribers = IntStream.range(0, 10)
                .mapToObj(i -> subscriber("reader" + i + "@example.com"))
                .collect(Collectors.toList());
        Set<String> rejected = Set.of("reader3@example.com", "reader7@example.com");
        when(subscriberStore.listConfirmed()).thenAnswer(invocation -> Flux.fromIterable(subscribers));
        when(emailTransport.send(anyString(), anyString(), anyString(), anyString()))
                .thenAnswer(invocation -> rejected.contains(invocation.<String>getArgument(0))
                        ? Mono.error(EmailTransportException.permanentFailure("mailbox unavailable", null))
                        : Mono.empty());
        NewsletterIssue issue = NewsletterIssue.of("issue-1", "Выпуск 1", "текст", "<p>текст</p>");

        // When
        BroadcastReport report = pipeline.broadcastIssue(issue).block();

        // Then
        assertThat(report).isNotNull();
        assertThat(report.getContentVersion()).isEqualTo("issue-1");
        assertThat(report.getSent()).isEqualTo(8);
        assertThat(report.isInterrupted()).isFalse();
        assertThat(report.getFailed())
                .extracting(FailedDelivery::getSubscriberId)
                .containsExactlyInAnyOrder(subscribers.get(3).getId(), subscribers.get(7).getId());
        verify(emailTransport, times(10)).send(anyString(), anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("Повторная публикация того же выпуска не отправляет письмо повторно")
    void rebroadcastSkipsDeliveredRecipients() {
        List<Subscriber> subscribers = List.of(subscriber("a@example.com"), subscriber("b@example.com"));
        when(subscriberStore.listConfirmed()).thenAnswer(invocation -> Flux.fromIterable(subscribers));
        when(emailTransport.send(anyString(), anyString(), anyString(), anyString())).thenReturn(Mono.empty());
        NewsletterIssue issue = NewsletterIssue.of("issue-2", "Выпуск 2", "текст", "<p>текст</p>");

        pipeline.broadcastIssue(issue).block();
        BroadcastReport second = pipeline.broadcastIssue(issue).block();

        assertThat(second).isNotNull();
        assertThat(second.getSent()).isEqualTo(2);
        assertThat(second.getFailed()).isEmpty();
        verify(emailTransport, times(2)).send(anyString(), anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("Остановка приложения прерывает выборку получателей и помечает отчет")
    void shutdownInterruptsBroadcast() {
        Subscriber first = subscriber("first@example.com");
        when(subscriberStore.listConfirmed()).thenReturn(Flux.concat(Flux.just(first), Flux.never()));
        when(emailTransport.send(anyString(), anyString(), anyString(), anyString())).thenReturn(Mono.empty());
        NewsletterIssue issue = NewsletterIssue.of("issue-3", "Выпуск 3", "текст", "<p>текст</p>");

        StepVerifier.create(pipeline.broadcastIssue(issue))
                .then(pipeline::shutdown)
                .assertNext(report -> {
                    assertThat(report.isInterrupted()).isTrue();
                    assertThat(report.getSent()).isEqualTo(1);
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    private DeliveryRequest request(UUID subscriberId, String contentVersion) {
        return DeliveryRequest.builder()
                .kind(DeliveryKind.NEWSLETTER_ISSUE)
                .subscriberId(subscriberId)
                .recipient("reader@example.com")
                .subject("Тема")
                .htmlContent("<p>Текст</p>")
                .textContent("Текст")
                .contentVersion(contentVersion)
                .build();
    }

    private static Subscriber subscriber(String email) {
        return Subscriber.builder()
                .id(UUID.randomUUID())
                .email(email)
                .name("Reader")
                .status(SubscriptionStatus.CONFIRMED)
                .build();
    }

    private static ConfirmationToken token(UUID subscriberId) {
        return new ConfirmationToken(subscriberId, START, START.plus(Duration.ofHours(24)), "signature");
    }
}
