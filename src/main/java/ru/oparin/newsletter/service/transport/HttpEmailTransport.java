package ru.oparin.newsletter.service.transport;

import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import ru.oparin.newsletter.config.properties.EmailProperties;
import ru.oparin.newsletter.exception.EmailTransportException;
import ru.oparin.newsletter.model.dto.email.SendEmailRequest;

import java.util.concurrent.TimeoutException;

/**
 * Отправка писем через HTTP API почтового сервиса.
 * 5xx, 429, таймауты и ошибки соединения считаются временными, остальные 4xx - постоянными.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.email", name = "transport", havingValue = "http")
public class HttpEmailTransport implements EmailTransport {

    static final String SERVER_TOKEN_HEADER = "X-Postmark-Server-Token";

    private final WebClient webClient;
    private final EmailProperties emailProperties;

    public HttpEmailTransport(WebClient.Builder webClientBuilder, EmailProperties emailProperties) {
        this.emailProperties = emailProperties;
        EmailProperties.Http http = emailProperties.getHttp();

        if (http.getAuthorizationToken() == null || http.getAuthorizationToken().isEmpty()) {
            log.warn("Токен почтового API не настроен");
        }

        HttpClient httpClient = HttpClient.create()
                .responseTimeout(http.getResponseTimeout())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) http.getConnectTimeout().toMillis());

        this.webClient = webClientBuilder
                .baseUrl(http.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(SERVER_TOKEN_HEADER, http.getAuthorizationToken())
                .build();
    }

    @Override
    public Mono<Void> send(String to, String subject, String htmlBody, String textBody) {
        SendEmailRequest request = SendEmailRequest.builder()
                .from(emailProperties.getFrom())
                .to(to)
                .subject(subject)
                .htmlBody(htmlBody)
                .textBody(textBody)
                .build();

        return webClient.post()
                .uri("/email")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .toBodilessEntity()
                .doOnSuccess(response -> log.debug("Письмо \"{}\" принято почтовым API для {}", subject, to))
                .onErrorMap(error -> !(error instanceof EmailTransportException), this::classify)
                .then();
    }

    EmailTransportException classify(Throwable error) {
        if (error instanceof WebClientResponseException responseException) {
            HttpStatus status = HttpStatus.resolve(responseException.getStatusCode().value());
            boolean retryable = responseException.getStatusCode().is5xxServerError()
                    || status == HttpStatus.TOO_MANY_REQUESTS
                    || status == HttpStatus.REQUEST_TIMEOUT;
            String message = String.format("Почтовый API ответил %s: %s",
                    responseException.getStatusCode().value(), responseException.getResponseBodyAsString());
            return retryable
                    ? EmailTransportException.transientFailure(message, error)
                    : EmailTransportException.permanentFailure(message, error);
        }
        if (error instanceof WebClientRequestException || error instanceof TimeoutException) {
            return EmailTransportException.transientFailure("Почтовый API недоступен: " + error.getMessage(), error);
        }
        return EmailTransportException.permanentFailure("Непредвиденная ошибка почтового API: " + error.getMessage(), error);
    }
}
