package ru.oparin.newsletter.config.properties;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import ru.oparin.newsletter.model.enums.EmailTransportType;

import java.time.Duration;

/**
 * Настройки отправки писем.
 * Загружаются из application.yml с префиксом app.email.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "app.email")
public class EmailProperties {

    /**
     * Адрес отправителя.
     */
    private String from = "newsletter@localhost";

    /**
     * Используемый почтовый транспорт.
     */
    private EmailTransportType transport = EmailTransportType.SMTP;

    /**
     * Настройки HTTP API почтового сервиса (используются при transport = HTTP).
     */
    private Http http = new Http();

    /**
     * Настройки HTTP API почтового сервиса.
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Http {
        /**
         * Базовый URL API.
         */
        private String baseUrl;

        /**
         * Токен авторизации сервера.
         */
        private String authorizationToken;

        /**
         * Таймаут установки соединения.
         */
        private Duration connectTimeout = Duration.ofSeconds(5);

        /**
         * Таймаут ожидания ответа.
         */
        private Duration responseTimeout = Duration.ofSeconds(10);
    }
}
