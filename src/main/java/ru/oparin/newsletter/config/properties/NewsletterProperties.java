package ru.oparin.newsletter.config.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Настройки жизненного цикла подписки и конвейера доставки писем.
 * Загружаются из application.yml с префиксом app.newsletter один раз при старте
 * и передаются компонентам через конструктор.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "app.newsletter")
public class NewsletterProperties {

    /**
     * Секрет для HMAC-подписи токенов подтверждения.
     * Без него приложение не стартует.
     */
    private String signingSecret;

    /**
     * Публичный адрес приложения, используется в ссылке подтверждения.
     */
    private String baseUrl = "http://localhost:8080";

    /**
     * Время жизни токена подтверждения.
     */
    private Duration tokenTtl = Duration.ofHours(24);

    /**
     * Общее количество попыток отправки одного письма (включая первую).
     */
    private int maxSendRetries = 5;

    /**
     * Базовая задержка экспоненциального backoff.
     */
    private Duration backoffBase = Duration.ofMillis(500);

    /**
     * Максимальная задержка между попытками.
     */
    private Duration backoffCap = Duration.ofSeconds(30);

    /**
     * Доля случайного уменьшения задержки (0..1), чтобы повторы не шли одной волной.
     */
    private double backoffJitter = 0.2;

    /**
     * Максимальное число одновременных отправок при рассылке выпуска.
     */
    private int broadcastConcurrency = 8;

    /**
     * Таймаут одного вызова почтового транспорта.
     */
    private Duration sendTimeout = Duration.ofSeconds(10);

    /**
     * Время жизни маркера "отправка выполняется".
     * После его истечения отправку может перехватить другой обработчик.
     */
    private Duration leaseTtl = Duration.ofMinutes(2);

    /**
     * Сколько хранится запись об успешной доставке.
     */
    private Duration sentTtl = Duration.ofDays(7);

    /**
     * Сколько хранится запись о неудачной доставке.
     * Пока запись жива, повторные запросы получают тот же результат без отправки.
     */
    private Duration failedTtl = Duration.ofMinutes(15);

    /**
     * Интервал опроса кеша, пока ту же отправку выполняет другой обработчик.
     */
    private Duration inFlightPollInterval = Duration.ofMillis(200);

    /**
     * Максимальное время ожидания чужой отправки.
     */
    private Duration inFlightMaxWait = Duration.ofSeconds(30);

    /**
     * Размер страницы при постраничном чтении подтвержденных подписчиков.
     */
    private int storePageSize = 500;
}
