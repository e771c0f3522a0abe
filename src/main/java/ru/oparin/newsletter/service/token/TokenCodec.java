package ru.oparin.newsletter.service.token;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.springframework.stereotype.Component;
import ru.oparin.newsletter.config.properties.NewsletterProperties;
import ru.oparin.newsletter.exception.InvalidTokenException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.UUID;

/**
 * Выпуск и проверка токенов подтверждения подписки.
 * Подпись: HMAC-SHA256(secret, subscriberId + "." + expiresAt) в base64url без паддинга.
 * Таблица токенов не нужна, взамен токен нельзя отозвать до истечения срока.
 */
@Slf4j
@Component
public class TokenCodec {

    static final String SEPARATOR = ".";

    private static final int TOKEN_PARTS = 4;
    private static final int MIN_SECRET_LENGTH = 32;

    private final byte[] secret;
    private final Clock clock;

    public TokenCodec(NewsletterProperties properties, Clock clock) {
        String signingSecret = properties.getSigningSecret();
        if (signingSecret == null || signingSecret.isBlank()) {
            throw new IllegalStateException("Не задан секрет подписи токенов (app.newsletter.signing-secret)");
        }
        if (signingSecret.length() < MIN_SECRET_LENGTH) {
            log.warn("Секрет подписи токенов короче {} символов, рекомендуется использовать более длинный", MIN_SECRET_LENGTH);
        }
        this.secret = signingSecret.getBytes(StandardCharsets.UTF_8);
        this.clock = clock;
    }

    /**
     * Выпускает токен для подписчика.
     *
     * @param subscriberId идентификатор подписчика
     * @param ttl          срок действия токена
     * @return подписанный токен с абсолютным временем истечения
     */
    public ConfirmationToken issue(UUID subscriberId, Duration ttl) {
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(ttl);
        String signature = sign(subscriberId.toString(), String.valueOf(expiresAt.getEpochSecond()));
        return new ConfirmationToken(subscriberId, issuedAt, expiresAt, signature);
    }

    /**
     * Проверяет токен и возвращает идентификатор подписчика.
     * Сначала проверяется формат, затем подпись и только потом срок действия,
     * поэтому токен с измененным сроком всегда отклоняется как поддельный.
     *
     * @param token строка токена из ссылки
     * @return идентификатор подписчика
     * @throws InvalidTokenException с видом MALFORMED, SIGNATURE_MISMATCH или EXPIRED
     */
    public UUID verify(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException(TokenError.MALFORMED);
        }

        String[] parts = token.trim().split("\\.", -1);
        if (parts.length != TOKEN_PARTS) {
            throw new InvalidTokenException(TokenError.MALFORMED);
        }

        String subscriberPart = parts[0];
        String expiresPart = parts[2];
        String providedSignature = parts[3];

        UUID subscriberId;
        Instant expiresAt;
        try {
            subscriberId = UUID.fromString(subscriberPart);
            Long.parseLong(parts[1]);
            expiresAt = Instant.ofEpochSecond(Long.parseLong(expiresPart));
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new InvalidTokenException(TokenError.MALFORMED, e);
        }

        String expectedSignature = sign(subscriberPart, expiresPart);
        if (!MessageDigest.isEqual(
                expectedSignature.getBytes(StandardCharsets.US_ASCII),
                providedSignature.getBytes(StandardCharsets.US_ASCII))) {
            throw new InvalidTokenException(TokenError.SIGNATURE_MISMATCH);
        }

        if (clock.instant().isAfter(expiresAt)) {
            throw new InvalidTokenException(TokenError.EXPIRED);
        }

        return subscriberId;
    }

    private String sign(String subscriberId, String expiresAtEpochSecond) {
        // Mac внутри HmacUtils не потокобезопасен: новый экземпляр на каждый вызов
        byte[] mac = new HmacUtils(HmacAlgorithms.HMAC_SHA_256, secret)
                .hmac(subscriberId + SEPARATOR + expiresAtEpochSecond);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(mac);
    }
}
