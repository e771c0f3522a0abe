package ru.oparin.newsletter.service.token;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Самодостаточный подписанный токен подтверждения подписки.
 * В базе не хранится: подпись связывает идентификатор подписчика и срок действия.
 */
@Value
public class ConfirmationToken {

    UUID subscriberId;
    Instant issuedAt;
    Instant expiresAt;
    String signature;

    /**
     * Строковое представление токена для ссылки:
     * {@code <subscriberId>.<issuedAt>.<expiresAt>.<signature>}, время в секундах эпохи.
     * Содержит только символы, допустимые в URL без экранирования.
     */
    public String encode() {
        return subscriberId + TokenCodec.SEPARATOR
                + issuedAt.getEpochSecond() + TokenCodec.SEPARATOR
                + expiresAt.getEpochSecond() + TokenCodec.SEPARATOR
                + signature;
    }

    @Override
    public String toString() {
        return encode();
    }
}
