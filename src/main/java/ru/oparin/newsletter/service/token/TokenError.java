package ru.oparin.newsletter.service.token;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Причины, по которым токен подтверждения отклонен.
 */
@Getter
@RequiredArgsConstructor
public enum TokenError {
    /**
     * Строку токена не удалось разобрать
     */
    MALFORMED("Некорректная ссылка подтверждения"),

    /**
     * Подпись не совпала: токен подделан или поврежден
     */
    SIGNATURE_MISMATCH("Ссылка подтверждения недействительна. Если вы не меняли ссылку, обратитесь в поддержку"),

    /**
     * Срок действия токена истек
     */
    EXPIRED("Срок действия ссылки истек. Запросите новое письмо подтверждения");

    private final String description;
}
