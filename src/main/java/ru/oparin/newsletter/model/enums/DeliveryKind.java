package ru.oparin.newsletter.model.enums;

/**
 * Вид отправляемого письма.
 */
public enum DeliveryKind {
    /**
     * Письмо со ссылкой подтверждения подписки
     */
    CONFIRMATION,

    /**
     * Выпуск рассылки
     */
    NEWSLETTER_ISSUE
}
