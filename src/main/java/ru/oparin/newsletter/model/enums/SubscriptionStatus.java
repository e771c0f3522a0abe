package ru.oparin.newsletter.model.enums;

/**
 * Статусы подписки.
 * Переход возможен только из PENDING_CONFIRMATION в CONFIRMED, обратно статус не возвращается.
 */
public enum SubscriptionStatus {
    /**
     * Подписка создана, ожидает перехода по ссылке из письма
     */
    PENDING_CONFIRMATION,

    /**
     * Подписка подтверждена
     */
    CONFIRMED
}
