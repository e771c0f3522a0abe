package ru.oparin.newsletter.model.enums;

/**
 * Итог доставки письма.
 */
public enum DeliveryOutcome {
    /**
     * Письмо передано почтовому транспорту
     */
    SENT,

    /**
     * Доставка невозможна: постоянная ошибка или исчерпаны попытки
     */
    PERMANENTLY_FAILED
}
