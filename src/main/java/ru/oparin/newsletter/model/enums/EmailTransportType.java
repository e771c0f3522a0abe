package ru.oparin.newsletter.model.enums;

/**
 * Способ отправки писем.
 */
public enum EmailTransportType {
    /**
     * Через SMTP-сервер (JavaMailSender)
     */
    SMTP,

    /**
     * Через HTTP API почтового сервиса
     */
    HTTP
}
