package ru.oparin.newsletter.exception;

import lombok.Getter;

/**
 * Ошибка почтового транспорта.
 * Временные ошибки (таймаут, 5xx, потеря соединения) повторяются конвейером доставки,
 * постоянные (неверный адрес, ошибка авторизации, 4xx) - нет.
 */
@Getter
public class EmailTransportException extends RuntimeException {

    private final boolean transientFailure;

    private EmailTransportException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public static EmailTransportException transientFailure(String message, Throwable cause) {
        return new EmailTransportException(message, true, cause);
    }

    public static EmailTransportException permanentFailure(String message, Throwable cause) {
        return new EmailTransportException(message, false, cause);
    }
}
