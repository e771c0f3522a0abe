package ru.oparin.newsletter.service.transport;

import reactor.core.publisher.Mono;

/**
 * Внешний почтовый транспорт.
 * Ошибки сообщаются через {@link ru.oparin.newsletter.exception.EmailTransportException}
 * с признаком временной или постоянной ошибки.
 */
public interface EmailTransport {

    /**
     * Отправляет письмо с HTML и текстовой версией.
     *
     * @param to       адрес получателя
     * @param subject  тема письма
     * @param htmlBody HTML-версия
     * @param textBody текстовая версия
     */
    Mono<Void> send(String to, String subject, String htmlBody, String textBody);
}
