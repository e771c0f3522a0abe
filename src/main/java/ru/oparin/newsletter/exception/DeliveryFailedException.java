package ru.oparin.newsletter.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import ru.oparin.newsletter.model.enums.DeliveryKind;

import java.util.UUID;

/**
 * Письмо не удалось доставить: постоянная ошибка транспорта или исчерпаны попытки.
 * Содержит достаточно данных для разбора оператором; исходная ошибка транспорта доступна как cause.
 */
@Getter
public class DeliveryFailedException extends RuntimeException {

    private final HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
    private final UUID subscriberId;
    private final DeliveryKind kind;
    private final String reason;

    public DeliveryFailedException(UUID subscriberId, DeliveryKind kind, String reason) {
        this(subscriberId, kind, reason, null);
    }

    public DeliveryFailedException(UUID subscriberId, DeliveryKind kind, String reason, Throwable cause) {
        super(String.format("Не удалось отправить письмо %s подписчику %s: %s", kind, subscriberId, reason), cause);
        this.subscriberId = subscriberId;
        this.kind = kind;
        this.reason = reason;
    }
}
