package ru.oparin.newsletter.service.cache;

import lombok.Value;
import ru.oparin.newsletter.model.enums.DeliveryOutcome;

/**
 * Результат попытки захватить право на отправку письма.
 */
@Value
public class LeaseResult {

    State state;

    /**
     * Итог доставки, заполнен только для SETTLED.
     */
    DeliveryOutcome outcome;

    public enum State {
        /**
         * Право на отправку получено вызывающим
         */
        GRANTED,

        /**
         * Отправку уже выполняет другой обработчик
         */
        IN_FLIGHT,

        /**
         * Отправка уже завершена с известным итогом
         */
        SETTLED
    }

    public static LeaseResult granted() {
        return new LeaseResult(State.GRANTED, null);
    }

    public static LeaseResult inFlight() {
        return new LeaseResult(State.IN_FLIGHT, null);
    }

    public static LeaseResult settled(DeliveryOutcome outcome) {
        return new LeaseResult(State.SETTLED, outcome);
    }
}
