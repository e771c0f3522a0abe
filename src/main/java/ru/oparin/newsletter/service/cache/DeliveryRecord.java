package ru.oparin.newsletter.service.cache;

import lombok.Value;
import ru.oparin.newsletter.model.enums.DeliveryOutcome;

import java.time.Duration;
import java.time.Instant;

/**
 * Запись кеша идемпотентности: либо маркер выполняющейся отправки, либо ее итог.
 */
@Value
public class DeliveryRecord {

    LeaseResult.State state;
    DeliveryOutcome outcome;
    Instant recordedAt;
    Instant expiresAt;

    public static DeliveryRecord inFlight(Instant now, Duration leaseTtl) {
        return new DeliveryRecord(LeaseResult.State.IN_FLIGHT, null, now, now.plus(leaseTtl));
    }

    public static DeliveryRecord settled(DeliveryOutcome outcome, Instant now, Duration ttl) {
        return new DeliveryRecord(LeaseResult.State.SETTLED, outcome, now, now.plus(ttl));
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isInFlight() {
        return state == LeaseResult.State.IN_FLIGHT;
    }

    LeaseResult toLeaseResult() {
        return isInFlight() ? LeaseResult.inFlight() : LeaseResult.settled(outcome);
    }
}
