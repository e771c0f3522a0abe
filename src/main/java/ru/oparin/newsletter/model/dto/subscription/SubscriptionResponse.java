package ru.oparin.newsletter.model.dto.subscription;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.newsletter.model.enums.DeliveryOutcome;
import ru.oparin.newsletter.model.enums.SubscriptionStatus;

import java.util.UUID;

/**
 * Результат оформления подписки или повторной отправки письма подтверждения.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionResponse {

    @Schema(description = "Идентификатор подписчика")
    private UUID subscriberId;

    @Schema(description = "Email подписчика", example = "ivan@example.com")
    private String email;

    @Schema(description = "Статус подписки")
    private SubscriptionStatus status;

    /**
     * Итог отправки письма подтверждения. Пусто, если письмо не отправлялось.
     */
    @Schema(description = "Итог отправки письма подтверждения")
    private DeliveryOutcome confirmationDelivery;
}
