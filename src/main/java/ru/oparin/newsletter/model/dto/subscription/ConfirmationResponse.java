package ru.oparin.newsletter.model.dto.subscription;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfirmationResponse {

    @Schema(description = "Идентификатор подписчика")
    private UUID subscriberId;

    @Schema(description = "Подписка была подтверждена ранее")
    private boolean alreadyConfirmed;

    @Schema(description = "Сообщение для пользователя", example = "Подписка подтверждена")
    private String message;
}
