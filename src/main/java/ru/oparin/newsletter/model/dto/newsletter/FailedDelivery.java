package ru.oparin.newsletter.model.dto.newsletter;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FailedDelivery {

    @Schema(description = "Идентификатор подписчика")
    private UUID subscriberId;

    @Schema(description = "Причина неудачной доставки")
    private String reason;
}
