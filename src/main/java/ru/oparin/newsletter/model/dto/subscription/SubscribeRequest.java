package ru.oparin.newsletter.model.dto.subscription;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscribeRequest {

    @NotBlank(message = "Email обязателен")
    @Schema(description = "Email адрес", example = "ivan@example.com")
    private String email;

    @NotBlank(message = "Имя обязательно")
    @Schema(description = "Имя подписчика", example = "Иван")
    private String name;
}
