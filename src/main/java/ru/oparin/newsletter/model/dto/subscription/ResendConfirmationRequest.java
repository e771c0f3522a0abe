package ru.oparin.newsletter.model.dto.subscription;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResendConfirmationRequest {

    @NotBlank(message = "Email обязателен")
    private String email;
}
