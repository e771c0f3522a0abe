package ru.oparin.newsletter.model.dto.newsletter;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishIssueRequest {

    @Size(max = 200, message = "Идентификатор выпуска не должен превышать 200 символов")
    @Schema(description = "Идентификатор выпуска. Если не указан, вычисляется из содержимого", example = "2026-10-issue-1")
    private String issueId;

    @NotBlank(message = "Заголовок выпуска обязателен")
    @Schema(description = "Тема письма", example = "Новости октября")
    private String title;

    @NotBlank(message = "Текстовая версия выпуска обязательна")
    @Schema(description = "Текстовая версия письма")
    private String text;

    @NotBlank(message = "HTML-версия выпуска обязательна")
    @Schema(description = "HTML-версия письма")
    private String html;
}
