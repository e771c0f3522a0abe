package ru.oparin.newsletter.model.dto.newsletter;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Итог рассылки выпуска по всем подтвержденным подписчикам.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BroadcastReport {

    @Schema(description = "Версия выпуска", example = "2026-10-issue-1")
    private String contentVersion;

    @Schema(description = "Количество подписчиков, получивших выпуск (включая доставленных ранее)")
    private int sent;

    @Schema(description = "Подписчики, которым выпуск доставить не удалось")
    private List<FailedDelivery> failed;

    /**
     * Рассылка остановлена при завершении приложения, часть подписчиков не обработана.
     */
    @Schema(description = "Рассылка прервана остановкой приложения")
    private boolean interrupted;
}
