package ru.oparin.newsletter.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import ru.oparin.newsletter.model.dto.newsletter.BroadcastReport;
import ru.oparin.newsletter.model.dto.newsletter.PublishIssueRequest;
import ru.oparin.newsletter.service.delivery.DeliveryPipeline;
import ru.oparin.newsletter.service.delivery.NewsletterIssue;

@Slf4j
@RequiredArgsConstructor
@RestController
@RequestMapping("/admin/newsletters")
@Tag(name = "Рассылка", description = "API администратора для публикации выпусков")
public class NewsletterController {

    private final DeliveryPipeline deliveryPipeline;

    @Operation(summary = "Публикация выпуска",
            description = "Рассылает выпуск всем подтвержденным подписчикам и возвращает отчет о доставке",
            security = @SecurityRequirement(name = "basicAuth"))
    @PostMapping
    public Mono<ResponseEntity<BroadcastReport>> publishIssue(@Valid @RequestBody PublishIssueRequest request) {
        NewsletterIssue issue = NewsletterIssue.of(request.getIssueId(), request.getTitle(), request.getText(), request.getHtml());
        log.info("Получен запрос на публикацию выпуска {}", issue.getContentVersion());
        return deliveryPipeline.broadcastIssue(issue)
                .map(ResponseEntity::ok);
    }
}
