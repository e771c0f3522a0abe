package ru.oparin.newsletter.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import ru.oparin.newsletter.model.dto.subscription.ConfirmationResponse;
import ru.oparin.newsletter.model.dto.subscription.ResendConfirmationRequest;
import ru.oparin.newsletter.model.dto.subscription.SubscribeRequest;
import ru.oparin.newsletter.model.dto.subscription.SubscriptionResponse;
import ru.oparin.newsletter.service.SubscriptionService;

@Slf4j
@RequiredArgsConstructor
@RestController
@RequestMapping("/subscriptions")
@Tag(name = "Подписки", description = "API для оформления и подтверждения подписки на рассылку")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;

    @Operation(summary = "Оформление подписки",
            description = "Создает неподтвержденную подписку и отправляет письмо со ссылкой подтверждения")
    @PostMapping
    public Mono<ResponseEntity<SubscriptionResponse>> subscribe(@Valid @RequestBody SubscribeRequest request) {
        log.info("Получен запрос на оформление подписки");
        return subscriptionService.subscribe(request.getEmail(), request.getName())
                .map(response -> ResponseEntity.status(HttpStatus.CREATED).body(response));
    }

    @Operation(summary = "Подтверждение подписки",
            description = "Подтверждает подписку по токену из письма. Повторный переход по ссылке тоже успешен")
    @GetMapping("/confirm")
    public Mono<ResponseEntity<ConfirmationResponse>> confirm(@RequestParam String token) {
        log.info("Получен запрос на подтверждение подписки");
        return subscriptionService.confirm(token)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Повторная отправка письма подтверждения",
            description = "Отправляет новое письмо со ссылкой подтверждения, если подписка еще не подтверждена")
    @PostMapping("/resend")
    public Mono<ResponseEntity<SubscriptionResponse>> resendConfirmation(@Valid @RequestBody ResendConfirmationRequest request) {
        log.info("Получен запрос на повторную отправку письма подтверждения");
        return subscriptionService.resendConfirmation(request.getEmail())
                .map(ResponseEntity::ok);
    }
}
