package ru.oparin.newsletter.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;
import ru.oparin.newsletter.model.dto.newsletter.BroadcastReport;
import ru.oparin.newsletter.model.dto.newsletter.FailedDelivery;
import ru.oparin.newsletter.security.SecurityConfig;
import ru.oparin.newsletter.service.delivery.DeliveryPipeline;
import ru.oparin.newsletter.service.delivery.NewsletterIssue;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.springframework.security.test.web.reactive.server.SecurityMockServerConfigurers.mockUser;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = NewsletterController.class,
        properties = {AdminTestConfig.USERNAME_PROPERTY, AdminTestConfig.PASSWORD_PROPERTY})
@Import({SecurityConfig.class, AdminTestConfig.class})
class NewsletterControllerTest {

    private static final Map<String, String> ISSUE = Map.of(
            "issueId", "2026-10",
            "title", "Октябрьский выпуск",
            "text", "Текст выпуска",
            "html", "<p>Текст выпуска</p>");

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private DeliveryPipeline deliveryPipeline;

    @Test
    @DisplayName("Публикация без авторизации отклоняется с 401")
    void publishRequiresAuthentication() {
        webTestClient.post().uri("/admin/newsletters")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(ISSUE)
                .exchange()
                .expectStatus().isUnauthorized();

        verify(deliveryPipeline, never()).broadcastIssue(any());
    }

    @Test
    @DisplayName("Неверный пароль администратора отклоняется с 401")
    void publishWithWrongPassword() {
        webTestClient.post().uri("/admin/newsletters")
                .headers(headers -> headers.setBasicAuth(AdminTestConfig.USERNAME, "wrong"))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(ISSUE)
                .exchange()
                .expectStatus().isUnauthorized();
    }

    @Test
    @DisplayName("Администратор публикует выпуск и получает отчет о рассылке")
    void publishReturnsReport() {
        UUID failedId = UUID.randomUUID();
        when(deliveryPipeline.broadcastIssue(any())).thenReturn(Mono.just(BroadcastReport.builder()
                .contentVersion("2026-10")
                .sent(9)
                .failed(List.of(new FailedDelivery(failedId, "mailbox unavailable")))
                .interrupted(false)
                .build()));

        webTestClient.post().uri("/admin/newsletters")
                .headers(headers -> headers.setBasicAuth(AdminTestConfig.USERNAME, AdminTestConfig.PASSWORD))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(ISSUE)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.sent").isEqualTo(9)
                .jsonPath("$.failed[0].subscriberId").isEqualTo(failedId.toString())
                .jsonPath("$.interrupted").isEqualTo(false);

        ArgumentCaptor<NewsletterIssue> captor = ArgumentCaptor.forClass(NewsletterIssue.class);
        verify(deliveryPipeline).broadcastIssue(captor.capture());
        assertThat(captor.getValue().getContentVersion()).isEqualTo("2026-10");
        assertThat(captor.getValue().getTitle()).isEqualTo("Октябрьский выпуск");
    }

    @Test
    @DisplayName("Выпуск без заголовка отклоняется с 400")
    void publishWithoutTitle() {
        webTestClient.post().uri("/admin/newsletters")
                .headers(headers -> headers.setBasicAuth(AdminTestConfig.USERNAME, AdminTestConfig.PASSWORD))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("text", "t", "html", "h"))
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    @DisplayName("Пользователь с ролью ADMIN допускается к публикации")
    void publishAsAdminRole() {
        when(deliveryPipeline.broadcastIssue(any())).thenReturn(Mono.just(BroadcastReport.builder()
                .contentVersion("2026-10")
                .sent(1)
                .failed(List.of())
                .interrupted(false)
                .build()));

        webTestClient.mutateWith(mockUser("editor").roles("ADMIN"))
                .post().uri("/admin/newsletters")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(ISSUE)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.sent").isEqualTo(1);
    }

    @Test
    @DisplayName("Пользователь без роли ADMIN получает 403")
    void publishWithoutAdminRole() {
        webTestClient.mutateWith(mockUser("reader").roles("USER"))
                .post().uri("/admin/newsletters")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(ISSUE)
                .exchange()
                .expectStatus().isForbidden();

        verify(deliveryPipeline, never()).broadcastIssue(any());
    }
}
