package ru.oparin.newsletter.service.delivery;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;
import ru.oparin.newsletter.config.properties.NewsletterProperties;
import ru.oparin.newsletter.model.entity.Subscriber;
import ru.oparin.newsletter.model.enums.DeliveryKind;
import ru.oparin.newsletter.service.token.ConfirmationToken;

/**
 * Построение писем подтверждения и выпусков рассылки.
 */
@Component
@RequiredArgsConstructor
public class EmailContentBuilder {

    private static final String CONFIRM_PATH = "/subscriptions/confirm?token=";
    private static final String CONFIRMATION_SUBJECT = "Подтвердите подписку на рассылку";

    private final NewsletterProperties properties;

    public String confirmationLink(ConfirmationToken token) {
        return properties.getBaseUrl() + CONFIRM_PATH + token.encode();
    }

    public DeliveryRequest confirmation(Subscriber subscriber, ConfirmationToken token) {
        String link = confirmationLink(token);
        return DeliveryRequest.builder()
                .kind(DeliveryKind.CONFIRMATION)
                .subscriberId(subscriber.getId())
                .recipient(subscriber.getEmail())
                .subject(CONFIRMATION_SUBJECT)
                .htmlContent(buildConfirmationHtml(subscriber.getName(), link))
                .textContent(buildConfirmationText(subscriber.getName(), link))
                .contentVersion(String.valueOf(token.getExpiresAt().getEpochSecond()))
                .build();
    }

    public DeliveryRequest issue(Subscriber subscriber, NewsletterIssue issue) {
        return DeliveryRequest.builder()
                .kind(DeliveryKind.NEWSLETTER_ISSUE)
                .subscriberId(subscriber.getId())
                .recipient(subscriber.getEmail())
                .subject(issue.getTitle())
                .htmlContent(issue.getHtmlContent())
                .textContent(issue.getTextContent())
                .contentVersion(issue.getContentVersion())
                .build();
    }

    private String buildConfirmationText(String name, String link) {
        return String.format("""
                Здравствуйте, %s!
                
                Вы оформили подписку на нашу рассылку.
                Чтобы получать выпуски, подтвердите подписку, перейдя по ссылке:
                
                %s
                
                Если вы не подписывались, просто проигнорируйте это письмо.
                """,
                name,
                link
        );
    }

    private String buildConfirmationHtml(String name, String link) {
        return String.format("""
                <p>Здравствуйте, %s!</p>
                <p>Вы оформили подписку на нашу рассылку.</p>
                <p>Чтобы получать выпуски, <a href="%s">подтвердите подписку</a>.</p>
                <p>Если вы не подписывались, просто проигнорируйте это письмо.</p>
                """,
                HtmlUtils.htmlEscape(name),
                HtmlUtils.htmlEscape(link)
        );
    }
}
