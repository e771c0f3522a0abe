package ru.oparin.newsletter.service.delivery;

import lombok.Builder;
import lombok.Value;
import org.apache.commons.codec.digest.DigestUtils;

/**
 * Выпуск рассылки.
 */
@Value
@Builder
public class NewsletterIssue {

    /**
     * Версия выпуска. Повторная публикация с той же версией не отправляет письмо тем,
     * кому оно уже доставлено.
     */
    String contentVersion;
    String title;
    String textContent;
    String htmlContent;

    /**
     * Создает выпуск; если версия не указана, она вычисляется из содержимого.
     */
    public static NewsletterIssue of(String issueId, String title, String textContent, String htmlContent) {
        String version = issueId != null && !issueId.isBlank()
                ? issueId.trim()
                : DigestUtils.sha256Hex(title + "\n" + textContent + "\n" + htmlContent);
        return NewsletterIssue.builder()
                .contentVersion(version)
                .title(title)
                .textContent(textContent)
                .htmlContent(htmlContent)
                .build();
    }
}
