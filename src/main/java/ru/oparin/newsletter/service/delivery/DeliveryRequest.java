package ru.oparin.newsletter.service.delivery;

import lombok.Builder;
import lombok.Value;
import org.apache.commons.codec.digest.DigestUtils;
import ru.oparin.newsletter.model.enums.DeliveryKind;

import java.util.UUID;

/**
 * Намерение отправить конкретное письмо конкретному подписчику.
 */
@Value
@Builder
public class DeliveryRequest {

    DeliveryKind kind;
    UUID subscriberId;
    String recipient;
    String subject;
    String htmlContent;
    String textContent;

    /**
     * Версия содержимого: срок действия токена для подтверждения, идентификатор выпуска для рассылки.
     */
    String contentVersion;

    /**
     * Детерминированный отпечаток отправки: одинаковый для одного и того же письма тому же подписчику.
     */
    public String fingerprint() {
        return fingerprint(kind, subscriberId, contentVersion);
    }

    public static String fingerprint(DeliveryKind kind, UUID subscriberId, String contentVersion) {
        return DigestUtils.sha256Hex(kind.name() + ":" + subscriberId + ":" + contentVersion);
    }
}
