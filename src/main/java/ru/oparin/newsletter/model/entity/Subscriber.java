package ru.oparin.newsletter.model.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;
import ru.oparin.newsletter.model.enums.SubscriptionStatus;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Сущность подписчика рассылки.
 * Создается в статусе PENDING_CONFIRMATION и переводится в CONFIRMED
 * после перехода по ссылке из письма. Ядро сервиса записи не удаляет.
 */
@Table("subscriptions")
@Getter
@Setter
@EqualsAndHashCode
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Subscriber {

    /**
     * Уникальный идентификатор подписчика.
     * Генерируется приложением при создании и больше не меняется.
     */
    @Id
    private UUID id;

    /**
     * Email адрес подписчика в нижнем регистре.
     * Уникален среди всех подписчиков независимо от статуса.
     */
    private String email;

    /**
     * Отображаемое имя подписчика.
     */
    private String name;

    /**
     * Статус подписки.
     */
    @Builder.Default
    private SubscriptionStatus status = SubscriptionStatus.PENDING_CONFIRMATION;

    /**
     * Дата и время создания подписки (UTC).
     */
    @Column("subscribed_at")
    private LocalDateTime subscribedAt;

    public boolean isConfirmed() {
        return status == SubscriptionStatus.CONFIRMED;
    }
}
