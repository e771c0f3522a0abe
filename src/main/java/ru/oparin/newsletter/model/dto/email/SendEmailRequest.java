package ru.oparin.newsletter.model.dto.email;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Тело запроса к HTTP API почтового сервиса (формат Postmark).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SendEmailRequest {

    @JsonProperty("From")
    private String from;

    @JsonProperty("To")
    private String to;

    @JsonProperty("Subject")
    private String subject;

    @JsonProperty("HtmlBody")
    private String htmlBody;

    @JsonProperty("TextBody")
    private String textBody;
}
