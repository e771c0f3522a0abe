package ru.oparin.newsletter.service.transport;

import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailException;
import org.springframework.mail.MailParseException;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import ru.oparin.newsletter.config.properties.EmailProperties;
import ru.oparin.newsletter.exception.EmailTransportException;

import java.nio.charset.StandardCharsets;

/**
 * Отправка писем через SMTP-сервер.
 * JavaMailSender блокирующий, поэтому вызов выполняется на boundedElastic.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.email", name = "transport", havingValue = "smtp", matchIfMissing = true)
public class SmtpEmailTransport implements EmailTransport {

    private final JavaMailSender mailSender;
    private final EmailProperties emailProperties;

    @Override
    public Mono<Void> send(String to, String subject, String htmlBody, String textBody) {
        return Mono.fromRunnable(() -> {
                    MimeMessage message = buildMessage(to, subject, htmlBody, textBody);
                    mailSender.send(message);
                    log.debug("Письмо \"{}\" передано SMTP-серверу для {}", subject, to);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(error -> !(error instanceof EmailTransportException), this::classify)
                .then();
    }

    private MimeMessage buildMessage(String to, String subject, String htmlBody, String textBody) {
        MimeMessage message = mailSender.createMimeMessage();
        try {
            MimeMessageHelper helper = new MimeMessageHelper(message, true, StandardCharsets.UTF_8.name());
            helper.setFrom(emailProperties.getFrom());
            helper.setTo(to);
            helper.setSubject(subject);
            helper.setText(textBody, htmlBody);
        } catch (MessagingException e) {
            throw EmailTransportException.permanentFailure("Не удалось сформировать письмо для " + to, e);
        }
        return message;
    }

    EmailTransportException classify(Throwable error) {
        if (error instanceof MailAuthenticationException
                || error instanceof MailParseException
                || error instanceof MailPreparationException) {
            return EmailTransportException.permanentFailure("SMTP отклонил письмо: " + error.getMessage(), error);
        }
        if (error instanceof MailSendException sendException && hasRejectedRecipients(sendException)) {
            return EmailTransportException.permanentFailure("SMTP отклонил адрес получателя: " + error.getMessage(), error);
        }
        if (error instanceof MailException) {
            return EmailTransportException.transientFailure("Временная ошибка SMTP: " + error.getMessage(), error);
        }
        return EmailTransportException.permanentFailure("Непредвиденная ошибка при отправке: " + error.getMessage(), error);
    }

    private boolean hasRejectedRecipients(MailSendException exception) {
        return exception.getFailedMessages().values().stream()
                .anyMatch(cause -> cause instanceof SendFailedException sendFailed
                        && sendFailed.getInvalidAddresses() != null
                        && sendFailed.getInvalidAddresses().length > 0);
    }
}
