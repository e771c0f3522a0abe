package ru.oparin.newsletter.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import ru.oparin.newsletter.service.token.TokenError;

/**
 * Токен подтверждения не прошел проверку.
 * Вид ошибки позволяет показать пользователю разные сообщения:
 * для истекшего токена - запросить новое письмо, для поддельного - обратиться в поддержку.
 */
@Getter
public class InvalidTokenException extends RuntimeException {

    private final HttpStatus status = HttpStatus.UNAUTHORIZED;
    private final TokenError error;

    public InvalidTokenException(TokenError error) {
        super(error.getDescription());
        this.error = error;
    }

    public InvalidTokenException(TokenError error, Throwable cause) {
        super(error.getDescription(), cause);
        this.error = error;
    }
}
