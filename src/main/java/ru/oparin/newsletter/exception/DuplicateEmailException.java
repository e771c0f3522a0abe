package ru.oparin.newsletter.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Подписчик с таким email уже существует (в любом статусе).
 */
@Getter
public class DuplicateEmailException extends RuntimeException {

    private final HttpStatus status = HttpStatus.CONFLICT;
    private final String email;

    public DuplicateEmailException(String email, Throwable cause) {
        super("Подписка с таким email уже существует", cause);
        this.email = email;
    }
}
