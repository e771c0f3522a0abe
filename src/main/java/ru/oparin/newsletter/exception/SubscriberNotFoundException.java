package ru.oparin.newsletter.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class SubscriberNotFoundException extends RuntimeException {

    private final HttpStatus status;

    public SubscriberNotFoundException(String message, HttpStatus status) {
        super(message);
        this.status = status;
    }

    public SubscriberNotFoundException(String message) {
        this(message, HttpStatus.NOT_FOUND);
    }
}
