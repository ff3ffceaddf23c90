package ru.oparin.stickers.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class LoraModelNotFoundException extends RuntimeException {
    private final HttpStatus status;

    public LoraModelNotFoundException(String message) {
        super(message);
        this.status = HttpStatus.NOT_FOUND;
    }
}
