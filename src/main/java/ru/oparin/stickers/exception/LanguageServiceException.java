package ru.oparin.stickers.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Исключение для ошибок языкового сервиса DeepInfra (перевод, классификация, разбивка на сцены).
 */
@Getter
public class LanguageServiceException extends RuntimeException {
    private final HttpStatus status;

    public LanguageServiceException(String message, HttpStatus status) {
        super(message);
        this.status = status;
    }

    public LanguageServiceException(String message, HttpStatus status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
