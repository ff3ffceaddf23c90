package ru.oparin.stickers.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Некорректный запрос на генерацию. Обработка пакета не начинается.
 */
@Getter
public class GenerationValidationException extends RuntimeException {
    private final HttpStatus status;

    public GenerationValidationException(String message) {
        super(message);
        this.status = HttpStatus.BAD_REQUEST;
    }
}
