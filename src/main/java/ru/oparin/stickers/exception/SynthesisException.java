package ru.oparin.stickers.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Ошибка сервиса синтеза изображений (Replicate).
 * Внутри пакета не выходит за пределы элемента: превращается в неуспешный ItemResult.
 */
@Getter
public class SynthesisException extends RuntimeException {
    private final HttpStatus status;

    public SynthesisException(String message, HttpStatus status) {
        super(message);
        this.status = status;
    }

    public SynthesisException(String message, HttpStatus status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /**
     * Ответ сервиса получен, но из него не удалось извлечь изображение.
     */
    public static SynthesisException malformed(String message) {
        return new SynthesisException(message, HttpStatus.UNPROCESSABLE_ENTITY);
    }
}
