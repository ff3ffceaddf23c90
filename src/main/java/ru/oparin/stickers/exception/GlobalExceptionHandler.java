package ru.oparin.stickers.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleAllExceptions(Exception ex) {
        log.error("Неизвестная ошибка: ", ex);

        return Mono.just(ResponseEntity.internalServerError()
                .body(Map.of(
                        "error", "Внутренняя ошибка сервера",
                        "status", 500,
                        "message", ex.getMessage() != null ? ex.getMessage() : "Unknown error"
                )));
    }

    @ExceptionHandler(GenerationValidationException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleGenerationValidationException(GenerationValidationException ex) {
        log.warn("Некорректный запрос на генерацию: {}", ex.getMessage());

        return Mono.just(ResponseEntity.status(ex.getStatus())
                .body(Map.of(
                        "error", ex.getMessage(),
                        "status", ex.getStatus().value()
                )));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleBindException(WebExchangeBindException ex) {
        Map<String, String> fields = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(FieldError::getField,
                        error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "некорректное значение",
                        (first, second) -> first));
        log.warn("Ошибка валидации запроса: {}", fields);

        return Mono.just(ResponseEntity.badRequest()
                .body(Map.of(
                        "error", "Ошибка валидации",
                        "status", 400,
                        "fields", fields
                )));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleInputException(ServerWebInputException ex) {
        log.warn("Некорректное тело запроса: {}", ex.getReason());

        return Mono.just(ResponseEntity.badRequest()
                .body(Map.of(
                        "error", ex.getReason() != null ? ex.getReason() : "Некорректное тело запроса",
                        "status", 400
                )));
    }

    @ExceptionHandler(LoraModelNotFoundException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleLoraModelNotFoundException(LoraModelNotFoundException ex) {
        log.warn("Модель не найдена: {}", ex.getMessage());

        return Mono.just(ResponseEntity.status(ex.getStatus())
                .body(Map.of(
                        "error", ex.getMessage(),
                        "status", ex.getStatus().value()
                )));
    }

    @ExceptionHandler(SynthesisException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleSynthesisException(SynthesisException ex) {
        log.error("Ошибка сервиса синтеза: {}", ex.getMessage());

        return Mono.just(ResponseEntity.status(ex.getStatus())
                .body(Map.of(
                        "error", ex.getMessage(),
                        "status", ex.getStatus().value()
                )));
    }

    @ExceptionHandler(LanguageServiceException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleLanguageServiceException(LanguageServiceException ex) {
        log.error("Ошибка языкового сервиса: {}", ex.getMessage());

        if (ex.getCause() != null) {
            log.error("Cause: {}", ex.getCause().getMessage());
        }

        return Mono.just(ResponseEntity.status(ex.getStatus())
                .body(Map.of(
                        "error", ex.getMessage(),
                        "status", ex.getStatus().value()
                )));
    }
}
