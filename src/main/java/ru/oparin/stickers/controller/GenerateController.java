package ru.oparin.stickers.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import ru.oparin.stickers.exception.GenerationValidationException;
import ru.oparin.stickers.model.dto.generation.BatchResult;
import ru.oparin.stickers.model.dto.generation.GenerationRequest;
import ru.oparin.stickers.model.dto.scene.SceneBreakdownRequest;
import ru.oparin.stickers.model.dto.scene.SceneBreakdownResponse;
import ru.oparin.stickers.service.BatchGenerationService;
import ru.oparin.stickers.service.SceneBreakdownService;

/**
 * Контроллер пакетной генерации стикеров.
 */
@Slf4j
@RestController
@RequestMapping("/generate")
@RequiredArgsConstructor
@Tag(name = "Generate", description = "API пакетной генерации стикеров с единым персонажем")
public class GenerateController {

    private final BatchGenerationService batchGenerationService;
    private final SceneBreakdownService sceneBreakdownService;

    /**
     * Сгенерировать пакет стикеров.
     *
     * @param request промпты или исходные изображения, режим, тема, стиль и параметры сохранения
     * @return результаты по элементам и идентификатор сохраненной серии
     */
    @Operation(summary = "Сгенерировать пакет стикеров",
            description = "Обрабатывает элементы строго последовательно с паузами под квоту сервиса синтеза. "
                    + "Ошибки отдельных элементов возвращаются в результате, пакет не прерывается")
    @PostMapping("/batch")
    public Mono<ResponseEntity<BatchResult>> generateBatch(@Valid @RequestBody GenerationRequest request) {
        return batchGenerationService.generate(request)
                .map(ResponseEntity::ok)
                .doOnError(error -> {
                    if (error instanceof GenerationValidationException validationEx) {
                        log.warn("Запрос на генерацию отклонен: {}", validationEx.getMessage());
                    } else {
                        log.error("Ошибка пакетной генерации", error);
                    }
                });
    }

    /**
     * Разбить тему на позы для серии.
     */
    @Operation(summary = "Разбить тему на сцены",
            description = "Возвращает фиксированное количество различных поз персонажа по теме")
    @PostMapping("/scenes")
    public Mono<ResponseEntity<SceneBreakdownResponse>> generateScenes(@Valid @RequestBody SceneBreakdownRequest request) {
        return sceneBreakdownService.breakdown(request.getTheme(), request.getCharacter())
                .map(scenes -> ResponseEntity.ok(new SceneBreakdownResponse(scenes, request.getCharacter(), request.getTheme())));
    }
}
