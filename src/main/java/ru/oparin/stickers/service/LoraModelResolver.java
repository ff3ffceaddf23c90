package ru.oparin.stickers.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.stickers.config.DatabaseConfig;
import ru.oparin.stickers.exception.GenerationValidationException;
import ru.oparin.stickers.exception.LoraModelNotFoundException;
import ru.oparin.stickers.repository.LoraModelRepository;

/**
 * Поиск ссылки на модель персонажа в сервисе синтеза по идентификатору модели.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoraModelResolver {

    private final LoraModelRepository loraModelRepository;

    /**
     * @param modelId идентификатор записи lora_models
     * @return ссылка вида owner/name или owner/name:version
     */
    public Mono<String> resolve(Long modelId) {
        if (modelId == null) {
            return Mono.error(new GenerationValidationException("Не указан идентификатор модели"));
        }
        return DatabaseConfig.withRetry(loraModelRepository.findById(modelId))
                .switchIfEmpty(Mono.error(new LoraModelNotFoundException("Модель не найдена: " + modelId)))
                .flatMap(model -> {
                    String reference = model.getReplicateModelName();
                    if (reference == null || reference.isBlank()) {
                        return Mono.error(new LoraModelNotFoundException(
                                "У модели " + modelId + " нет ссылки на обученную версию"));
                    }
                    log.info("Модель {} разрешена в {}", modelId, reference);
                    return Mono.just(reference);
                });
    }
}
