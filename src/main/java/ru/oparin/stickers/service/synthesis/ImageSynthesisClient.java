package ru.oparin.stickers.service.synthesis;

import reactor.core.publisher.Mono;
import ru.oparin.stickers.model.dto.replicate.SynthesisInput;

/**
 * Внешний сервис синтеза изображений.
 * <p>
 * Один вызов соответствует одному обращению к квоте сервиса. Ответ может быть медленным
 * (от секунд до десятков секунд), ссылка на изображение извлекается из ответа любой поддерживаемой формы.
 */
public interface ImageSynthesisClient {

    /**
     * Синтезировать одно изображение.
     *
     * @param modelReference ссылка на модель персонажа (owner/name или owner/name:version)
     * @param input          промпт, опциональное исходное изображение и сила влияния промпта
     * @return http(s) ссылка на результат
     */
    Mono<String> synthesize(String modelReference, SynthesisInput input);
}
