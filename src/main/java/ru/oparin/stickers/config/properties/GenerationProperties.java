package ru.oparin.stickers.config.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "app.generation")
public class GenerationProperties {

    /**
     * Пауза между первым проходом и проходом уточнения (лимит сервиса: 6 вызовов в минуту).
     */
    private Duration refinementDelay = Duration.ofSeconds(15);

    /**
     * Пауза перед следующим элементом пакета в полном двухпроходном режиме.
     */
    private Duration itemDelay = Duration.ofSeconds(15);

    /**
     * Пауза перед следующим элементом в режиме превью (один проход).
     */
    private Duration previewItemDelay = Duration.ofSeconds(2);

    /**
     * Сила влияния промпта при уточнении: поза из первого прохода сохраняется.
     */
    private double refinementPromptStrength = 0.3;

    /**
     * Сила влияния промпта в режиме image-to-image.
     */
    private double imageToImagePromptStrength = 0.25;

    /**
     * Сторона квадратного канонического растра в пикселях.
     */
    private int canonicalSize = 360;

    /**
     * Префикс пути в хранилище для изображений серий.
     */
    private String storagePrefix = "emoticons";

    /**
     * Количество сцен при разбивке темы.
     */
    private int sceneCount = 5;

    /**
     * Получить паузу перед следующим элементом пакета.
     *
     * @param preview true для режима превью
     * @return длительность паузы
     */
    public Duration getItemDelay(boolean preview) {
        return preview ? previewItemDelay : itemDelay;
    }
}
