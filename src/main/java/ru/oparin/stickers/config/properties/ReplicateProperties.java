package ru.oparin.stickers.config.properties;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Конфигурационные свойства сервиса синтеза изображений Replicate.
 * Настройки загружаются из application.yml с префиксом replicate.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "replicate")
public class ReplicateProperties {

    /**
     * Настройки API Replicate (URL и токен).
     */
    private Api api = new Api();

    /**
     * Сколько секунд сервис может держать синхронный ответ (заголовок Prefer: wait).
     */
    private int preferWaitSeconds = 60;

    /**
     * Настройки опроса незавершенных предсказаний.
     */
    private Polling polling = new Polling();

    /**
     * Фиксированные параметры рендеринга, одинаковые для всех вызовов.
     */
    private Rendering rendering = new Rendering();

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Api {
        private String url = "https://api.replicate.com";
        private String token;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Polling {
        /**
         * Интервал опроса статуса предсказания в миллисекундах.
         */
        private long intervalMs = 1_000;

        /**
         * Максимальное время ожидания завершения предсказания в миллисекундах.
         */
        private long maxWaitMs = 180_000;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    public static class Rendering {
        private String model = "dev";
        private boolean goFast = false;
        private double loraScale = 1;
        private String megapixels = "1";
        private int numOutputs = 1;
        private String aspectRatio = "1:1";
        /**
         * png, а не webp: результат дальше читается через ImageIO.
         */
        private String outputFormat = "png";
        private double guidanceScale = 3;
        private int outputQuality = 80;
        private double extraLoraScale = 1;
        private int numInferenceSteps = 28;
    }
}
