package ru.oparin.stickers.config.properties;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Языковой сервис (OpenAI-совместимый chat completions DeepInfra):
 * перевод, классификация категорий и разбивка темы на сцены.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "deepinfra")
public class DeepInfraProperties {

    private Api api = new Api();

    /**
     * Таймаут запроса в миллисекундах.
     */
    private Integer timeout = 30_000;

    private ModelConfig text = new ModelConfig("meta-llama/Meta-Llama-3.1-8B-Instruct", 512, 0.2);

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Api {
        private String url = "https://api.deepinfra.com/v1";
        private String key;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModelConfig {
        private String model;
        private Integer maxTokens;
        private Double temperature;
    }
}
