package ru.oparin.stickers.model.dto.replicate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.stickers.model.enums.PredictionStatus;

/**
 * Ответ Replicate на создание или опрос предсказания.
 * Поле output оставлено сырым: его форма зависит от модели.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PredictionResponseDTO {

    private String id;
    private PredictionStatus status;
    private JsonNode output;
    private String error;
    private Urls urls;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Urls {
        private String get;
        private String cancel;
    }
}
