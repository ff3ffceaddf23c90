package ru.oparin.stickers.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import ru.oparin.stickers.config.properties.DeepInfraProperties;
import ru.oparin.stickers.exception.LanguageServiceException;
import ru.oparin.stickers.model.dto.prompt.ChatCompletionResponseDTO;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Клиент языкового сервиса DeepInfra (OpenAI-совместимый chat completions).
 * Принимает свободную инструкцию и возвращает свободный текст ответа.
 */
@Slf4j
@Service
public class LanguageModelClient {

    private static final String ENDPOINT = "/openai/chat/completions";

    private final WebClient webClient;
    private final DeepInfraProperties properties;

    public LanguageModelClient(WebClient.Builder webClientBuilder,
                               DeepInfraProperties deepInfraProperties) {
        this.properties = deepInfraProperties;
        this.webClient = webClientBuilder
                .baseUrl(deepInfraProperties.getApi().getUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + deepInfraProperties.getApi().getKey())
                .build();
    }

    /**
     * Выполнить инструкцию и вернуть текст ответа модели.
     *
     * @param instruction текст инструкции
     * @return ответ модели без пробелов по краям
     * @throws LanguageServiceException если сервис недоступен, вернул ошибку или пустой ответ
     */
    public Mono<String> complete(String instruction) {
        DeepInfraProperties.ModelConfig modelConfig = properties.getText();
        Map<String, Object> requestBody = buildRequestBody(instruction, modelConfig);
        log.debug("Отправляем запрос в языковую модель {}: {}", modelConfig.getModel(), instruction);

        return webClient.post()
                .uri(ENDPOINT)
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<ChatCompletionResponseDTO>() {})
                .timeout(Duration.ofMillis(properties.getTimeout()))
                .switchIfEmpty(Mono.error(new LanguageServiceException("Языковой сервис вернул пустой ответ", HttpStatus.BAD_GATEWAY)))
                .map(this::extractContent)
                .onErrorMap(this::mapToLanguageServiceException);
    }

    private Map<String, Object> buildRequestBody(String instruction, DeepInfraProperties.ModelConfig modelConfig) {
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", modelConfig.getModel());
        requestBody.put("max_tokens", modelConfig.getMaxTokens());
        requestBody.put("temperature", modelConfig.getTemperature());
        requestBody.put("messages", List.of(Map.of("role", "user", "content", instruction)));
        return requestBody;
    }

    private String extractContent(ChatCompletionResponseDTO response) {
        if (response.getChoices() == null || response.getChoices().isEmpty()) {
            log.error("Ответ от DeepInfra API не содержит choices");
            throw new LanguageServiceException("Языковой сервис вернул пустой ответ", HttpStatus.BAD_GATEWAY);
        }
        ChatCompletionResponseDTO.Message message = response.getChoices().get(0).getMessage();
        if (message == null || message.getContent() == null || message.getContent().isBlank()) {
            throw new LanguageServiceException("Языковой сервис вернул пустой ответ", HttpStatus.BAD_GATEWAY);
        }
        return message.getContent().trim();
    }

    /**
     * Преобразование ошибок WebClient в LanguageServiceException.
     */
    private Throwable mapToLanguageServiceException(Throwable e) {
        if (e instanceof LanguageServiceException) {
            return e;
        }

        if (e instanceof WebClientRequestException) {
            return new LanguageServiceException(
                    "Не удалось подключиться к языковому сервису",
                    HttpStatus.SERVICE_UNAVAILABLE,
                    e);
        } else if (e instanceof WebClientResponseException webE) {
            log.error("DeepInfra API вернул ошибку. Статус: {}, тело ответа: {}", webE.getStatusCode(), webE.getResponseBodyAsString());
            return new LanguageServiceException(
                    String.format("Языковой сервис вернул ошибку. Статус: %s", webE.getStatusCode()),
                    HttpStatus.BAD_GATEWAY,
                    e);
        } else {
            return new LanguageServiceException(
                    "Ошибка обращения к языковому сервису: " + e.getMessage(),
                    HttpStatus.BAD_GATEWAY,
                    e);
        }
    }
}
