package ru.oparin.stickers.service.synthesis;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import ru.oparin.stickers.config.properties.ReplicateProperties;
import ru.oparin.stickers.exception.SynthesisException;
import ru.oparin.stickers.model.dto.replicate.PredictionResponseDTO;
import ru.oparin.stickers.model.dto.replicate.SynthesisInput;
import ru.oparin.stickers.model.dto.replicate.SynthesisOutput;
import ru.oparin.stickers.model.enums.PredictionStatus;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Клиент Replicate: создание предсказания и ожидание его завершения.
 * <p>
 * Запрос отправляется с заголовком Prefer: wait, поэтому обычно ответ приходит уже завершенным.
 * Если нет, статус опрашивается по ссылке urls.get до терминального состояния.
 */
@Slf4j
@Service
public class ReplicateSynthesisClient implements ImageSynthesisClient {

    private static final String VERSION_SEPARATOR = ":";

    private final WebClient webClient;
    private final ReplicateProperties properties;

    public ReplicateSynthesisClient(WebClient.Builder webClientBuilder,
                                    ReplicateProperties replicateProperties) {
        this.properties = replicateProperties;
        this.webClient = webClientBuilder
                .baseUrl(replicateProperties.getApi().getUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + replicateProperties.getApi().getToken())
                .build();
    }

    @Override
    public Mono<String> synthesize(String modelReference, SynthesisInput input) {
        return createPrediction(modelReference, input)
                .flatMap(this::awaitCompletion)
                .map(this::extractImageUrl)
                .onErrorMap(this::mapToSynthesisException);
    }

    private Mono<PredictionResponseDTO> createPrediction(String modelReference, SynthesisInput input) {
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("input", buildInput(input));

        String uri;
        int separator = modelReference.indexOf(VERSION_SEPARATOR);
        if (separator >= 0) {
            requestBody.put("version", modelReference.substring(separator + 1));
            uri = "/v1/predictions";
        } else {
            uri = "/v1/models/" + modelReference + "/predictions";
        }

        log.debug("Создание предсказания Replicate: model={}, image={}, prompt_strength={}",
                modelReference, input.getImage() != null, input.getPromptStrength());

        return webClient.post()
                .uri(uri)
                .header("Prefer", "wait=" + properties.getPreferWaitSeconds())
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(PredictionResponseDTO.class)
                .doOnNext(prediction -> log.info("Предсказание Replicate {} создано, статус: {}",
                        prediction.getId(), prediction.getStatus()));
    }

    /**
     * Дождаться терминального статуса предсказания.
     */
    private Mono<PredictionResponseDTO> awaitCompletion(PredictionResponseDTO prediction) {
        if (isTerminal(prediction)) {
            return Mono.just(prediction);
        }
        if (prediction.getUrls() == null || prediction.getUrls().getGet() == null) {
            return Mono.error(SynthesisException.malformed(
                    "Предсказание " + prediction.getId() + " не завершено и не содержит ссылки для опроса"));
        }

        String statusUrl = prediction.getUrls().getGet();
        ReplicateProperties.Polling polling = properties.getPolling();
        log.debug("Предсказание {} в статусе {}, начинаем опрос", prediction.getId(), prediction.getStatus());

        return Mono.defer(() -> fetchPrediction(statusUrl))
                .delaySubscription(Duration.ofMillis(polling.getIntervalMs()))
                .repeat()
                .filter(this::isTerminal)
                .next()
                .timeout(Duration.ofMillis(polling.getMaxWaitMs()));
    }

    private Mono<PredictionResponseDTO> fetchPrediction(String statusUrl) {
        return webClient.get()
                .uri(statusUrl)
                .retrieve()
                .bodyToMono(PredictionResponseDTO.class);
    }

    private boolean isTerminal(PredictionResponseDTO prediction) {
        return prediction.getStatus() != null && prediction.getStatus().isTerminal();
    }

    private String extractImageUrl(PredictionResponseDTO prediction) {
        if (prediction.getStatus() != PredictionStatus.SUCCEEDED) {
            String reason = prediction.getError() != null ? prediction.getError() : "без описания";
            throw SynthesisException.malformed(String.format("Предсказание %s завершилось со статусом %s: %s",
                    prediction.getId(), prediction.getStatus(), reason));
        }
        return SynthesisOutput.from(prediction.getOutput()).resolveImageUrl();
    }

    private Map<String, Object> buildInput(SynthesisInput input) {
        ReplicateProperties.Rendering rendering = properties.getRendering();
        Map<String, Object> params = new HashMap<>();
        params.put("prompt", input.getPrompt());
        params.put("model", rendering.getModel());
        params.put("go_fast", rendering.isGoFast());
        params.put("lora_scale", rendering.getLoraScale());
        params.put("megapixels", rendering.getMegapixels());
        params.put("num_outputs", rendering.getNumOutputs());
        params.put("aspect_ratio", rendering.getAspectRatio());
        params.put("output_format", rendering.getOutputFormat());
        params.put("guidance_scale", rendering.getGuidanceScale());
        params.put("output_quality", rendering.getOutputQuality());
        params.put("extra_lora_scale", rendering.getExtraLoraScale());
        params.put("num_inference_steps", rendering.getNumInferenceSteps());
        if (input.getImage() != null) {
            params.put("image", input.getImage());
        }
        if (input.getPromptStrength() != null) {
            params.put("prompt_strength", input.getPromptStrength());
        }
        return params;
    }

    /**
     * Преобразование ошибок WebClient в SynthesisException.
     */
    private Throwable mapToSynthesisException(Throwable e) {
        if (e instanceof SynthesisException) {
            return e;
        }

        if (e instanceof WebClientRequestException) {
            return new SynthesisException("Не удалось подключиться к сервису синтеза", HttpStatus.SERVICE_UNAVAILABLE, e);
        } else if (e instanceof WebClientResponseException webE) {
            log.error("Replicate API вернул ошибку. Статус: {}, тело ответа: {}", webE.getStatusCode(), webE.getResponseBodyAsString());
            return new SynthesisException(
                    String.format("Сервис синтеза вернул ошибку. Статус: %s", webE.getStatusCode()),
                    HttpStatus.BAD_GATEWAY,
                    e);
        } else if (e instanceof TimeoutException) {
            return new SynthesisException("Превышено время ожидания результата синтеза", HttpStatus.GATEWAY_TIMEOUT, e);
        } else {
            return new SynthesisException("Ошибка синтеза изображения: " + e.getMessage(), HttpStatus.BAD_GATEWAY, e);
        }
    }
}
