package ru.oparin.stickers.service.synthesis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;
import ru.oparin.stickers.config.properties.ReplicateProperties;
import ru.oparin.stickers.exception.SynthesisException;
import ru.oparin.stickers.model.dto.replicate.SynthesisInput;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ReplicateSynthesisClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockWebServer server;
    private ReplicateSynthesisClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        ReplicateProperties properties = new ReplicateProperties();
        properties.setApi(new ReplicateProperties.Api("http://localhost:" + server.getPort(), "test-token"));
        properties.setPolling(new ReplicateProperties.Polling(10, 5_000));
        client = new ReplicateSynthesisClient(WebClient.builder(), properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private void enqueueJson(String body) {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody(body));
    }

    @Test
    @DisplayName("Ссылка с версией отправляется в /v1/predictions с полем version")
    void versionedReferenceUsesPredictionsEndpoint() throws Exception {
        enqueueJson("""
                {"id":"p1","status":"succeeded","output":["https://replicate.delivery/p1.png"]}
                """);

        StepVerifier.create(client.synthesize("owner/cat-lora:abc123", SynthesisInput.textOnly("кот машет лапой")))
                .expectNext("https://replicate.delivery/p1.png")
                .verifyComplete();

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/predictions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer test-token");
        assertThat(request.getHeader("Prefer")).isEqualTo("wait=60");

        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.get("version").asText()).isEqualTo("abc123");
        assertThat(body.get("input").get("prompt").asText()).isEqualTo("кот машет лапой");
        assertThat(body.get("input").get("output_format").asText()).isEqualTo("png");
        assertThat(body.get("input").has("image")).isFalse();
        assertThat(body.get("input").has("prompt_strength")).isFalse();
    }

    @Test
    @DisplayName("Ссылка без версии отправляется в /v1/models/{ref}/predictions вместе с изображением")
    void unversionedReferenceUsesModelEndpoint() throws Exception {
        enqueueJson("""
                {"id":"p2","status":"succeeded","output":"https://replicate.delivery/p2.png"}
                """);

        SynthesisInput input = SynthesisInput.withImage("кот спит", "https://replicate.delivery/p1.png", 0.3);
        StepVerifier.create(client.synthesize("owner/cat-lora", input))
                .expectNext("https://replicate.delivery/p2.png")
                .verifyComplete();

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/models/owner/cat-lora/predictions");

        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.has("version")).isFalse();
        assertThat(body.get("input").get("image").asText()).isEqualTo("https://replicate.delivery/p1.png");
        assertThat(body.get("input").get("prompt_strength").asDouble()).isEqualTo(0.3);
    }

    @Test
    @DisplayName("Незавершенное предсказание опрашивается до терминального статуса")
    void pollsUntilTerminalStatus() throws Exception {
        String statusUrl = server.url("/v1/predictions/p3").toString();
        enqueueJson("{\"id\":\"p3\",\"status\":\"starting\",\"urls\":{\"get\":\"" + statusUrl + "\"}}");
        enqueueJson("{\"id\":\"p3\",\"status\":\"processing\",\"urls\":{\"get\":\"" + statusUrl + "\"}}");
        enqueueJson("{\"id\":\"p3\",\"status\":\"succeeded\",\"output\":{\"url\":\"https://replicate.delivery/p3.png\"}}");

        StepVerifier.create(client.synthesize("owner/cat-lora", SynthesisInput.textOnly("кот")))
                .expectNext("https://replicate.delivery/p3.png")
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertThat(server.getRequestCount()).isEqualTo(3);
        server.takeRequest();
        assertThat(server.takeRequest().getPath()).isEqualTo("/v1/predictions/p3");
    }

    @Test
    @DisplayName("Статус failed превращается в ошибку синтеза с причиной")
    void failedPredictionIsError() {
        enqueueJson("""
                {"id":"p4","status":"failed","error":"NSFW content detected"}
                """);

        StepVerifier.create(client.synthesize("owner/cat-lora", SynthesisInput.textOnly("кот")))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(SynthesisException.class);
                    assertThat(error.getMessage()).contains("FAILED").contains("NSFW content detected");
                })
                .verify();
    }

    @Test
    @DisplayName("HTTP 500 от сервиса превращается в ошибку 502")
    void serverErrorIsBadGateway() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("internal"));

        StepVerifier.create(client.synthesize("owner/cat-lora", SynthesisInput.textOnly("кот")))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(SynthesisException.class);
                    assertThat(((SynthesisException) error).getStatus()).isEqualTo(HttpStatus.BAD_GATEWAY);
                })
                .verify();
    }

    @Test
    @DisplayName("Результат без http ссылки отклоняется")
    void nonHttpOutputIsRejected() {
        enqueueJson("""
                {"id":"p5","status":"succeeded","output":"data:image/png;base64,AAAA"}
                """);

        StepVerifier.create(client.synthesize("owner/cat-lora", SynthesisInput.textOnly("кот")))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(SynthesisException.class);
                    assertThat(((SynthesisException) error).getStatus()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
                })
                .verify();
    }
}
