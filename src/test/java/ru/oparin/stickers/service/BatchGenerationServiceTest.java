package ru.oparin.stickers.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import ru.oparin.stickers.exception.GenerationValidationException;
import ru.oparin.stickers.exception.LoraModelNotFoundException;
import ru.oparin.stickers.exception.SynthesisException;
import ru.oparin.stickers.model.dto.generation.BatchResult;
import ru.oparin.stickers.model.dto.generation.GenerationItem;
import ru.oparin.stickers.model.dto.generation.GenerationRequest;
import ru.oparin.stickers.model.dto.generation.GenerationSettings;
import ru.oparin.stickers.model.dto.generation.ItemResult;
import ru.oparin.stickers.model.dto.generation.PersistenceDirective;
import ru.oparin.stickers.model.enums.GenerationMode;
import ru.oparin.stickers.model.enums.SketchStyle;
import ru.oparin.stickers.service.persistence.SeriesPersistenceService;
import ru.oparin.stickers.service.synthesis.TwoStageSynthesisEngine;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class BatchGenerationServiceTest {

    private static final String MODEL = "owner/cat-lora";
    private static final String NORMALIZED = "data:image/png;base64,iVBORw0KGgo=";

    private LoraModelResolver loraModelResolver;
    private TwoStageSynthesisEngine synthesisEngine;
    private ImagePostProcessor postProcessor;
    private SeriesPersistenceService seriesPersistenceService;
    private BatchGenerationService service;

    @BeforeEach
    void setUp() {
        loraModelResolver = mock(LoraModelResolver.class);
        synthesisEngine = mock(TwoStageSynthesisEngine.class);
        postProcessor = mock(ImagePostProcessor.class);
        seriesPersistenceService = mock(SeriesPersistenceService.class);
        service = new BatchGenerationService(loraModelResolver, synthesisEngine, postProcessor, seriesPersistenceService);

        when(loraModelResolver.resolve(42L)).thenReturn(Mono.just(MODEL));
        when(postProcessor.normalize(anyString())).thenReturn(Mono.just(NORMALIZED));
    }

    private void synthesisFailsFor(int failingIndex) {
        when(synthesisEngine.synthesize(any(), any())).thenAnswer(invocation -> {
            GenerationItem item = invocation.getArgument(0);
            if (item.getIndex() == failingIndex) {
                return Mono.error(new SynthesisException("Сервис синтеза вернул ошибку", HttpStatus.BAD_GATEWAY));
            }
            return Mono.just("https://replicate.delivery/" + item.getIndex() + ".png");
        });
    }

    @Test
    @DisplayName("Результатов столько же, сколько элементов, в исходном порядке, несмотря на ошибки")
    void resultsKeepInputOrderDespiteFailures() {
        synthesisFailsFor(1);
        GenerationRequest request = GenerationRequest.builder()
                .modelId(42L)
                .mode(GenerationMode.TEXT_TO_IMAGE)
                .prompts(List.of("сидит", "прыгает", "спит"))
                .build();

        StepVerifier.create(service.generate(request))
                .assertNext(result -> {
                    assertThat(result.getResults()).extracting(ItemResult::getIndex).containsExactly(0, 1, 2);
                    assertThat(result.getResults()).extracting(ItemResult::isSuccess).containsExactly(true, false, true);
                    assertThat(result.getResults().get(1).getError()).isEqualTo("Сервис синтеза вернул ошибку");
                    assertThat(result.getTotal()).isEqualTo(3);
                    assertThat(result.getSuccessCount()).isEqualTo(2);
                    assertThat(result.getFailedCount()).isEqualTo(1);
                    assertThat(result.getSavedSeriesId()).isNull();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Один промпт с темой и стилем без сохранения: один успешный результат с нормализованным изображением")
    void singlePromptWithoutPersistence() {
        synthesisFailsFor(-1);
        GenerationRequest request = GenerationRequest.builder()
                .modelId(42L)
                .mode(GenerationMode.TEXT_TO_IMAGE)
                .prompts(List.of("sitting and smiling"))
                .theme("cafe")
                .style("pen")
                .monochrome(true)
                .build();

        StepVerifier.create(service.generate(request))
                .assertNext(result -> {
                    assertThat(result.getResults()).hasSize(1);
                    ItemResult item = result.getResults().get(0);
                    assertThat(item.isSuccess()).isTrue();
                    assertThat(item.getNormalizedImage()).isEqualTo(NORMALIZED);
                    assertThat(item.getPrompt()).isEqualTo("sitting and smiling");
                    assertThat(result.getSavedSeriesId()).isNull();
                })
                .verifyComplete();

        ArgumentCaptor<GenerationSettings> captor = ArgumentCaptor.forClass(GenerationSettings.class);
        verify(synthesisEngine).synthesize(any(), captor.capture());
        assertThat(captor.getValue().getModelReference()).isEqualTo(MODEL);
        assertThat(captor.getValue().getStyle()).isEqualTo(SketchStyle.PEN);
        assertThat(captor.getValue().getTheme()).isEqualTo("cafe");
        assertThat(captor.getValue().isMonochrome()).isTrue();
        verifyNoInteractions(seriesPersistenceService);
    }

    @Test
    @DisplayName("Ошибка нормализации не делает элемент неуспешным")
    void normalizationFailureKeepsItemSuccessful() {
        synthesisFailsFor(-1);
        when(postProcessor.normalize(anyString())).thenReturn(Mono.empty());
        GenerationRequest request = GenerationRequest.builder()
                .modelId(42L)
                .mode(GenerationMode.PREVIEW)
                .prompts(List.of("сидит"))
                .build();

        StepVerifier.create(service.generate(request))
                .assertNext(result -> {
                    ItemResult item = result.getResults().get(0);
                    assertThat(item.isSuccess()).isTrue();
                    assertThat(item.getGeneratedUrl()).isEqualTo("https://replicate.delivery/0.png");
                    assertThat(item.getNormalizedImage()).isNull();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("img2img: промпты необязательны и сопоставляются по индексу")
    void imageToImageAlignsOptionalPrompts() {
        synthesisFailsFor(-1);
        GenerationRequest request = GenerationRequest.builder()
                .modelId(42L)
                .mode(GenerationMode.IMAGE_TO_IMAGE)
                .images(List.of("data:image/png;base64,AAA", "data:image/png;base64,BBB"))
                .prompts(List.of("машет рукой"))
                .build();

        StepVerifier.create(service.generate(request))
                .assertNext(result -> assertThat(result.getSuccessCount()).isEqualTo(2))
                .verifyComplete();

        ArgumentCaptor<GenerationItem> captor = ArgumentCaptor.forClass(GenerationItem.class);
        verify(synthesisEngine, times(2)).synthesize(captor.capture(), any());
        assertThat(captor.getAllValues()).extracting(GenerationItem::getPrompt).containsExactly("машет рукой", null);
        assertThat(captor.getAllValues()).extracting(GenerationItem::getSourceImage)
                .containsExactly("data:image/png;base64,AAA", "data:image/png;base64,BBB");
    }

    @Test
    @DisplayName("Без промптов в text2img запрос отклоняется до обработки")
    void missingPromptsIsValidationError() {
        GenerationRequest request = GenerationRequest.builder()
                .modelId(42L)
                .mode(GenerationMode.BATCH)
                .build();

        StepVerifier.create(service.generate(request))
                .expectError(GenerationValidationException.class)
                .verify();

        verifyNoInteractions(loraModelResolver, synthesisEngine);
    }

    @Test
    @DisplayName("Без изображений в img2img запрос отклоняется")
    void missingImagesIsValidationError() {
        GenerationRequest request = GenerationRequest.builder()
                .modelId(42L)
                .mode(GenerationMode.IMAGE_TO_IMAGE)
                .prompts(List.of("сидит"))
                .build();

        StepVerifier.create(service.generate(request))
                .expectError(GenerationValidationException.class)
                .verify();
    }

    @Test
    @DisplayName("Неизвестный стиль отклоняется")
    void unknownStyleIsValidationError() {
        GenerationRequest request = GenerationRequest.builder()
                .modelId(42L)
                .prompts(List.of("сидит"))
                .style("watercolor")
                .build();

        StepVerifier.create(service.generate(request))
                .expectError(GenerationValidationException.class)
                .verify();
    }

    @Test
    @DisplayName("Ненайденная модель пробрасывается как ошибка запроса")
    void unresolvedModelPropagates() {
        when(loraModelResolver.resolve(7L)).thenReturn(Mono.error(new LoraModelNotFoundException("Модель не найдена: 7")));
        GenerationRequest request = GenerationRequest.builder()
                .modelId(7L)
                .prompts(List.of("сидит"))
                .build();

        StepVerifier.create(service.generate(request))
                .expectError(LoraModelNotFoundException.class)
                .verify();

        verifyNoInteractions(synthesisEngine);
    }

    @Test
    @DisplayName("Сохранение запускается после пакета и возвращает идентификатор серии")
    void persistenceReturnsSeriesId() {
        synthesisFailsFor(-1);
        PersistenceDirective directive = new PersistenceDirective(7L, "белый кот");
        GenerationRequest request = GenerationRequest.builder()
                .modelId(42L)
                .mode(GenerationMode.BATCH)
                .prompts(List.of("сидит", "прыгает"))
                .theme("кафе")
                .titles(List.of("Привет", "Ура"))
                .persistence(directive)
                .build();
        when(seriesPersistenceService.persist(any(BatchResult.class), eq(directive), eq("кафе"), any(),
                anyBoolean(), eq(List.of("Привет", "Ура")))).thenReturn(Mono.just(101L));

        StepVerifier.create(service.generate(request))
                .assertNext(result -> assertThat(result.getSavedSeriesId()).isEqualTo(101L))
                .verifyComplete();
    }

    @Test
    @DisplayName("Если серию создать не удалось, результат пакета возвращается без идентификатора")
    void failedPersistenceKeepsBatchResult() {
        synthesisFailsFor(-1);
        GenerationRequest request = GenerationRequest.builder()
                .modelId(42L)
                .prompts(List.of("сидит"))
                .persistence(new PersistenceDirective(7L, "белый кот"))
                .build();
        when(seriesPersistenceService.persist(any(), any(), any(), any(), anyBoolean(), any())).thenReturn(Mono.empty());

        StepVerifier.create(service.generate(request))
                .assertNext(result -> {
                    assertThat(result.getSuccessCount()).isEqualTo(1);
                    assertThat(result.getSavedSeriesId()).isNull();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Если ни один элемент не удался, сохранение не запускается")
    void noPersistenceWithoutSuccessfulItems() {
        synthesisFailsFor(0);
        GenerationRequest request = GenerationRequest.builder()
                .modelId(42L)
                .prompts(List.of("сидит"))
                .persistence(new PersistenceDirective(7L, "белый кот"))
                .build();

        StepVerifier.create(service.generate(request))
                .assertNext(result -> assertThat(result.getFailedCount()).isEqualTo(1))
                .verifyComplete();

        verify(seriesPersistenceService, never()).persist(any(), any(), any(), any(), anyBoolean(), any());
    }

    @Test
    @DisplayName("Ошибка без сообщения все равно дает причину в результате элемента")
    void errorWithoutMessageStillHasReason() {
        when(synthesisEngine.synthesize(any(), any())).thenReturn(Mono.error(new NullPointerException()));
        GenerationRequest request = GenerationRequest.builder()
                .modelId(42L)
                .prompts(List.of("сидит"))
                .build();

        StepVerifier.create(service.generate(request))
                .assertNext(result -> {
                    ItemResult item = result.getResults().get(0);
                    assertThat(item.isSuccess()).isFalse();
                    assertThat(item.getError()).isEqualTo("NullPointerException");
                })
                .verifyComplete();
    }
}
