package ru.oparin.stickers.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.stickers.model.enums.CategoryTag;
import ru.oparin.stickers.util.JsonUtils;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Классификация серии по закрытой таксономии категорий через языковой сервис.
 * Вызывается один раз на пакет и никогда не завершается ошибкой.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CategoryClassifier {

    private static final String INSTRUCTION = """
            Classify this emoticon theme and character into categories.

            Theme: %s
            Character: %s

            Available categories:
            %s

            Return ONLY a JSON array of matching category slugs (1-3 categories).
            Example: ["cute", "animal"]

            Categories:""";

    private final LanguageModelClient languageModelClient;
    private final ObjectMapper objectMapper;

    /**
     * Определить категории серии.
     *
     * @param theme     тема серии (может быть пустой)
     * @param character описание персонажа
     * @return допустимые категории из ответа или набор из категории по умолчанию
     */
    public Mono<Set<CategoryTag>> classify(String theme, String character) {
        String instruction = String.format(INSTRUCTION, theme != null ? theme : "", character, describeTaxonomy());
        return languageModelClient.complete(instruction)
                .map(this::parseCategories)
                .onErrorResume(error -> {
                    log.warn("Не удалось классифицировать серию, используем категорию по умолчанию: {}", error.getMessage());
                    return Mono.just(defaultCategories());
                })
                .defaultIfEmpty(defaultCategories());
    }

    /**
     * Разобрать JSON массив из свободного текста ответа и оставить только известные категории.
     */
    Set<CategoryTag> parseCategories(String response) {
        Optional<String> array = JsonUtils.extractJsonArray(response);
        if (array.isEmpty()) {
            log.warn("В ответе классификатора нет JSON массива: '{}'", response);
            return defaultCategories();
        }
        try {
            List<String> slugs = objectMapper.readValue(array.get(), new TypeReference<List<String>>() {});
            Set<CategoryTag> categories = slugs.stream()
                    .map(CategoryTag::fromSlug)
                    .flatMap(Optional::stream)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            log.info("Категории серии: {}", categories);
            return categories;
        } catch (JsonProcessingException e) {
            log.warn("Не удалось разобрать категории из ответа '{}': {}", response, e.getOriginalMessage());
            return defaultCategories();
        }
    }

    private Set<CategoryTag> defaultCategories() {
        return Set.of(CategoryTag.DEFAULT);
    }

    private String describeTaxonomy() {
        return Arrays.stream(CategoryTag.values())
                .map(tag -> "- " + tag.getSlug() + ": " + tag.getHint())
                .collect(Collectors.joining("\n"));
    }
}
