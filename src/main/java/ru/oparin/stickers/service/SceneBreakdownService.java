package ru.oparin.stickers.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.stickers.config.properties.GenerationProperties;
import ru.oparin.stickers.exception.LanguageServiceException;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Разбивка темы серии на набор различных поз персонажа через языковой сервис.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SceneBreakdownService {

    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\d+\\.?\\s*");

    private static final String INSTRUCTION = """
            You are creating %1$d emoticon scenes for a character based on a theme.

            Character: %2$s
            Theme: %3$s

            Create %1$d DIVERSE and VARIED POSE DESCRIPTIONS with SPECIFIC body movements that represent this theme.

            CRITICAL REQUIREMENTS:
            - Each pose MUST be COMPLETELY DIFFERENT from others
            - Mix VARIOUS pose types: standing, sitting, lying, jumping, running, leaning, bending, stretching, etc.
            - Include DIVERSE angles: front, side, back, diagonal

            Each pose MUST include:
            - SPECIFIC ARM positions (both hands above the head, one hand raised, arms spread, arms crossed, etc.)
            - SPECIFIC LEG positions (sitting, lying on the stomach, lying down, running, standing on one leg, etc.)
            - BODY ANGLE details (leaning back, lying on the side, looking over the shoulder, bending forward, etc.)
            - Related to the theme
            - Written in the same language as the theme

            Format: Return ONLY %1$d lines, each describing one DETAILED POSE.
            DO NOT follow any fixed pattern. Be creative and think outside the box based on the theme.

            Now generate %1$d DETAILED POSE DESCRIPTIONS for the given theme:""";

    private final LanguageModelClient languageModelClient;
    private final GenerationProperties generationProperties;

    /**
     * Получить описания поз для темы.
     *
     * @param theme     тема серии
     * @param character описание персонажа
     * @return ровно sceneCount описаний поз
     * @throws LanguageServiceException если модель вернула меньше поз, чем нужно
     */
    public Mono<List<String>> breakdown(String theme, String character) {
        int sceneCount = generationProperties.getSceneCount();
        log.info("Разбивка темы '{}' на {} сцен", abbreviate(theme), sceneCount);

        return languageModelClient.complete(String.format(INSTRUCTION, sceneCount, character, theme))
                .map(text -> parseScenes(text, sceneCount))
                .flatMap(scenes -> {
                    if (scenes.size() < sceneCount) {
                        log.warn("Получено {} сцен из {} для темы '{}'", scenes.size(), sceneCount, abbreviate(theme));
                        return Mono.error(new LanguageServiceException(
                                String.format("Получено только %d сцен, нужно %d", scenes.size(), sceneCount),
                                HttpStatus.BAD_GATEWAY));
                    }
                    log.info("Сцены для темы '{}': {}", abbreviate(theme), scenes);
                    return Mono.just(scenes);
                });
    }

    List<String> parseScenes(String text, int limit) {
        return Arrays.stream(text.split("\n"))
                .map(line -> LEADING_NUMBER.matcher(line.trim()).replaceFirst("").trim())
                .filter(line -> !line.isEmpty())
                .limit(limit)
                .collect(Collectors.toList());
    }

    private String abbreviate(String theme) {
        return theme.length() > 50 ? theme.substring(0, 50) + "..." : theme;
    }
}
