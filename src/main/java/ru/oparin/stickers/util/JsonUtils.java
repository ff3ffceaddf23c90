package ru.oparin.stickers.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Утилитный класс для работы с JSON-колонками и JSON, встроенным в свободный текст.
 */
@UtilityClass
@Slf4j
public class JsonUtils {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern JSON_ARRAY = Pattern.compile("\\[.*]", Pattern.DOTALL);

    /**
     * Преобразовать список строк в JSON строку.
     *
     * @param list список строк для сериализации
     * @return JSON строка в формате ["item1", "item2", ...] или null если список пустой
     */
    public static String convertListToJson(List<String> list) {
        if (list == null || list.isEmpty()) {
            return null;
        }
        return write(list);
    }

    /**
     * Преобразовать объект метаданных в JSON строку.
     */
    public static String convertMapToJson(Map<String, ?> map) {
        if (map == null) {
            return null;
        }
        return write(map);
    }

    /**
     * Преобразовать JSON строку в список строк.
     *
     * @param json JSON строка в формате ["item1", "item2", ...]
     * @return список строк или пустой список если JSON некорректный
     */
    public static List<String> parseJsonToList(String json) {
        if (json == null || json.isBlank() || json.equals("null")) {
            return List.of();
        }
        try {
            return MAPPER.readValue(json, new TypeReference<List<String>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Не удалось разобрать JSON массив: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    /**
     * Найти первый JSON массив в свободном тексте (ответ языковой модели).
     *
     * @param text ответ модели
     * @return текст от первой '[' до последней ']' или пусто
     */
    public static Optional<String> extractJsonArray(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = JSON_ARRAY.matcher(text);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }

    private static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Не удалось сериализовать в JSON", e);
        }
    }
}
