package ru.oparin.stickers.model.dto.replicate;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import ru.oparin.stickers.exception.SynthesisException;

/**
 * Результат сервиса синтеза в одной из трех форм: ссылка, список ссылок или объект с полем ссылки.
 * Форма определяется один раз при разборе, ссылка извлекается методом {@link #resolveImageUrl()}.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class SynthesisOutput {

    /**
     * Форма ответа сервиса синтеза.
     */
    public enum Shape {
        REFERENCE,
        REFERENCE_LIST,
        STRUCTURED
    }

    private static final String[] URL_FIELDS = {"url", "output", "0"};

    private final Shape shape;
    private final JsonNode raw;

    /**
     * Определить форму ответа.
     *
     * @param output поле output из ответа сервиса
     * @return разобранный результат
     * @throws SynthesisException если ответ пустой или имеет неподдерживаемый тип
     */
    public static SynthesisOutput from(JsonNode output) {
        if (output == null || output.isNull() || output.isMissingNode()) {
            throw SynthesisException.malformed("Сервис синтеза не вернул результат");
        }
        if (output.isTextual()) {
            return new SynthesisOutput(Shape.REFERENCE, output);
        }
        if (output.isArray()) {
            return new SynthesisOutput(Shape.REFERENCE_LIST, output);
        }
        if (output.isObject()) {
            return new SynthesisOutput(Shape.STRUCTURED, output);
        }
        throw SynthesisException.malformed("Неверный формат результата: " + output.getNodeType());
    }

    /**
     * Извлечь ссылку на изображение.
     *
     * @return http(s) ссылка на изображение
     * @throws SynthesisException если ссылку найти не удалось или это не URL
     */
    public String resolveImageUrl() {
        String url = switch (shape) {
            case REFERENCE -> raw.asText();
            case REFERENCE_LIST -> raw.isEmpty() ? null : asText(raw.get(0));
            case STRUCTURED -> findUrlField();
        };
        if (url == null) {
            throw SynthesisException.malformed("Не найден URL в результате сервиса синтеза");
        }
        if (!url.startsWith("http")) {
            throw SynthesisException.malformed("Сервис синтеза вернул некорректный URL");
        }
        return url;
    }

    private String findUrlField() {
        for (String field : URL_FIELDS) {
            JsonNode value = raw.get(field);
            String text = asText(value);
            if (text != null && !text.isEmpty()) {
                return text;
            }
        }
        return null;
    }

    private static String asText(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            return node.isEmpty() ? null : asText(node.get(0));
        }
        return node.asText();
    }
}
