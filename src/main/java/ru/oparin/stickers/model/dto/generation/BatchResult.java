package ru.oparin.stickers.model.dto.generation;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.stickers.model.enums.GenerationMode;

import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Результат пакетной генерации")
public class BatchResult {

    @Schema(description = "Режим генерации")
    private GenerationMode mode;

    @Schema(description = "Результаты по элементам в порядке входного списка")
    private List<ItemResult> results;

    @Schema(description = "Всего элементов", example = "5")
    private int total;

    @Schema(description = "Успешных элементов", example = "4")
    private int successCount;

    @Schema(description = "Неуспешных элементов", example = "1")
    private int failedCount;

    @Schema(description = "Идентификатор сохраненной серии или null")
    private Long savedSeriesId;

    /**
     * Собрать результат пакета с подсчетом итогов.
     *
     * @param mode    режим генерации
     * @param results результаты по элементам в исходном порядке
     * @return результат пакета без сохраненной серии
     */
    public static BatchResult of(GenerationMode mode, List<ItemResult> results) {
        int successCount = (int) results.stream().filter(ItemResult::isSuccess).count();
        return BatchResult.builder()
                .mode(mode)
                .results(results)
                .total(results.size())
                .successCount(successCount)
                .failedCount(results.size() - successCount)
                .build();
    }
}
