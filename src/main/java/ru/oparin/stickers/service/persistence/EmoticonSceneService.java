package ru.oparin.stickers.service.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.stickers.config.DatabaseConfig;
import ru.oparin.stickers.model.entity.EmoticonScene;
import ru.oparin.stickers.model.entity.EmoticonSeries;
import ru.oparin.stickers.repository.EmoticonSeriesRepository;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Запись серий и сцен в БД. Только вставка, существующие записи не обновляются.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmoticonSceneService {

    private static final String INSERT_SCENES = "INSERT INTO stickers.emoticon_scenes "
            + "(series_id, scene_number, title, prompt, narrative, image_url, metadata) VALUES ";

    private final EmoticonSeriesRepository seriesRepository;
    private final DatabaseClient databaseClient;

    /**
     * Создать запись серии.
     *
     * @return сохраненная серия со сгенерированным идентификатором
     */
    public Mono<EmoticonSeries> createSeries(EmoticonSeries series) {
        return DatabaseConfig.withRetry(seriesRepository.save(series))
                .doOnNext(saved -> log.info("Создана серия {} для пользователя {}", saved.getId(), saved.getUserId()));
    }

    /**
     * Вставить сцены серии одним многострочным INSERT.
     *
     * @param scenes сцены для вставки
     * @return количество вставленных сцен
     */
    public Mono<Long> insertAll(List<EmoticonScene> scenes) {
        if (scenes.isEmpty()) {
            return Mono.just(0L);
        }
        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(insertSql(scenes.size()));
        for (int i = 0; i < scenes.size(); i++) {
            EmoticonScene scene = scenes.get(i);
            spec = bind(spec, "seriesId" + i, scene.getSeriesId(), Long.class);
            spec = bind(spec, "sceneNumber" + i, scene.getSceneNumber(), Integer.class);
            spec = bind(spec, "title" + i, scene.getTitle(), String.class);
            spec = bind(spec, "prompt" + i, scene.getPrompt(), String.class);
            spec = bind(spec, "narrative" + i, scene.getNarrative() != null ? scene.getNarrative() : "", String.class);
            spec = bind(spec, "imageUrl" + i, scene.getImageUrl(), String.class);
            spec = bind(spec, "metadata" + i, scene.getMetadataJson(), String.class);
        }
        return spec.fetch()
                .rowsUpdated()
                .doOnNext(count -> log.info("Вставлено {} сцен серии {}", count, scenes.get(0).getSeriesId()));
    }

    static String insertSql(int rows) {
        return INSERT_SCENES + IntStream.range(0, rows)
                .mapToObj(i -> String.format("(:seriesId%1$d, :sceneNumber%1$d, :title%1$d, :prompt%1$d, "
                        + ":narrative%1$d, :imageUrl%1$d, :metadata%1$d)", i))
                .collect(Collectors.joining(", "));
    }

    private DatabaseClient.GenericExecuteSpec bind(DatabaseClient.GenericExecuteSpec spec, String name,
                                                   Object value, Class<?> type) {
        return value != null ? spec.bind(name, value) : spec.bindNull(name, type);
    }
}
