package ru.oparin.stickers.repository;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import ru.oparin.stickers.model.entity.EmoticonSeries;

public interface EmoticonSeriesRepository extends ReactiveCrudRepository<EmoticonSeries, Long> {
}
