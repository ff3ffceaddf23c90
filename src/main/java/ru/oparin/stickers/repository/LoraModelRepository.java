package ru.oparin.stickers.repository;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import ru.oparin.stickers.model.entity.LoraModel;

public interface LoraModelRepository extends ReactiveCrudRepository<LoraModel, Long> {
}
