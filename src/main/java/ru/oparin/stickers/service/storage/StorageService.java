package ru.oparin.stickers.service.storage;

import reactor.core.publisher.Mono;

/**
 * Объектное хранилище изображений.
 */
public interface StorageService {

    /**
     * Загрузить файл. Существующий файл по тому же пути перезаписывается.
     *
     * @param path        относительный путь внутри хранилища
     * @param data        содержимое файла
     * @param contentType MIME тип
     * @return публичная ссылка на файл
     */
    Mono<String> upload(String path, byte[] data, String contentType);
}
