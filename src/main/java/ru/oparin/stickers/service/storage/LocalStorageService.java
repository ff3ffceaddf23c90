package ru.oparin.stickers.service.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;

/**
 * Хранилище на локальном диске. Файлы раздаются по /files/** (см. WebConfig).
 */
@Slf4j
@Service
public class LocalStorageService implements StorageService {

    private final Path root;
    private final String serverHost;

    public LocalStorageService(@Value("${file.upload-dir}") String uploadDir,
                               @Value("${file.host}") String serverHost) {
        this.root = Paths.get(uploadDir).toAbsolutePath().normalize();
        this.serverHost = serverHost;
    }

    @Override
    public Mono<String> upload(String path, byte[] data, String contentType) {
        return Mono.fromCallable(() -> {
                    Path target = root.resolve(path).normalize();
                    if (!target.startsWith(root)) {
                        throw new IllegalArgumentException("Путь выходит за пределы хранилища: " + path);
                    }
                    Files.createDirectories(target.getParent());
                    Files.write(target, data, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                            StandardOpenOption.WRITE);

                    String fileUrl = "https://" + serverHost + "/files/" + path;
                    log.info("Файл сохранен: {} ({}, {} байт)", fileUrl, contentType, data.length);
                    return fileUrl;
                })
                .subscribeOn(Schedulers.boundedElastic());
    }
}
