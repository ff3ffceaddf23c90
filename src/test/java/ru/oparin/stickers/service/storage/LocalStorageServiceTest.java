package ru.oparin.stickers.service.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class LocalStorageServiceTest {

    @TempDir
    Path uploadDir;

    private LocalStorageService service() {
        return new LocalStorageService(uploadDir.toString(), "stickers.example");
    }

    @Test
    @DisplayName("Файл записывается по пути и доступен по публичной ссылке")
    void writesFileAndReturnsUrl() throws Exception {
        StepVerifier.create(service().upload("emoticons/10/scene_0.png", new byte[]{1, 2, 3}, "image/png"))
                .expectNext("https://stickers.example/files/emoticons/10/scene_0.png")
                .verifyComplete();

        assertThat(Files.readAllBytes(uploadDir.resolve("emoticons/10/scene_0.png"))).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("Повторная загрузка по тому же пути перезаписывает файл")
    void overwritesExistingFile() throws Exception {
        LocalStorageService service = service();
        service.upload("emoticons/10/scene_0.png", new byte[]{1, 2, 3, 4}, "image/png").block();

        StepVerifier.create(service.upload("emoticons/10/scene_0.png", new byte[]{9}, "image/png"))
                .expectNextCount(1)
                .verifyComplete();

        assertThat(Files.readAllBytes(uploadDir.resolve("emoticons/10/scene_0.png"))).containsExactly(9);
    }

    @Test
    @DisplayName("Путь за пределами каталога хранилища отклоняется")
    void rejectsPathTraversal() {
        StepVerifier.create(service().upload("../outside.png", new byte[]{1}, "image/png"))
                .expectError(IllegalArgumentException.class)
                .verify();

        assertThat(Files.exists(uploadDir.resolveSibling("outside.png"))).isFalse();
    }
}
