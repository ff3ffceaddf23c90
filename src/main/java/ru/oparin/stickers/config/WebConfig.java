package ru.oparin.stickers.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerResponse;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.springframework.web.reactive.function.server.RequestPredicates.GET;
import static org.springframework.web.reactive.function.server.ServerResponse.ok;

/**
 * Раздача сохраненных изображений стикеров из локального хранилища по пути /files/**.
 */
@Configuration
public class WebConfig {

    @Value("${file.upload-dir}")
    private String uploadDir;

    @Bean
    public RouterFunction<ServerResponse> storedFilesRouter() {
        return RouterFunctions
                .route(GET("/files/**"), request -> {
                    String path = request.path().substring("/files/".length());
                    Path root = Paths.get(uploadDir).normalize();
                    Path filePath = root.resolve(path).normalize();

                    // Не выпускаем запрос за пределы корня хранилища
                    if (!filePath.startsWith(root)) {
                        return ServerResponse.notFound().build();
                    }

                    Resource resource = new FileSystemResource(filePath);
                    if (!resource.exists() || !resource.isReadable()) {
                        return ServerResponse.notFound().build();
                    }
                    return ok()
                            .contentType(getContentType(path))
                            .bodyValue(resource);
                });
    }

    private MediaType getContentType(String filename) {
        String extension = filename.toLowerCase();
        if (extension.endsWith(".png")) {
            return MediaType.IMAGE_PNG;
        } else if (extension.endsWith(".jpg") || extension.endsWith(".jpeg")) {
            return MediaType.IMAGE_JPEG;
        } else if (extension.endsWith(".webp")) {
            return MediaType.parseMediaType("image/webp");
        }
        return MediaType.APPLICATION_OCTET_STREAM;
    }
}
