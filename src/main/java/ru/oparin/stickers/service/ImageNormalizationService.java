package ru.oparin.stickers.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;

/**
 * Сервис приведения изображений к виду, пригодному для синтеза и хранения:
 * заливка прозрачного фона белым и вписывание в квадрат фиксированного размера.
 */
@Slf4j
@Service
public class ImageNormalizationService {

    private static final String DATA_URL_PREFIX = "data:";
    private static final String BASE64_MARKER = ";base64,";
    private static final String PNG_DATA_URL_PREFIX = "data:image/png;base64,";

    /**
     * Залить прозрачный фон исходного изображения белым.
     * Ссылки, не являющиеся data URL, возвращаются без изменений.
     *
     * @param image data URL или http(s) ссылка
     * @return PNG data URL без прозрачности
     * @throws IOException если изображение не удалось прочитать
     */
    public String flattenToWhite(String image) throws IOException {
        if (!isDataUrl(image)) {
            log.debug("Исходное изображение передано ссылкой, заливка фона пропущена");
            return image;
        }
        BufferedImage source = readImage(decodeDataUrl(image));
        BufferedImage flattened = ensureRgb(source);
        return toDataUrl(writePng(flattened));
    }

    /**
     * Вписать изображение в квадрат size x size с сохранением пропорций на белом фоне.
     *
     * @param imageBytes исходные байты изображения
     * @param size       сторона квадрата в пикселях
     * @return байты PNG
     * @throws IOException если изображение не удалось прочитать или записать
     */
    public byte[] toCanonicalPng(byte[] imageBytes, int size) throws IOException {
        BufferedImage image = readImage(imageBytes);
        int width = image.getWidth();
        int height = image.getHeight();

        double scale = Math.min((double) size / width, (double) size / height);
        int newWidth = Math.max(1, (int) Math.round(width * scale));
        int newHeight = Math.max(1, (int) Math.round(height * scale));
        int x = (size - newWidth) / 2;
        int y = (size - newHeight) / 2;

        BufferedImage canvas = new BufferedImage(size, size, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = canvas.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, size, size);
        g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g.drawImage(image, x, y, newWidth, newHeight, null);
        g.dispose();

        log.debug("Изображение {}x{} вписано в {}x{}", width, height, size, size);
        return writePng(canvas);
    }

    public String toDataUrl(byte[] png) {
        return PNG_DATA_URL_PREFIX + Base64.getEncoder().encodeToString(png);
    }

    /**
     * Декодировать содержимое data URL.
     *
     * @throws IllegalArgumentException если строка не является base64 data URL
     */
    public byte[] decodeDataUrl(String dataUrl) {
        int marker = dataUrl != null ? dataUrl.indexOf(BASE64_MARKER) : -1;
        if (!isDataUrl(dataUrl) || marker < 0) {
            throw new IllegalArgumentException("Ожидался base64 data URL");
        }
        return Base64.getDecoder().decode(dataUrl.substring(marker + BASE64_MARKER.length()));
    }

    private boolean isDataUrl(String value) {
        return value != null && value.startsWith(DATA_URL_PREFIX);
    }

    private BufferedImage readImage(byte[] imageBytes) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(imageBytes));
        if (image == null) {
            throw new IOException("Не удалось прочитать изображение");
        }
        return image;
    }

    private BufferedImage ensureRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, rgb.getWidth(), rgb.getHeight());
        g.drawImage(image, 0, 0, null);
        g.dispose();
        return rgb;
    }

    private byte[] writePng(BufferedImage image) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        if (!ImageIO.write(image, "png", baos)) {
            throw new IOException("Не найден PNG writer");
        }
        return baos.toByteArray();
    }
}
