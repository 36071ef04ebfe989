package xyz.vvrf.reactor.flow.client.llm;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Base64;
import java.util.Locale;

/**
 * 读取本地图片并编码为 base64。已经是 data URL 的值直接取其数据部分。
 */
final class ImageEncoder {

    private ImageEncoder() {}

    static String toBase64(String image) {
        if (image.startsWith("data:")) {
            int comma = image.indexOf(',');
            return comma >= 0 ? image.substring(comma + 1) : image;
        }
        Path path = Paths.get(image);
        try {
            return Base64.getEncoder().encodeToString(Files.readAllBytes(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read image " + image, e);
        }
    }

    static String mimeType(String image) {
        if (image.startsWith("data:")) {
            int semicolon = image.indexOf(';');
            return semicolon > 5 ? image.substring(5, semicolon) : "image/png";
        }
        String lower = image.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".jpg") || lower.endsWith(".jpeg")) return "image/jpeg";
        if (lower.endsWith(".gif")) return "image/gif";
        if (lower.endsWith(".bmp")) return "image/bmp";
        return "image/png";
    }
}
