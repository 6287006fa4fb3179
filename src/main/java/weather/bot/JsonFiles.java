package weather.bot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Чтение и запись JSON-документа целиком для файловых хранилищ.
 */
final class JsonFiles {
    private static final Logger log = LoggerFactory.getLogger(JsonFiles.class);

    private JsonFiles() {
    }

    /**
     * Читает документ. Отсутствующий, пустой, нечитаемый или повреждённый файл
     * возвращает {@code null}: такое хранилище считается пустым.
     */
    static JsonNode readOrNull(ObjectMapper mapper, Path file) {
        try {
            if (!Files.exists(file) || Files.size(file) == 0) {
                return null;
            }
            return mapper.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            log.warn("Файл {} повреждён, считаем его пустым: {}", file, e.getOriginalMessage());
            return null;
        } catch (IOException e) {
            log.warn("Не удалось прочитать {}, считаем его пустым: {}", file, e.getMessage());
            return null;
        }
    }

    /**
     * Заменяет документ целиком: пишет во временный файл рядом и переносит его
     * поверх целевого, чтобы читатель никогда не увидел половину записи.
     */
    static void replace(ObjectMapper mapper, Path file, JsonNode document) throws IOException {
        Path target = file.toAbsolutePath();
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.write(tmp, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document));
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
