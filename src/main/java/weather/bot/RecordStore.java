package weather.bot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Файловое хранилище записей кэша: один JSON-массив, который читается и
 * заменяется только целиком.
 * <p>
 * Формат элемента: {@code kind}, либо {@code city}, либо пара {@code lat}/{@code lon},
 * {@code fetched_at} (ISO-8601) и {@code payload} - ответ API без изменений.
 */
public class RecordStore {
    private static final Logger log = LoggerFactory.getLogger(RecordStore.class);

    static final String KIND = "kind";
    static final String CITY = "city";
    static final String LAT = "lat";
    static final String LON = "lon";
    static final String FETCHED_AT = "fetched_at";
    static final String PAYLOAD = "payload";

    private final Path file;
    private final ObjectMapper mapper;

    public RecordStore(Path file, ObjectMapper mapper) {
        this.file = Objects.requireNonNull(file, "file");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public RecordStore(Path file) {
        this(file, new ObjectMapper());
    }

    public Path file() {
        return file;
    }

    /**
     * Все записи в порядке документа. Отсутствие или порча файла дают пустой
     * список; отдельные битые элементы пропускаются.
     */
    public List<CacheEntry> load() {
        JsonNode root = JsonFiles.readOrNull(mapper, file);
        if (root == null) {
            return new ArrayList<>();
        }
        if (!root.isArray()) {
            log.warn("Корень кэша {} не массив ({}), считаем кэш пустым", file, root.getNodeType());
            return new ArrayList<>();
        }
        List<CacheEntry> entries = new ArrayList<>(root.size());
        int index = 0;
        for (JsonNode node : root) {
            CacheEntry entry = parseEntry(node);
            if (entry == null) {
                log.warn("Пропускаем некорректную запись кэша #{} в {}", index, file);
            } else {
                entries.add(entry);
            }
            index++;
        }
        return entries;
    }

    /**
     * Перезаписывает документ переданной последовательностью записей.
     *
     * @throws CachePersistenceException если файл не удалось записать
     */
    public void replace(List<CacheEntry> entries) throws CachePersistenceException {
        ArrayNode document = mapper.createArrayNode();
        for (CacheEntry entry : entries) {
            document.add(toNode(entry));
        }
        try {
            JsonFiles.replace(mapper, file, document);
            log.debug("Кэш {} сохранён, записей: {}", file, entries.size());
        } catch (IOException e) {
            throw new CachePersistenceException("Ошибка записи кэша в " + file + ": " + e.getMessage(), e);
        }
    }

    private ObjectNode toNode(CacheEntry entry) {
        ObjectNode node = mapper.createObjectNode();
        node.put(KIND, entry.kind);
        if (entry.key.isCity()) {
            node.put(CITY, entry.key.city());
        } else {
            node.put(LAT, entry.key.coordinates().lat);
            node.put(LON, entry.key.coordinates().lon);
        }
        node.put(FETCHED_AT, entry.fetchedAt.toString());
        node.set(PAYLOAD, entry.payload);
        return node;
    }

    private static CacheEntry parseEntry(JsonNode node) {
        if (!node.isObject()) {
            return null;
        }
        JsonNode kind = node.get(KIND);
        JsonNode fetchedAt = node.get(FETCHED_AT);
        JsonNode payload = node.get(PAYLOAD);
        if (kind == null || !kind.isTextual() || kind.asText().isEmpty()
                || fetchedAt == null || !fetchedAt.isTextual()
                || payload == null || payload.isNull()) {
            return null;
        }
        CacheKey key = parseKey(node);
        if (key == null) {
            return null;
        }
        try {
            return new CacheEntry(kind.asText(), key, Instant.parse(fetchedAt.asText()), payload);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static CacheKey parseKey(JsonNode node) {
        JsonNode city = node.get(CITY);
        JsonNode lat = node.get(LAT);
        JsonNode lon = node.get(LON);
        boolean hasCity = city != null && city.isTextual();
        boolean hasCoordinates = lat != null && lat.isNumber() && lon != null && lon.isNumber();
        if (hasCity == hasCoordinates) {
            return null;
        }
        try {
            return hasCity ? CacheKey.city(city.asText()) : CacheKey.coordinates(lat.asDouble(), lon.asDouble());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return "RecordStore{" + file + "}";
    }
}
