package weather.bot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Данные пользователей в одном JSON-объекте, ключ - id пользователя.
 */
public class UserSettingsStore {
    private static final Logger log = LoggerFactory.getLogger(UserSettingsStore.class);

    private final Path file;
    private final ObjectMapper mapper;
    private final ReentrantLock lock = new ReentrantLock();

    public UserSettingsStore(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    /** Настройки пользователя; для неизвестного пользователя - пустые. */
    public UserSettings load(long userId) {
        JsonNode node = loadAll().get(Long.toString(userId));
        return node == null ? new UserSettings() : fromNode(node);
    }

    public List<Long> userIds() {
        List<Long> ids = new ArrayList<>();
        Iterator<String> names = loadAll().fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            try {
                ids.add(Long.parseLong(name));
            } catch (NumberFormatException e) {
                log.warn("Пропускаем запись с некорректным id пользователя: {}", name);
            }
        }
        return ids;
    }

    /**
     * Сохраняет или обновляет данные пользователя.
     *
     * @throws WeatherException если файл не удалось записать
     */
    public void save(long userId, UserSettings settings) throws WeatherException {
        update(userId, current -> settings);
    }

    /**
     * Читает настройки, изменяет их и записывает обратно под одной блокировкой,
     * так что параллельные изменения одного файла не теряются.
     *
     * @return записанные настройки
     * @throws WeatherException если файл не удалось записать
     */
    public UserSettings update(long userId, UnaryOperator<UserSettings> change) throws WeatherException {
        lock.lock();
        try {
            ObjectNode all = loadAll();
            String id = Long.toString(userId);
            JsonNode node = all.get(id);
            UserSettings updated = change.apply(node == null ? new UserSettings() : fromNode(node));
            all.set(id, toNode(updated));
            JsonFiles.replace(mapper, file, all);
            return updated;
        } catch (IOException e) {
            throw new WeatherException("Ошибка при сохранении данных пользователя " + userId + ": " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    private ObjectNode loadAll() {
        JsonNode root = JsonFiles.readOrNull(mapper, file);
        if (root instanceof ObjectNode) {
            return (ObjectNode) root;
        }
        if (root != null) {
            log.warn("Корень {} не объект, считаем данные пользователей пустыми", file);
        }
        return mapper.createObjectNode();
    }

    private ObjectNode toNode(UserSettings settings) {
        ObjectNode node = mapper.createObjectNode();
        if (settings.city != null) node.put("city", settings.city);
        if (settings.lat != null) node.put("lat", settings.lat);
        if (settings.lon != null) node.put("lon", settings.lon);
        ObjectNode notifications = node.putObject("notifications");
        notifications.put("enabled", settings.notifications.enabled);
        notifications.put("interval_h", settings.notifications.intervalHours);
        if (settings.notifications.lastNotifiedAt != null) {
            notifications.put("last_notified_at", settings.notifications.lastNotifiedAt.toString());
        }
        return node;
    }

    private static UserSettings fromNode(JsonNode node) {
        UserSettings settings = new UserSettings();
        settings.city = node.hasNonNull("city") ? node.get("city").asText() : null;
        settings.lat = node.has("lat") && node.get("lat").isNumber() ? node.get("lat").asDouble() : null;
        settings.lon = node.has("lon") && node.get("lon").isNumber() ? node.get("lon").asDouble() : null;
        JsonNode n = node.get("notifications");
        if (n != null && n.isObject()) {
            settings.notifications.enabled = n.path("enabled").asBoolean(false);
            settings.notifications.intervalHours = n.path("interval_h").asInt(NotificationSettings.DEFAULT_INTERVAL_HOURS);
            if (n.hasNonNull("last_notified_at")) {
                try {
                    settings.notifications.lastNotifiedAt = Instant.parse(n.get("last_notified_at").asText());
                } catch (DateTimeParseException e) {
                    log.warn("Некорректная дата последнего уведомления: {}", n.get("last_notified_at").asText());
                }
            }
        }
        return settings;
    }
}
