package weather.bot;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Кэш ответов API с ограниченным временем жизни поверх {@link RecordStore}.
 * <p>
 * Запись адресуется парой (kind, ключ). Устаревшие записи не удаляются:
 * {@link #lookup} их просто не возвращает, а {@link #lookupAnyAge} отдаёт
 * как запасной вариант, если свежие данные получить не удалось.
 * Цикл «прочитать-изменить-записать» в {@link #upsert} выполняется под
 * блокировкой, поэтому параллельные вызовы не теряют обновлений.
 */
public class CacheManager {
    private static final Logger log = LoggerFactory.getLogger(CacheManager.class);

    private final RecordStore store;
    private final Duration ttl;
    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public CacheManager(RecordStore store, Duration ttl, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL должен быть положительным: " + ttl);
        }
        this.ttl = ttl;
    }

    public CacheManager(RecordStore store, Duration ttl) {
        this(store, ttl, Clock.systemUTC());
    }

    public Duration ttl() {
        return ttl;
    }

    /**
     * Свежий ответ для (kind, key) или пусто, если записи нет или она устарела.
     */
    public Optional<JsonNode> lookup(String kind, CacheKey key) {
        Optional<CacheEntry> entry = lookupAnyAge(kind, key);
        if (entry.isEmpty()) {
            log.debug("Промах кэша: {} {}", kind, key);
            return Optional.empty();
        }
        if (!entry.get().isFresh(clock.instant(), ttl)) {
            log.debug("Запись кэша устарела: {} {} (получена {})", kind, key, entry.get().fetchedAt);
            return Optional.empty();
        }
        return Optional.of(entry.get().payload);
    }

    /**
     * Первая запись для (kind, key) независимо от её возраста.
     */
    public Optional<CacheEntry> lookupAnyAge(String kind, CacheKey key) {
        requireKind(kind);
        Objects.requireNonNull(key, "key");
        lock.readLock().lock();
        try {
            for (CacheEntry entry : store.load()) {
                if (entry.matches(kind, key)) {
                    return Optional.of(entry);
                }
            }
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Заменяет запись для (kind, key) на месте или добавляет новую в конец,
     * после чего сохраняет документ целиком. Повторные записи с тем же ключом,
     * если они попали в файл извне, удаляются.
     *
     * @throws CachePersistenceException если документ не удалось записать
     * @throws IllegalArgumentException если payload равен JSON null или отсутствует
     */
    public void upsert(String kind, CacheKey key, JsonNode payload) throws CachePersistenceException {
        requireKind(kind);
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(payload, "payload");
        if (payload.isMissingNode() || payload.isNull()) {
            throw new IllegalArgumentException("Пустые данные нельзя сохранить в кэш");
        }
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            CacheEntry fresh = new CacheEntry(kind, key, now, payload);
            List<CacheEntry> entries = store.load();
            int position = -1;
            for (int i = 0; i < entries.size(); i++) {
                if (entries.get(i).matches(kind, key)) {
                    position = i;
                    break;
                }
            }
            if (position < 0) {
                entries.add(fresh);
            } else {
                entries.set(position, fresh);
                for (int i = entries.size() - 1; i > position; i--) {
                    if (entries.get(i).matches(kind, key)) {
                        log.warn("Удаляем дубликат записи кэша {} {}", kind, key);
                        entries.remove(i);
                    }
                }
            }
            store.replace(entries);
            log.debug("Кэш обновлён: {} {}", kind, key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static void requireKind(String kind) {
        if (kind == null || kind.trim().isEmpty()) {
            throw new IllegalArgumentException("Категория запроса не может быть пустой");
        }
    }
}
