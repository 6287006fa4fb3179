package weather.bot;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Элемент кэша: ответ API, его категория, ключ и время получения.
 */
public final class CacheEntry {
    public final String kind;
    public final CacheKey key;
    public final Instant fetchedAt;
    public final JsonNode payload;

    public CacheEntry(String kind, CacheKey key, Instant fetchedAt, JsonNode payload) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.key = Objects.requireNonNull(key, "key");
        this.fetchedAt = Objects.requireNonNull(fetchedAt, "fetchedAt");
        this.payload = Objects.requireNonNull(payload, "payload");
    }

    public boolean matches(String kind, CacheKey key) {
        return this.kind.equals(kind) && this.key.equals(key);
    }

    /** Запись свежая, пока её возраст строго меньше ttl. */
    public boolean isFresh(Instant now, Duration ttl) {
        return Duration.between(fetchedAt, now).compareTo(ttl) < 0;
    }
}
