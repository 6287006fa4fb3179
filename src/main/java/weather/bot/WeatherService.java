package weather.bot;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Основной сервис погоды: сначала кэш, при промахе запрос к API и запись
 * свежего ответа обратно в кэш.
 * <p>
 * Ошибка записи кэша только логируется: пользователь всё равно получает
 * свежие данные. Если API недоступен, возвращается устаревшая запись кэша,
 * когда она есть.
 */
public class WeatherService {
    private static final Logger log = LoggerFactory.getLogger(WeatherService.class);

    private final WeatherApiClient api;
    private final CacheManager cache;
    private final String lang;

    public WeatherService(WeatherApiClient api, CacheManager cache, String lang) {
        this.api = api;
        this.cache = cache;
        this.lang = lang;
    }

    @FunctionalInterface
    interface Fetch {
        JsonNode get() throws WeatherException;
    }

    public Location resolveCity(String city) throws WeatherException {
        if (city == null || city.trim().isEmpty()) {
            throw new WeatherException("Название города не может быть пустым");
        }
        String trimmedCity = city.trim();
        JsonNode places = cached(RequestKind.GEOCODING, CacheKey.city(trimmedCity), () -> {
            JsonNode found = api.geocode(trimmedCity);
            if (Location.fromGeocoding(found, lang) == null) {
                throw new LocationNotFoundException("Город '" + trimmedCity + "' не найден");
            }
            return found;
        });
        return requireLocation(places, "Город '" + trimmedCity + "' не найден");
    }

    public Location resolveLocation(Coordinates coordinates) throws WeatherException {
        JsonNode places = cached(RequestKind.REVERSE_GEOCODING, CacheKey.coordinates(coordinates), () -> {
            JsonNode found = api.reverseGeocode(coordinates);
            if (Location.fromGeocoding(found, lang) == null) {
                throw new LocationNotFoundException("Не удалось определить город для " + coordinates);
            }
            return found;
        });
        return requireLocation(places, "Не удалось определить город для " + coordinates);
    }

    /**
     * Текущая погода по названию. Запись кэшируется под каноническим
     * названием города, которое вернул геокодер.
     */
    public JsonNode getWeatherByCity(String city) throws WeatherException {
        Location location = resolveCity(city);
        return cached(RequestKind.CURRENT_WEATHER, CacheKey.city(location.name),
                () -> api.currentWeather(location.coordinates));
    }

    public JsonNode getWeatherByCoordinates(Coordinates coordinates) throws WeatherException {
        return cached(RequestKind.CURRENT_WEATHER, CacheKey.coordinates(coordinates),
                () -> api.currentWeather(coordinates));
    }

    public JsonNode getForecast(Coordinates coordinates) throws WeatherException {
        return cached(RequestKind.FORECAST, CacheKey.coordinates(coordinates),
                () -> api.forecast(coordinates));
    }

    public JsonNode getAirQuality(Coordinates coordinates) throws WeatherException {
        return cached(RequestKind.AIR_QUALITY, CacheKey.coordinates(coordinates),
                () -> api.airQuality(coordinates));
    }

    JsonNode cached(RequestKind kind, CacheKey key, Fetch fetch) throws WeatherException {
        Optional<JsonNode> hit = cache.lookup(kind.tag(), key);
        if (hit.isPresent()) {
            log.debug("Ответ из кэша: {} {}", kind.tag(), key);
            return hit.get();
        }

        JsonNode fresh;
        try {
            fresh = fetch.get();
        } catch (LocationNotFoundException e) {
            throw e;
        } catch (WeatherException e) {
            Optional<CacheEntry> stale = cache.lookupAnyAge(kind.tag(), key);
            if (stale.isPresent()) {
                log.warn("API недоступен ({}), отдаём устаревшие данные {} {} от {}",
                        e.getMessage(), kind.tag(), key, stale.get().fetchedAt);
                return stale.get().payload;
            }
            throw e;
        }

        try {
            cache.upsert(kind.tag(), key, fresh);
        } catch (CachePersistenceException e) {
            log.warn("Не удалось сохранить ответ в кэш {} {}: {}", kind.tag(), key, e.getMessage());
        }
        return fresh;
    }

    private Location requireLocation(JsonNode places, String notFoundMessage) throws LocationNotFoundException {
        Location location = Location.fromGeocoding(places, lang);
        if (location == null) {
            throw new LocationNotFoundException(notFoundMessage);
        }
        return location;
    }
}
