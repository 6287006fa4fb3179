package weather.bot;

import java.util.Locale;
import java.util.Objects;

/**
 * Ключ записи кэша: либо нормализованное название города, либо координаты.
 */
public final class CacheKey {
    private final String city;
    private final Coordinates coordinates;

    private CacheKey(String city, Coordinates coordinates) {
        this.city = city;
        this.coordinates = coordinates;
    }

    /**
     * Ключ по городу. Название обрезается и приводится к нижнему регистру,
     * так что "Moscow" и " moscow " дают один и тот же ключ.
     */
    public static CacheKey city(String city) {
        if (city == null || city.trim().isEmpty()) {
            throw new IllegalArgumentException("Название города не может быть пустым");
        }
        return new CacheKey(city.trim().toLowerCase(Locale.ROOT), null);
    }

    public static CacheKey coordinates(Coordinates coordinates) {
        return new CacheKey(null, Objects.requireNonNull(coordinates, "coordinates"));
    }

    public static CacheKey coordinates(double lat, double lon) {
        return coordinates(new Coordinates(lat, lon));
    }

    public boolean isCity() {
        return city != null;
    }

    /** Нормализованное название; {@code null} для ключа по координатам. */
    public String city() {
        return city;
    }

    /** Координаты; {@code null} для ключа по городу. */
    public Coordinates coordinates() {
        return coordinates;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheKey)) return false;
        CacheKey other = (CacheKey) o;
        return Objects.equals(city, other.city) && Objects.equals(coordinates, other.coordinates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(city, coordinates);
    }

    @Override
    public String toString() {
        return isCity() ? city : coordinates.toString();
    }
}
