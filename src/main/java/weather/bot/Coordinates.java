package weather.bot;

/**
 * Пара широта/долгота в градусах.
 */
public final class Coordinates {
    public final double lat;
    public final double lon;

    public Coordinates(double lat, double lon) {
        if (Double.isNaN(lat) || lat < -90.0 || lat > 90.0) {
            throw new IllegalArgumentException("Широта вне диапазона [-90, 90]: " + lat);
        }
        if (Double.isNaN(lon) || lon < -180.0 || lon > 180.0) {
            throw new IllegalArgumentException("Долгота вне диапазона [-180, 180]: " + lon);
        }
        this.lat = lat;
        this.lon = lon;
    }

    // точное сравнение: 55.75 и 55.7558 - разные ключи
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Coordinates)) return false;
        Coordinates other = (Coordinates) o;
        return lat == other.lat && lon == other.lon;
    }

    @Override
    public int hashCode() {
        // +0.0 складывает -0.0 и 0.0, которые равны по ==
        return 31 * Double.hashCode(lat + 0.0) + Double.hashCode(lon + 0.0);
    }

    @Override
    public String toString() {
        return "(" + lat + ", " + lon + ")";
    }
}
