package weather.bot;

/**
 * Категории запросов к API, по которым разделено пространство ключей кэша.
 */
public enum RequestKind {
    CURRENT_WEATHER("current-weather"),
    FORECAST("forecast"),
    AIR_QUALITY("air-quality"),
    GEOCODING("geocoding"),
    REVERSE_GEOCODING("reverse-geocoding");

    private final String tag;

    RequestKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
