package weather.bot;

/**
 * Не удалось записать документ кэша на диск.
 */
public class CachePersistenceException extends WeatherException {
    public CachePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
