package weather.bot;

/**
 * Базовое исключение приложения: ошибки API, сети и хранилищ.
 */
public class WeatherException extends Exception {
    public WeatherException(String message) {
        super(message);
    }

    public WeatherException(String message, Throwable cause) {
        super(message, cause);
    }
}
