package weather.bot;

/**
 * Геокодер не нашёл ни одного места по запросу.
 */
public class LocationNotFoundException extends WeatherException {
    public LocationNotFoundException(String message) {
        super(message);
    }
}
