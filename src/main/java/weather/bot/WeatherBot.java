package weather.bot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.function.UnaryOperator;

/**
 * Главный класс бота: связывает API, кэш, хранилище пользователей и
 * уведомления. Каждое действие возвращает готовый текст ответа.
 */
public class WeatherBot implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WeatherBot.class);
    static final String SAVE_FAILED = "Не удалось сохранить настройки.";
    static final String NO_LOCATION = "Сначала сохраните геолокацию или введите город.";

    private final WeatherApiClient api;
    private final WeatherService weather;
    private final UserSettingsStore users;
    private final WeatherFormatter formatter;
    private final NotificationPoller poller;

    WeatherBot(WeatherApiClient api, WeatherService weather, UserSettingsStore users,
               WeatherFormatter formatter, NotificationPoller poller) {
        this.api = api;
        this.weather = weather;
        this.users = users;
        this.formatter = formatter;
        this.poller = poller;
    }

    public static WeatherBot create(WeatherConfig config, MessageSender sender) {
        return create(config, sender, Clock.systemDefaultZone());
    }

    static WeatherBot create(WeatherConfig config, MessageSender sender, Clock clock) {
        ObjectMapper mapper = new ObjectMapper();
        WeatherApiClient api = new WeatherApiClient(config, mapper);
        CacheManager cache = new CacheManager(new RecordStore(config.cacheFile, mapper), config.cacheTtl, clock);
        WeatherService weather = new WeatherService(api, cache, config.lang);
        UserSettingsStore users = new UserSettingsStore(config.userDataFile, mapper);
        WeatherFormatter formatter = new WeatherFormatter(clock);
        NotificationService notifications = new NotificationService(users, weather, formatter, sender, clock);
        NotificationPoller poller = new NotificationPoller(notifications, users,
                config.notificationCheckInterval.toMillis());
        log.info("Бот инициализирован: кэш {} (TTL {}), пользователи {}",
                config.cacheFile, config.cacheTtl, config.userDataFile);
        return new WeatherBot(api, weather, users, formatter, poller);
    }

    /** Запускает фоновую проверку уведомлений. */
    public void startNotifications() {
        poller.start();
    }

    /**
     * Погода по названию города; найденный город запоминается за пользователем.
     */
    public String weatherForCity(long userId, String city) {
        JsonNode data;
        try {
            data = weather.getWeatherByCity(city);
        } catch (LocationNotFoundException e) {
            return "😔 Город '" + city + "' не найден.";
        } catch (WeatherException e) {
            log.error("Ошибка при получении погоды для {}: {}", city, e.getMessage());
            return "Не удалось получить погоду для " + city + ".";
        }
        rememberLocation(userId, data);
        return formatter.formatCurrent(data);
    }

    /**
     * Погода по геолокации устройства.
     */
    public String weatherForLocation(long userId, double lat, double lon) {
        Coordinates coordinates = new Coordinates(lat, lon);
        Location location;
        JsonNode data;
        try {
            location = weather.resolveLocation(coordinates);
        } catch (WeatherException e) {
            log.warn("Не удалось определить город для {}: {}", coordinates, e.getMessage());
            return "Не удалось определить ваш город. Попробуйте ввести его вручную.";
        }
        try {
            data = weather.getWeatherByCoordinates(coordinates);
        } catch (WeatherException e) {
            log.error("Ошибка при получении погоды для {}: {}", coordinates, e.getMessage());
            return "Не удалось получить погоду для " + location.name + ".";
        }

        update(userId, settings -> {
            settings.setLocation(location.name, coordinates);
            return settings;
        });
        return "📍 Ваша геолокация определена как: " + location.name + ". Сохраняю...\n\n"
                + formatter.formatCurrent(data);
    }

    public String forecast(long userId) {
        UserSettings settings = users.load(userId);
        if (!settings.hasLocation()) {
            return NO_LOCATION;
        }
        try {
            return formatter.formatDailyForecast(weather.getForecast(settings.coordinates()));
        } catch (WeatherException e) {
            log.error("Ошибка при получении прогноза для {}: {}", settings.city, e.getMessage());
            return "Не удалось получить прогноз.";
        }
    }

    public String forecastDay(long userId, int dayOffset) {
        UserSettings settings = users.load(userId);
        if (!settings.hasLocation()) {
            return NO_LOCATION;
        }
        try {
            return formatter.formatHourlyForecast(weather.getForecast(settings.coordinates()), dayOffset);
        } catch (WeatherException e) {
            log.error("Ошибка при получении прогноза для {}: {}", settings.city, e.getMessage());
            return "Не удалось получить прогноз.";
        }
    }

    /**
     * Текущая погода и качество воздуха для сохранённого места. Если качество
     * воздуха недоступно, сообщение строится без него.
     */
    public String extended(long userId) {
        UserSettings settings = users.load(userId);
        if (!settings.hasLocation()) {
            return NO_LOCATION;
        }
        JsonNode current;
        try {
            current = weather.getWeatherByCoordinates(settings.coordinates());
        } catch (WeatherException e) {
            log.error("Ошибка при получении погоды для {}: {}", settings.city, e.getMessage());
            return formatter.formatExtended(null, null);
        }
        JsonNode air = null;
        try {
            air = weather.getAirQuality(settings.coordinates());
        } catch (WeatherException e) {
            log.warn("Качество воздуха для {} недоступно: {}", settings.city, e.getMessage());
        }
        return formatter.formatExtended(current, air);
    }

    public String compare(String firstCity, String secondCity) {
        JsonNode first;
        JsonNode second;
        try {
            first = weather.getWeatherByCity(firstCity);
        } catch (WeatherException e) {
            return "Город '" + firstCity + "' не найден.";
        }
        try {
            second = weather.getWeatherByCity(secondCity);
        } catch (WeatherException e) {
            return "Город '" + secondCity + "' не найден.";
        }
        return formatter.formatComparison(first, second);
    }

    public String toggleNotifications(long userId) {
        UserSettings settings = update(userId, current -> {
            current.notifications.enabled = !current.notifications.enabled;
            return current;
        });
        if (settings == null) {
            return SAVE_FAILED;
        }
        return "Уведомления " + (settings.notifications.enabled ? "включены" : "выключены") + ".";
    }

    public String cycleNotificationInterval(long userId) {
        UserSettings settings = update(userId, current -> {
            current.notifications.intervalHours = current.notifications.nextIntervalHours();
            return current;
        });
        if (settings == null) {
            return SAVE_FAILED;
        }
        return "Интервал изменен на " + settings.notifications.intervalHours + " ч.";
    }

    private void rememberLocation(long userId, JsonNode data) {
        WeatherResponse response;
        try {
            response = WeatherResponse.from(data);
        } catch (WeatherException e) {
            log.warn("Не удалось сохранить город пользователя {}: {}", userId, e.getMessage());
            return;
        }
        if (response.coord == null) {
            return;
        }
        update(userId, settings -> {
            settings.setLocation(response.name, response.coord);
            return settings;
        });
    }

    /** @return записанные настройки или {@code null}, если файл не удалось записать */
    private UserSettings update(long userId, UnaryOperator<UserSettings> change) {
        try {
            return users.update(userId, change);
        } catch (WeatherException e) {
            log.error("{}", e.getMessage(), e);
            return null;
        }
    }

    @Override
    public void close() {
        poller.close();
        api.close();
    }
}
