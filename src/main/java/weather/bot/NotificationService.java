package weather.bot;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Повторная отправка погоды пользователям с включёнными уведомлениями.
 */
public class NotificationService {
    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);
    static final String HEADER = "🔔 <b>Ваше уведомление о погоде</b>";

    private final UserSettingsStore users;
    private final WeatherService weather;
    private final WeatherFormatter formatter;
    private final MessageSender sender;
    private final Clock clock;

    public NotificationService(UserSettingsStore users, WeatherService weather, WeatherFormatter formatter,
                               MessageSender sender, Clock clock) {
        this.users = users;
        this.weather = weather;
        this.formatter = formatter;
        this.sender = sender;
        this.clock = clock;
    }

    /**
     * Отправляет уведомление, если они включены, город сохранён и с прошлого
     * уведомления прошёл выбранный интервал.
     *
     * @return {@code true}, если уведомление отправлено
     */
    public boolean checkAndNotify(long userId) {
        UserSettings settings = users.load(userId);
        Instant now = clock.instant();
        if (!settings.notifications.isDue(now) || !settings.hasLocation()) {
            return false;
        }

        JsonNode data;
        try {
            data = weather.getWeatherByCity(settings.city);
        } catch (WeatherException e) {
            log.error("Не удалось получить погоду для уведомления пользователю {} ({}): {}",
                    userId, settings.city, e.getMessage());
            return false;
        }

        sender.send(userId, HEADER);
        sender.send(userId, formatter.formatCurrent(data));

        try {
            users.update(userId, current -> {
                current.notifications.lastNotifiedAt = now;
                return current;
            });
        } catch (WeatherException e) {
            log.error("Не удалось сохранить время уведомления пользователя {}: {}", userId, e.getMessage());
        }
        return true;
    }
}
