package weather.bot;

import java.time.Duration;
import java.time.Instant;

/**
 * Настройки уведомлений пользователя.
 */
public class NotificationSettings {
    static final int[] INTERVALS_HOURS = {1, 3, 6, 12, 24};
    static final int DEFAULT_INTERVAL_HOURS = 3;

    public boolean enabled;
    public int intervalHours = DEFAULT_INTERVAL_HOURS;
    public Instant lastNotifiedAt;

    public Duration interval() {
        return Duration.ofHours(intervalHours);
    }

    /**
     * Следующий интервал по кругу 1 → 3 → 6 → 12 → 24 → 1. Нестандартное
     * значение сбрасывается на 3 часа.
     */
    public int nextIntervalHours() {
        for (int i = 0; i < INTERVALS_HOURS.length; i++) {
            if (INTERVALS_HOURS[i] == intervalHours) {
                return INTERVALS_HOURS[(i + 1) % INTERVALS_HOURS.length];
            }
        }
        return DEFAULT_INTERVAL_HOURS;
    }

    /** Пора ли отправить уведомление в момент {@code now}. */
    public boolean isDue(Instant now) {
        if (!enabled) {
            return false;
        }
        return lastNotifiedAt == null || Duration.between(lastNotifiedAt, now).compareTo(interval()) >= 0;
    }
}
