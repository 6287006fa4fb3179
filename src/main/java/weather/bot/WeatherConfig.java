package weather.bot;

import io.github.cdimascio.dotenv.Dotenv;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Настройки приложения. Значения берутся из .env или переменных окружения,
 * отсутствующие заменяются значениями по умолчанию.
 */
public final class WeatherConfig {
    public static final String DEFAULT_BASE_URL = "https://api.openweathermap.org";

    public final String apiKey;
    public final String baseUrl;
    public final String lang;
    public final String units;
    public final Path cacheFile;
    public final Duration cacheTtl;
    public final Path userDataFile;
    public final int maxAttempts;
    public final Duration retryDelay;
    public final Duration notificationCheckInterval;

    private WeatherConfig(Builder b) {
        this.apiKey = b.apiKey;
        this.baseUrl = b.baseUrl;
        this.lang = b.lang;
        this.units = b.units;
        this.cacheFile = b.cacheFile;
        this.cacheTtl = b.cacheTtl;
        this.userDataFile = b.userDataFile;
        this.maxAttempts = b.maxAttempts;
        this.retryDelay = b.retryDelay;
        this.notificationCheckInterval = b.notificationCheckInterval;
    }

    public static WeatherConfig load() {
        return fromDotenv(Dotenv.configure().ignoreIfMissing().load());
    }

    static WeatherConfig fromDotenv(Dotenv dotenv) {
        String apiKey = dotenv.get("OPENWEATHER_API_KEY", dotenv.get("API_KEY"));
        return builder()
                .apiKey(apiKey)
                .baseUrl(dotenv.get("OPENWEATHER_BASE_URL", DEFAULT_BASE_URL))
                .lang(dotenv.get("WEATHER_LANG", "ru"))
                .units(dotenv.get("WEATHER_UNITS", "metric"))
                .cacheFile(Paths.get(dotenv.get("CACHE_FILE", "weather_cache.json")))
                .cacheTtl(Duration.ofMinutes(parseLong(dotenv, "CACHE_TTL_MINUTES", 180)))
                .userDataFile(Paths.get(dotenv.get("USER_DATA_FILE", "User_Data.json")))
                .maxAttempts((int) parseLong(dotenv, "HTTP_MAX_ATTEMPTS", 3))
                .retryDelay(Duration.ofMillis(parseLong(dotenv, "HTTP_RETRY_DELAY_MS", 1000)))
                .notificationCheckInterval(Duration.ofMillis(parseLong(dotenv, "NOTIFICATION_CHECK_INTERVAL_MS", 60000)))
                .build();
    }

    private static long parseLong(Dotenv dotenv, String name, long defaultValue) {
        String raw = dotenv.get(name);
        if (raw == null || raw.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Переменная " + name + " должна быть числом: " + raw, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String apiKey;
        private String baseUrl = DEFAULT_BASE_URL;
        private String lang = "ru";
        private String units = "metric";
        private Path cacheFile = Paths.get("weather_cache.json");
        private Duration cacheTtl = Duration.ofHours(3);
        private Path userDataFile = Paths.get("User_Data.json");
        private int maxAttempts = 3;
        private Duration retryDelay = Duration.ofSeconds(1);
        private Duration notificationCheckInterval = Duration.ofMinutes(1);

        private Builder() {
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder lang(String lang) {
            this.lang = lang;
            return this;
        }

        public Builder units(String units) {
            this.units = units;
            return this;
        }

        public Builder cacheFile(Path cacheFile) {
            this.cacheFile = cacheFile;
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        public Builder userDataFile(Path userDataFile) {
            this.userDataFile = userDataFile;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder notificationCheckInterval(Duration notificationCheckInterval) {
            this.notificationCheckInterval = notificationCheckInterval;
            return this;
        }

        public WeatherConfig build() {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("HTTP_MAX_ATTEMPTS должен быть не меньше 1: " + maxAttempts);
            }
            if (cacheTtl == null || cacheTtl.isZero() || cacheTtl.isNegative()) {
                throw new IllegalArgumentException("TTL кэша должен быть положительным: " + cacheTtl);
            }
            return new WeatherConfig(this);
        }
    }
}
