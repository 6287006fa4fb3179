package weather.bot;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class WeatherBotTest {

    private static final long USER = 5L;

    @TempDir
    Path tempDir;

    private MockWebServer server;
    private WeatherBot bot;
    private Path userData;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        userData = tempDir.resolve("User_Data.json");
        WeatherConfig config = WeatherConfig.builder()
                .apiKey("test-api-key")
                .baseUrl(server.url("/").toString())
                .cacheFile(tempDir.resolve("weather_cache.json"))
                .userDataFile(userData)
                .cacheTtl(Duration.ofHours(3))
                .maxAttempts(1)
                .build();
        bot = WeatherBot.create(config, new RecordingSender(),
                new MutableClock(Instant.parse("2026-10-19T12:00:00Z")));
    }

    @AfterEach
    void tearDown() throws IOException {
        bot.close();
        server.shutdown();
    }

    @Test
    void weatherForCity_remembersCityForLaterActions() throws Exception {
        enqueueJson(WeatherServiceTest.Fixtures.GEOCODE_MOSCOW);
        enqueueJson(WeatherServiceTest.Fixtures.WEATHER_MOSCOW);

        String text = bot.weatherForCity(USER, "Москва");

        assertTrue(text.contains("Погода в Москва"));
        UserSettings saved = new UserSettingsStore(userData, new ObjectMapper()).load(USER);
        assertEquals("Москва", saved.city);
        assertEquals(new Coordinates(55.7558, 37.6176), saved.coordinates());

        enqueueJson(WeatherServiceTest.Fixtures.FORECAST_MOSCOW);
        assertTrue(bot.forecast(USER).contains("Прогноз погоды на 5 дней"));
    }

    @Test
    void weatherForCity_unknownCity_saysNotFound() {
        enqueueJson("[]");

        assertEquals("😔 Город 'Атлантида' не найден.", bot.weatherForCity(USER, "Атлантида"));
    }

    @Test
    void forecast_withoutSavedLocation_asksForCity() {
        assertEquals(WeatherBot.NO_LOCATION, bot.forecast(USER));
        assertEquals(WeatherBot.NO_LOCATION, bot.extended(USER));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void weatherForLocation_resolvesCityAndUsesCoordinateCache() {
        enqueueJson(WeatherServiceTest.Fixtures.REVERSE_MOSCOW);
        enqueueJson(WeatherServiceTest.Fixtures.WEATHER_MOSCOW);

        String first = bot.weatherForLocation(USER, 55.75, 37.62);
        String second = bot.weatherForLocation(USER, 55.75, 37.62);

        assertTrue(first.startsWith("📍 Ваша геолокация определена как: Москва."));
        assertEquals(first, second);
        assertEquals(2, server.getRequestCount());
    }

    @Test
    void extended_airQualityUnavailable_stillShowsWeather() {
        enqueueJson(WeatherServiceTest.Fixtures.REVERSE_MOSCOW);
        enqueueJson(WeatherServiceTest.Fixtures.WEATHER_MOSCOW);
        bot.weatherForLocation(USER, 55.75, 37.62);
        server.enqueue(new MockResponse().setResponseCode(500));

        String text = bot.extended(USER);

        assertTrue(text.contains("Расширенные данные о погоде"));
        assertFalse(text.contains("Качество воздуха"));
    }

    @Test
    void compare_secondCityMissing_reportsIt() {
        enqueueJson(WeatherServiceTest.Fixtures.GEOCODE_MOSCOW);
        enqueueJson(WeatherServiceTest.Fixtures.WEATHER_MOSCOW);
        enqueueJson("[]");

        assertEquals("Город 'Nowhere' не найден.", bot.compare("Москва", "Nowhere"));
    }

    @Test
    void notificationSettings_toggleAndCycle() {
        assertEquals("Уведомления включены.", bot.toggleNotifications(USER));
        assertEquals("Интервал изменен на 6 ч.", bot.cycleNotificationInterval(USER));
        assertEquals("Уведомления выключены.", bot.toggleNotifications(USER));
    }

    @Test
    void notificationSettings_keepSavedCity() throws Exception {
        enqueueJson(WeatherServiceTest.Fixtures.GEOCODE_MOSCOW);
        enqueueJson(WeatherServiceTest.Fixtures.WEATHER_MOSCOW);
        bot.weatherForCity(USER, "Москва");

        bot.toggleNotifications(USER);
        bot.cycleNotificationInterval(USER);

        UserSettings saved = new UserSettingsStore(userData, new ObjectMapper()).load(USER);
        assertEquals("Москва", saved.city);
        assertTrue(saved.notifications.enabled);
        assertEquals(6, saved.notifications.intervalHours);
    }

    private void enqueueJson(String body) {
        server.enqueue(new MockResponse()
                .setBody(body)
                .addHeader("Content-Type", "application/json"));
    }
}
