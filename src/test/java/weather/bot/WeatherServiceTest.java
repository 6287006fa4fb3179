package weather.bot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class WeatherServiceTest {

    private static final Duration TTL = Duration.ofHours(1);

    @TempDir
    Path tempDir;

    private MockWebServer server;
    private WeatherApiClient api;
    private MutableClock clock;
    private CacheManager cache;
    private WeatherService service;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String API_KEY = "test-api-key";

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        clock = new MutableClock(Instant.parse("2026-10-19T12:00:00Z"));
        api = new WeatherApiClient(config(API_KEY), mapper);
        cache = new CacheManager(new RecordStore(tempDir.resolve("weather_cache.json"), mapper), TTL, clock);
        service = new WeatherService(api, cache, "ru");
    }

    @AfterEach
    void tearDown() throws IOException {
        api.close();
        server.shutdown();
    }

    @Test
    void getWeatherByCity_validCity_returnsResponse() throws Exception {
        enqueueJson(Fixtures.GEOCODE_MOSCOW);
        enqueueJson(Fixtures.WEATHER_MOSCOW);

        JsonNode weather = service.getWeatherByCity("Москва");

        assertEquals("Москва", weather.get("name").asText());
        assertEquals(4.2, weather.get("main").get("temp").asDouble());

        RecordedRequest geocode = server.takeRequest();
        assertEquals("/geo/1.0/direct", geocode.getRequestUrl().encodedPath());
        assertEquals("Москва", geocode.getRequestUrl().queryParameter("q"));
        assertEquals(API_KEY, geocode.getRequestUrl().queryParameter("appid"));
        assertEquals("ru", geocode.getRequestUrl().queryParameter("lang"));

        RecordedRequest current = server.takeRequest();
        assertEquals("/data/2.5/weather", current.getRequestUrl().encodedPath());
        assertEquals("55.7558", current.getRequestUrl().queryParameter("lat"));
        assertEquals("37.6176", current.getRequestUrl().queryParameter("lon"));
        assertEquals("metric", current.getRequestUrl().queryParameter("units"));
    }

    @Test
    void getWeatherByCity_cachedResponse_returnsFromCache() throws Exception {
        enqueueJson(Fixtures.GEOCODE_MOSCOW);
        enqueueJson(Fixtures.WEATHER_MOSCOW);

        service.getWeatherByCity("Москва");
        assertEquals(2, server.getRequestCount());

        JsonNode again = service.getWeatherByCity("москва");
        assertEquals(2, server.getRequestCount());
        assertEquals("Москва", again.get("name").asText());
        assertTrue(cache.lookup(RequestKind.CURRENT_WEATHER.tag(), CacheKey.city("Москва")).isPresent());
    }

    @Test
    void getWeatherByCity_expiredCache_fetchesNewData() throws Exception {
        enqueueJson(Fixtures.GEOCODE_MOSCOW);
        enqueueJson(Fixtures.WEATHER_MOSCOW);
        enqueueJson(Fixtures.GEOCODE_MOSCOW);
        enqueueJson(Fixtures.WEATHER_MOSCOW.replace("4.2", "9.9"));

        service.getWeatherByCity("Москва");
        clock.advance(TTL.plusSeconds(1));

        JsonNode refreshed = service.getWeatherByCity("Москва");
        assertEquals(4, server.getRequestCount());
        assertEquals(9.9, refreshed.get("main").get("temp").asDouble());
    }

    @Test
    void getWeatherByCity_unknownCity_throwsAndCachesNothing() throws Exception {
        enqueueJson("[]");

        assertThrows(LocationNotFoundException.class, () -> service.getWeatherByCity("Atlantis"));
        assertTrue(cache.lookupAnyAge(RequestKind.GEOCODING.tag(), CacheKey.city("Atlantis")).isEmpty());
    }

    @Test
    void getAirQuality_emptyBody_throwsAndCachesNothing() {
        Coordinates moscow = new Coordinates(55.7558, 37.6176);
        enqueueJson("");

        WeatherException exception = assertThrows(WeatherException.class, () -> service.getAirQuality(moscow));
        assertTrue(exception.getMessage().contains("Пустое тело"));
        assertEquals(1, server.getRequestCount());
        assertTrue(cache.lookupAnyAge(RequestKind.AIR_QUALITY.tag(), CacheKey.coordinates(moscow)).isEmpty());
    }

    @Test
    void getWeatherByCity_blankCity_throwsException() {
        assertThrows(WeatherException.class, () -> service.getWeatherByCity("   "));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void getWeather_invalidApiKey_throwsWithoutRetry() {
        server.enqueue(new MockResponse()
                .setResponseCode(401)
                .setBody(Fixtures.UNAUTHORIZED_RESPONSE)
                .addHeader("Content-Type", "application/json"));

        WeatherException exception = assertThrows(WeatherException.class,
                () -> service.getWeatherByCoordinates(new Coordinates(51.5085, -0.1257)));
        assertTrue(exception.getMessage().contains("401"));
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void getWeather_notFound_throwsWithoutRetry() {
        server.enqueue(new MockResponse()
                .setResponseCode(404)
                .setBody(Fixtures.ERROR_RESPONSE)
                .addHeader("Content-Type", "application/json"));

        WeatherException exception = assertThrows(WeatherException.class,
                () -> service.getForecast(new Coordinates(0.0, 0.0)));
        assertTrue(exception.getMessage().contains("404"));
        assertTrue(exception.getMessage().contains("city not found"));
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void getWeather_tooManyRequests_retriesAndSucceeds() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("{\"message\": \"slow down\"}"));
        enqueueJson(Fixtures.WEATHER_MOSCOW);

        JsonNode weather = service.getWeatherByCoordinates(new Coordinates(55.7558, 37.6176));

        assertEquals("Москва", weather.get("name").asText());
        assertEquals(2, server.getRequestCount());
    }

    @Test
    void getWeather_serverErrors_exhaustRetries() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(500));
        }

        WeatherException exception = assertThrows(WeatherException.class,
                () -> service.getAirQuality(new Coordinates(55.7558, 37.6176)));
        assertTrue(exception.getMessage().contains("500"));
        assertEquals(3, server.getRequestCount());
    }

    @Test
    void getWeather_apiDown_returnsStaleCacheEntry() throws Exception {
        Coordinates moscow = new Coordinates(55.7558, 37.6176);
        enqueueJson(Fixtures.WEATHER_MOSCOW);
        service.getWeatherByCoordinates(moscow);

        clock.advance(TTL.multipliedBy(2));
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(503));
        }

        JsonNode stale = service.getWeatherByCoordinates(moscow);
        assertEquals(4.2, stale.get("main").get("temp").asDouble());
        assertEquals(4, server.getRequestCount());
    }

    @Test
    void getWeather_cacheWriteFails_stillReturnsFreshPayload() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "x");
        CacheManager brokenCache = new CacheManager(new RecordStore(blocker.resolve("cache.json"), mapper), TTL, clock);
        WeatherService brokenService = new WeatherService(api, brokenCache, "ru");
        enqueueJson(Fixtures.WEATHER_MOSCOW);
        enqueueJson(Fixtures.WEATHER_MOSCOW);

        Coordinates moscow = new Coordinates(55.7558, 37.6176);
        assertEquals("Москва", brokenService.getWeatherByCoordinates(moscow).get("name").asText());
        // ничего не сохранилось, поэтому второй вызов снова идёт в API
        brokenService.getWeatherByCoordinates(moscow);
        assertEquals(2, server.getRequestCount());
    }

    @Test
    void forecastAndAirQuality_cachedSeparatelyByCoordinates() throws Exception {
        Coordinates moscow = new Coordinates(55.7558, 37.6176);
        enqueueJson(Fixtures.FORECAST_MOSCOW);
        enqueueJson(Fixtures.AIR_MOSCOW);

        service.getForecast(moscow);
        service.getAirQuality(moscow);
        JsonNode air = service.getAirQuality(moscow);
        service.getForecast(moscow);

        assertEquals(2, server.getRequestCount());
        assertEquals(2, air.get("list").get(0).get("main").get("aqi").asInt());
        assertEquals("/data/2.5/forecast", server.takeRequest().getRequestUrl().encodedPath());
        assertEquals("/data/2.5/air_pollution", server.takeRequest().getRequestUrl().encodedPath());
    }

    @Test
    void resolveLocation_prefersLocalName() throws Exception {
        enqueueJson(Fixtures.REVERSE_MOSCOW);

        Location location = service.resolveLocation(new Coordinates(55.75, 37.62));

        assertEquals("Москва", location.name);
        assertEquals("RU", location.country);
        assertEquals("/geo/1.0/reverse", server.takeRequest().getRequestUrl().encodedPath());
    }

    private WeatherConfig config(String apiKey) {
        return WeatherConfig.builder()
                .apiKey(apiKey)
                .baseUrl(server.url("/").toString())
                .maxAttempts(3)
                .retryDelay(Duration.ofMillis(10))
                .build();
    }

    private void enqueueJson(String body) {
        server.enqueue(new MockResponse()
                .setBody(body)
                .addHeader("Content-Type", "application/json"));
    }

    static class Fixtures {
        static final String GEOCODE_MOSCOW = """
                [
                  {"name": "Moscow", "local_names": {"ru": "Москва", "en": "Moscow"},
                   "lat": 55.7558, "lon": 37.6176, "country": "RU"}
                ]""";

        static final String REVERSE_MOSCOW = """
                [
                  {"name": "Moscow", "local_names": {"ru": "Москва"},
                   "lat": 55.7504, "lon": 37.6175, "country": "RU"}
                ]""";

        static final String WEATHER_MOSCOW = """
                {
                  "coord": {"lon": 37.6176, "lat": 55.7558},
                  "weather": [{"id": 800, "main": "Clear", "description": "ясно", "icon": "01d"}],
                  "main": {"temp": 4.2, "feels_like": 1.1, "pressure": 1015, "humidity": 80},
                  "visibility": 10000,
                  "wind": {"speed": 3.6, "deg": 180},
                  "clouds": {"all": 0},
                  "dt": 1792396800,
                  "sys": {"country": "RU", "sunrise": 1792380000, "sunset": 1792416000},
                  "timezone": 10800,
                  "id": 524901,
                  "name": "Москва",
                  "cod": 200
                }""";

        static final String FORECAST_MOSCOW = """
                {
                  "cod": "200",
                  "list": [
                    {"dt": 1792396800, "main": {"temp": 5.0}, "weather": [{"description": "облачно"}]}
                  ],
                  "city": {"name": "Москва", "timezone": 10800}
                }""";

        static final String AIR_MOSCOW = """
                {
                  "coord": {"lon": 37.6176, "lat": 55.7558},
                  "list": [{"main": {"aqi": 2}, "components": {"o3": 68.66}, "dt": 1792396800}]
                }""";

        static final String ERROR_RESPONSE = """
                {
                  "cod": "404",
                  "message": "city not found"
                }""";

        static final String UNAUTHORIZED_RESPONSE = """
                {
                  "cod": 401,
                  "message": "Invalid API key"
                }""";
    }
}
