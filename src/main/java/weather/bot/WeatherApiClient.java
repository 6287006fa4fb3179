package weather.bot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * HTTP-клиент OpenWeather: геокодинг, текущая погода, прогноз, качество воздуха.
 * <p>
 * Коды 429 и 5xx, а также сетевые ошибки повторяются с экспоненциальной
 * паузой; 401 и прочие 4xx сразу завершаются {@link WeatherException}.
 */
public class WeatherApiClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WeatherApiClient.class);

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final HttpUrl baseUrl;
    private final String apiKey;
    private final String lang;
    private final String units;
    private final int maxAttempts;
    private final long retryDelayMillis;

    public WeatherApiClient(WeatherConfig config, ObjectMapper mapper) {
        if (config.apiKey == null || config.apiKey.trim().isEmpty()) {
            throw new IllegalArgumentException("API-ключ не может быть пустым");
        }
        HttpUrl parsed = HttpUrl.parse(config.baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Некорректный адрес API: " + config.baseUrl);
        }
        this.baseUrl = parsed;
        this.apiKey = config.apiKey.trim();
        this.lang = config.lang;
        this.units = config.units;
        this.maxAttempts = config.maxAttempts;
        this.retryDelayMillis = config.retryDelay.toMillis();
        this.mapper = mapper;
        this.client = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(10, TimeUnit.SECONDS)
                .build();
    }

    /** Прямой геокодинг; ответ - массив найденных мест (не более одного). */
    public JsonNode geocode(String city) throws WeatherException {
        HttpUrl url = endpoint("geo/1.0/direct")
                .addQueryParameter("q", city)
                .addQueryParameter("limit", "1")
                .build();
        return execute(url);
    }

    public JsonNode reverseGeocode(Coordinates coordinates) throws WeatherException {
        HttpUrl url = withCoordinates(endpoint("geo/1.0/reverse"), coordinates)
                .addQueryParameter("limit", "1")
                .build();
        return execute(url);
    }

    public JsonNode currentWeather(Coordinates coordinates) throws WeatherException {
        HttpUrl url = withCoordinates(endpoint("data/2.5/weather"), coordinates)
                .addQueryParameter("units", units)
                .build();
        return execute(url);
    }

    public JsonNode forecast(Coordinates coordinates) throws WeatherException {
        HttpUrl url = withCoordinates(endpoint("data/2.5/forecast"), coordinates)
                .addQueryParameter("units", units)
                .build();
        return execute(url);
    }

    public JsonNode airQuality(Coordinates coordinates) throws WeatherException {
        HttpUrl url = withCoordinates(endpoint("data/2.5/air_pollution"), coordinates).build();
        return execute(url);
    }

    private HttpUrl.Builder endpoint(String path) {
        return baseUrl.newBuilder()
                .addPathSegments(path)
                .addQueryParameter("appid", apiKey)
                .addQueryParameter("lang", lang);
    }

    private static HttpUrl.Builder withCoordinates(HttpUrl.Builder builder, Coordinates coordinates) {
        return builder
                .addQueryParameter("lat", Double.toString(coordinates.lat))
                .addQueryParameter("lon", Double.toString(coordinates.lon));
    }

    private JsonNode execute(HttpUrl url) throws WeatherException {
        Request request = new Request.Builder().url(url).build();
        String path = url.encodedPath();
        long delay = retryDelayMillis;
        WeatherException lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (Response response = client.newCall(request).execute()) {
                int code = response.code();
                if (code == 401) {
                    throw new WeatherException("OpenWeather API error [401]: неверный API-ключ");
                }
                if (code == 429 || code >= 500) {
                    lastError = new WeatherException("OpenWeather API error [" + code + "]: " + errorMessage(response.body()));
                    log.warn("Запрос {} вернул {}, попытка {} из {}", path, code, attempt, maxAttempts);
                } else if (!response.isSuccessful()) {
                    throw new WeatherException("OpenWeather API error [" + code + "]: " + errorMessage(response.body()));
                } else {
                    ResponseBody body = response.body();
                    if (body == null) {
                        throw new WeatherException("Пустое тело ответа от API");
                    }
                    return parse(body.string());
                }
            } catch (IOException e) {
                lastError = new WeatherException("Ошибка сети при запросе к API: " + e.getMessage(), e);
                log.warn("Ошибка сети при запросе {}: {}, попытка {} из {}", path, e.getMessage(), attempt, maxAttempts);
            }

            if (attempt < maxAttempts) {
                sleep(delay);
                delay *= 2;
            }
        }
        log.error("Не удалось выполнить запрос {} после {} попыток", path, maxAttempts);
        throw lastError;
    }

    private JsonNode parse(String body) throws WeatherException {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new WeatherException("Некорректный JSON в ответе API: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new WeatherException("Пустое тело ответа от API");
        }
        return root;
    }

    private String errorMessage(ResponseBody body) {
        if (body == null) {
            return "Неизвестная ошибка API";
        }
        try {
            JsonNode root = mapper.readTree(body.string());
            return root.has("message") ? root.get("message").asText() : "Неизвестная ошибка API";
        } catch (IOException e) {
            return "Неизвестная ошибка API";
        }
    }

    private static void sleep(long millis) throws WeatherException {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WeatherException("Запрос к API прерван", e);
        }
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        try {
            if (!client.dispatcher().executorService().awaitTermination(1, TimeUnit.SECONDS)) {
                client.dispatcher().executorService().shutdownNow();
            }
        } catch (InterruptedException e) {
            client.dispatcher().executorService().shutdownNow();
            Thread.currentThread().interrupt();
        }
        client.connectionPool().evictAll();
    }
}
