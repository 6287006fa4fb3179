package weather.bot;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Типизированное представление ответа «текущая погода».
 */
public class WeatherResponse {
    public Weather weather;
    public Temperature temperature;
    public int visibility;
    public Wind wind;
    public int clouds;
    public long datetime;
    public Sys sys;
    public int timezone;
    public String name;
    public Coordinates coord;

    public static class Weather {
        public String main;
        public String description;
    }

    public static class Temperature {
        public double temp;
        public double feels_like;
        public int humidity;
        public int pressure;
    }

    public static class Wind {
        public double speed;
    }

    public static class Sys {
        public long sunrise;
        public long sunset;
    }

    /**
     * Разбирает ответ API.
     *
     * @throws WeatherException если в ответе нет названия, блока main или описания погоды
     */
    public static WeatherResponse from(JsonNode root) throws WeatherException {
        if (root == null || !root.isObject()) {
            throw new WeatherException("Ответ API о погоде не является объектом");
        }
        JsonNode weatherArr = root.get("weather");
        JsonNode main = root.get("main");
        if (!root.hasNonNull("name") || main == null || !main.has("temp")
                || weatherArr == null || !weatherArr.isArray() || weatherArr.isEmpty()) {
            throw new WeatherException("Неполный ответ API о погоде");
        }

        WeatherResponse wr = new WeatherResponse();
        wr.name = root.get("name").asText();

        wr.weather = new Weather();
        wr.weather.main = weatherArr.get(0).has("main") ?
                weatherArr.get(0).get("main").asText() : "Unknown";
        wr.weather.description = weatherArr.get(0).has("description") ?
                weatherArr.get(0).get("description").asText() : "";

        wr.temperature = new Temperature();
        wr.temperature.temp = main.get("temp").asDouble();
        wr.temperature.feels_like = main.has("feels_like") ? main.get("feels_like").asDouble() : wr.temperature.temp;
        wr.temperature.humidity = main.has("humidity") ? main.get("humidity").asInt() : 0;
        wr.temperature.pressure = main.has("pressure") ? main.get("pressure").asInt() : 0;

        wr.visibility = root.has("visibility") ? root.get("visibility").asInt() : 10000;

        wr.wind = new Wind();
        JsonNode wind = root.get("wind");
        if (wind != null) {
            wr.wind.speed = wind.has("speed") ? wind.get("speed").asDouble() : 0.0;
        }

        JsonNode clouds = root.get("clouds");
        wr.clouds = clouds != null && clouds.has("all") ? clouds.get("all").asInt() : 0;

        wr.datetime = root.has("dt") ? root.get("dt").asLong() : 0L;

        wr.sys = new Sys();
        JsonNode sys = root.get("sys");
        if (sys != null) {
            wr.sys.sunrise = sys.has("sunrise") ? sys.get("sunrise").asLong() : 0L;
            wr.sys.sunset = sys.has("sunset") ? sys.get("sunset").asLong() : 0L;
        }

        wr.timezone = root.has("timezone") ? root.get("timezone").asInt() : 0;

        JsonNode coord = root.get("coord");
        if (coord != null && coord.has("lat") && coord.has("lon")) {
            wr.coord = new Coordinates(coord.get("lat").asDouble(), coord.get("lon").asDouble());
        }
        return wr;
    }
}
