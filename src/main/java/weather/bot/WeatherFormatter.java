package weather.bot;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Превращает ответы API в сообщения для пользователя (разметка HTML).
 */
public class WeatherFormatter {
    private static final String[] WEEKDAYS = {
            "Понедельник", "Вторник", "Среда", "Четверг", "Пятница", "Суббота", "Воскресенье"
    };
    private static final String[] AQI_LABELS = {
            "Хорошее 🟢", "Удовлетворительное 🟡", "Умеренное 🟠", "Плохое 🔴", "Очень плохое 🟣"
    };
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm");
    private static final DateTimeFormatter DAY_MONTH = DateTimeFormatter.ofPattern("dd.MM");
    private static final DateTimeFormatter FULL_DATE = DateTimeFormatter.ofPattern("dd.MM.yyyy");
    private static final int FORECAST_DAYS = 5;

    private final Clock clock;

    public WeatherFormatter(Clock clock) {
        this.clock = clock;
    }

    public WeatherFormatter() {
        this(Clock.systemDefaultZone());
    }

    public String formatCurrent(JsonNode data) {
        if (data == null) {
            return "Не удалось получить данные о погоде.";
        }
        WeatherResponse w;
        try {
            w = WeatherResponse.from(data);
        } catch (WeatherException e) {
            return "Ошибка при обработке данных о погоде.";
        }
        return "🌤️ <b>Погода в " + w.name + "</b>\n\n"
                + "🌡️ Температура: <b>" + oneDecimal(w.temperature.temp) + "°C</b>\n"
                + "🤔 Ощущается как: <b>" + oneDecimal(w.temperature.feels_like) + "°C</b>\n\n"
                + "💧 Влажность: " + w.temperature.humidity + "%\n"
                + "🌬️ Ветер: " + w.wind.speed + " м/с\n"
                + "📊 Давление: " + w.temperature.pressure + " гПа\n\n"
                + "☁️ " + capitalize(w.weather.description);
    }

    /**
     * Расширенные данные: текущая погода плюс качество воздуха, если оно есть.
     */
    public String formatExtended(JsonNode current, JsonNode air) {
        if (current == null) {
            return "Не удалось получить расширенные данные о погоде.";
        }
        WeatherResponse w;
        try {
            w = WeatherResponse.from(current);
        } catch (WeatherException e) {
            return "Ошибка при обработке расширенных данных: " + e.getMessage();
        }
        ZoneOffset offset = ZoneOffset.ofTotalSeconds(w.timezone);
        StringBuilder text = new StringBuilder()
                .append("📍 <b>Расширенные данные о погоде\n").append(w.name).append("</b>\n\n")
                .append("🌡️ Температура: ").append(oneDecimal(w.temperature.temp))
                .append("°C (ощущается как ").append(oneDecimal(w.temperature.feels_like)).append("°C)\n")
                .append("💧 Влажность: ").append(w.temperature.humidity).append("%\n")
                .append("📊 Давление: ").append(w.temperature.pressure).append(" гПа\n")
                .append("🌬️ Ветер: ").append(w.wind.speed).append(" м/с\n")
                .append("👁️ Видимость: ").append(oneDecimal(w.visibility / 1000.0)).append(" км\n")
                .append("☁️ Облачность: ").append(w.clouds).append("%\n")
                .append("🌅 Восход: ").append(timeOf(w.sys.sunrise, offset)).append("\n")
                .append("🌇 Закат: ").append(timeOf(w.sys.sunset, offset)).append("\n");

        JsonNode first = air != null && air.has("list") && air.get("list").size() > 0 ? air.get("list").get(0) : null;
        if (first != null && first.has("main")) {
            JsonNode components = first.get("components");
            double o3 = components != null && components.has("o3") ? components.get("o3").asDouble() : 0.0;
            text.append("\n🏭 <b>Качество воздуха:</b>\n")
                    .append("Общий статус: ").append(airQualityLabel(first.get("main").path("aqi").asInt())).append("\n")
                    .append("O₃: ").append(String.format(Locale.ROOT, "%.2f", o3)).append(" мкг/м³");
        }

        text.append("\n\n📝 <b>Условия:</b> ").append(capitalize(w.weather.description));
        return text.toString();
    }

    /** Подпись для индекса качества воздуха OpenWeather (1..5). */
    public String airQualityLabel(int aqi) {
        if (aqi < 1 || aqi > AQI_LABELS.length) {
            return "Нет данных";
        }
        return AQI_LABELS[aqi - 1];
    }

    public String formatComparison(JsonNode first, JsonNode second) {
        WeatherResponse a;
        WeatherResponse b;
        try {
            a = WeatherResponse.from(first);
            b = WeatherResponse.from(second);
        } catch (WeatherException e) {
            return "Не удалось сравнить погоду. Данные для одного из городов неполные.";
        }
        double diff = Math.abs(a.temperature.temp - b.temperature.temp);
        String warmer = a.temperature.temp > b.temperature.temp ? a.name : b.name;
        return "⚖️ <b>Сравнение погоды</b>\n<b>" + a.name + " vs " + b.name + "</b>\n\n"
                + "🌡️ <b>Температура:</b>\n" + a.name + ": " + oneDecimal(a.temperature.temp) + "°C\n"
                + b.name + ": " + oneDecimal(b.temperature.temp) + "°C\n"
                + "🔥 В " + warmer + " теплее на " + oneDecimal(diff) + "°C\n\n"
                + "💧 <b>Влажность:</b>\n" + a.name + ": " + a.temperature.humidity + "%\n"
                + b.name + ": " + b.temperature.humidity + "%\n\n"
                + "🌬️ <b>Ветер:</b>\n" + a.name + ": " + a.wind.speed + " м/с\n"
                + b.name + ": " + b.wind.speed + " м/с\n\n"
                + "📊 <b>Давление:</b>\n" + a.name + ": " + a.temperature.pressure + " гПа\n"
                + b.name + ": " + b.temperature.pressure + " гПа\n\n"
                + "☁️ <b>Условия:</b>\n" + a.name + ": " + capitalize(a.weather.description) + "\n"
                + b.name + ": " + capitalize(b.weather.description);
    }

    /**
     * Прогноз на 5 дней со средней температурой по каждому дню.
     */
    public String formatDailyForecast(JsonNode forecast) {
        if (!isForecast(forecast)) {
            return "Не удалось получить прогноз.";
        }
        ZoneOffset offset = forecastOffset(forecast);
        Map<LocalDate, List<Double>> byDay = new LinkedHashMap<>();
        for (JsonNode item : forecast.get("list")) {
            LocalDate day = dateTimeOf(item.path("dt").asLong(), offset).toLocalDate();
            byDay.computeIfAbsent(day, d -> new ArrayList<>()).add(item.path("main").path("temp").asDouble());
        }

        StringBuilder text = new StringBuilder()
                .append("📅 <b>Прогноз погоды на 5 дней</b>\n📍 <b>")
                .append(forecast.get("city").path("name").asText()).append("</b>\n\n")
                .append("Выберите день для подробного прогноза:\n");
        int shown = 0;
        for (Map.Entry<LocalDate, List<Double>> day : byDay.entrySet()) {
            if (shown++ >= FORECAST_DAYS) break;
            double avg = day.getValue().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            text.append("\n☀️ ").append(day.getKey().format(DAY_MONTH)).append(" - ").append(weekday(day.getKey()))
                    .append(" (").append(oneDecimal(avg)).append("°C)");
        }
        return text.toString();
    }

    /**
     * Почасовой прогноз на день со смещением {@code dayOffset} от сегодняшнего.
     */
    public String formatHourlyForecast(JsonNode forecast, int dayOffset) {
        if (!isForecast(forecast)) {
            return "Не удалось получить прогноз.";
        }
        ZoneOffset offset = forecastOffset(forecast);
        LocalDate target = LocalDate.ofInstant(clock.instant(), offset).plusDays(dayOffset);
        String targetStr = target.format(FULL_DATE) + " - " + weekday(target);

        StringBuilder text = new StringBuilder();
        for (JsonNode item : forecast.get("list")) {
            LocalDateTime at = dateTimeOf(item.path("dt").asLong(), offset);
            if (!at.toLocalDate().equals(target)) continue;
            int hour = at.getHour();
            String emoji = hour >= 6 && hour < 12 ? "🌅" : hour >= 12 && hour < 18 ? "☀️" : hour >= 18 && hour < 22 ? "🌇" : "🌙";
            String desc = item.path("weather").path(0).path("description").asText();
            text.append("\n").append(emoji).append(" ").append(at.format(TIME)).append(": ")
                    .append(oneDecimal(item.path("main").path("temp").asDouble())).append("°C, ")
                    .append(capitalize(desc));
        }
        if (text.length() == 0) {
            return "Нет данных прогноза на " + targetStr + ".";
        }
        return "🗓️ <b>Подробный прогноз</b>\n📍 <b>" + forecast.get("city").path("name").asText() + "</b>\n\n"
                + "📅 <b>" + targetStr + "</b>\n" + text;
    }

    private static boolean isForecast(JsonNode forecast) {
        return forecast != null && forecast.has("city") && forecast.has("list") && forecast.get("list").isArray();
    }

    private static ZoneOffset forecastOffset(JsonNode forecast) {
        return ZoneOffset.ofTotalSeconds(forecast.get("city").path("timezone").asInt(0));
    }

    private static LocalDateTime dateTimeOf(long epochSeconds, ZoneOffset offset) {
        return LocalDateTime.ofInstant(Instant.ofEpochSecond(epochSeconds), offset);
    }

    private static String timeOf(long epochSeconds, ZoneOffset offset) {
        return dateTimeOf(epochSeconds, offset).format(TIME);
    }

    private static String weekday(LocalDate date) {
        return WEEKDAYS[date.getDayOfWeek().getValue() - 1];
    }

    static String oneDecimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    static String capitalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return text.substring(0, 1).toUpperCase(Locale.ROOT) + text.substring(1).toLowerCase(Locale.ROOT);
    }
}
