package weather.bot.examples;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import weather.bot.LoggingMessageSender;
import weather.bot.WeatherBot;
import weather.bot.WeatherConfig;

/**
 * Пример использования бота без чата: ответы пишутся в лог.
 * Первый аргумент - город (по умолчанию Москва).
 */
public class ExampleUsage {
    private static final Logger log = LoggerFactory.getLogger(ExampleUsage.class);
    private static final long DEMO_USER = 1L;

    public static void main(String[] args) {
        WeatherConfig config = WeatherConfig.load();
        if (config.apiKey == null || config.apiKey.trim().isEmpty()) {
            log.error("Ошибка: установите переменную окружения OPENWEATHER_API_KEY");
            log.error("Используйте OPENWEATHER_API_KEY=ваш_ключ");
            return;
        }
        String city = args.length > 0 ? args[0] : "Москва";

        try (WeatherBot bot = WeatherBot.create(config, new LoggingMessageSender())) {
            log.info("{}", bot.weatherForCity(DEMO_USER, city));
            log.info("Повторный запрос (кэш):");
            log.info("{}", bot.weatherForCity(DEMO_USER, city));
            log.info("{}", bot.forecast(DEMO_USER));
            log.info("{}", bot.extended(DEMO_USER));
        }

        log.info("Бот закрыт. Приложение завершено.");
    }
}
