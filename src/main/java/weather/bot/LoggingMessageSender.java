package weather.bot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Отправка сообщений в лог - для запуска без подключённого чата.
 */
public class LoggingMessageSender implements MessageSender {
    private static final Logger log = LoggerFactory.getLogger(LoggingMessageSender.class);

    @Override
    public void send(long userId, String text) {
        log.info("Сообщение для {}:\n{}", userId, text);
    }
}
