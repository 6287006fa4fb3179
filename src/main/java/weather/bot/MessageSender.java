package weather.bot;

/**
 * Транспорт чата: доставляет готовое сообщение пользователю.
 */
public interface MessageSender {
    void send(long userId, String text);
}
