package weather.bot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Фоновая задача: периодически проверяет уведомления всех известных пользователей.
 * После {@link #close()} задачу можно снова запустить через {@link #start()}.
 */
public class NotificationPoller implements Runnable, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NotificationPoller.class);

    private final NotificationService notifications;
    private final UserSettingsStore users;
    private final long checkIntervalMillis;
    private volatile boolean running = true;
    private volatile Thread thread;

    public NotificationPoller(NotificationService notifications, UserSettingsStore users, long checkIntervalMillis) {
        this.notifications = notifications;
        this.users = users;
        this.checkIntervalMillis = checkIntervalMillis;
    }

    public synchronized void start() {
        if (thread != null) {
            return;
        }
        running = true;
        thread = new Thread(this, "WeatherBot-NotificationThread");
        thread.setDaemon(true);
        thread.start();
    }

    @Override
    public void run() {
        while (running && Thread.currentThread() == thread) {
            try {
                pollOnce();
                Thread.sleep(checkIntervalMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    /** Один проход по всем пользователям; возвращает число отправленных уведомлений. */
    int pollOnce() {
        int sent = 0;
        List<Long> ids = users.userIds();
        for (Long userId : ids) {
            try {
                if (notifications.checkAndNotify(userId)) {
                    sent++;
                }
            } catch (RuntimeException e) {
                // Логируем ошибку, но продолжаем обработку других пользователей
                log.error("Ошибка проверки уведомлений для пользователя {}", userId, e);
            }
        }
        return sent;
    }

    synchronized boolean isAlive() {
        return thread != null && thread.isAlive();
    }

    public void stop() {
        running = false;
    }

    @Override
    public synchronized void close() {
        stop();
        if (thread != null && !thread.isInterrupted()) {
            thread.interrupt();
            try {
                thread.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        thread = null;
    }
}
