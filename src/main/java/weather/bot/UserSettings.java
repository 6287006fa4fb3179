package weather.bot;

/**
 * Сохранённые данные пользователя: последний город и его координаты.
 */
public class UserSettings {
    public String city;
    public Double lat;
    public Double lon;
    public NotificationSettings notifications = new NotificationSettings();

    public boolean hasLocation() {
        return city != null && lat != null && lon != null;
    }

    public Coordinates coordinates() {
        return hasLocation() ? new Coordinates(lat, lon) : null;
    }

    public void setLocation(String city, Coordinates coordinates) {
        this.city = city;
        this.lat = coordinates.lat;
        this.lon = coordinates.lon;
    }
}
