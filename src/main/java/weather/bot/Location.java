package weather.bot;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Место, найденное геокодером: каноническое название и координаты.
 */
public final class Location {
    public final String name;
    public final String country;
    public final Coordinates coordinates;

    public Location(String name, String country, Coordinates coordinates) {
        this.name = name;
        this.country = country;
        this.coordinates = coordinates;
    }

    /**
     * Первое место из ответа геокодера. Название берётся из local_names для
     * указанного языка, если оно там есть.
     *
     * @return {@code null}, если массив пуст или в элементе нет координат
     */
    static Location fromGeocoding(JsonNode places, String lang) {
        if (places == null || !places.isArray() || places.isEmpty()) {
            return null;
        }
        JsonNode place = places.get(0);
        if (!place.has("lat") || !place.has("lon") || !place.has("name")) {
            return null;
        }
        String name = place.get("name").asText();
        JsonNode localNames = place.get("local_names");
        if (lang != null && localNames != null && localNames.hasNonNull(lang)) {
            name = localNames.get(lang).asText();
        }
        String country = place.has("country") ? place.get("country").asText() : null;
        return new Location(name, country, new Coordinates(place.get("lat").asDouble(), place.get("lon").asDouble()));
    }

    @Override
    public String toString() {
        return name + " " + coordinates;
    }
}
