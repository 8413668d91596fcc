package brandai.core.service.activity;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.Optional;

import io.vertx.core.json.JsonObject;

/**
 * Reads ISO-8601 timestamps out of GitHub JSON items.
 */
final class ActivityTimestamps {

    private ActivityTimestamps() {
        // Utility class
    }

    /**
     * Read a timestamp at a dotted path such as {@code commit.author.date}.
     *
     * @return the instant, or empty if the path is missing or unparseable
     */
    static Optional<Instant> read(JsonObject item, String path) {
        final String[] segments = path.split("\\.");
        JsonObject current = item;
        for (int i = 0; i < segments.length - 1; i++) {
            final Object next = current.getValue(segments[i]);
            if (!(next instanceof JsonObject nested)) {
                return Optional.empty();
            }
            current = nested;
        }
        final Object raw = current.getValue(segments[segments.length - 1]);
        if (!(raw instanceof String text) || text.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(text).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Most recent first. Items without a timestamp sort last.
     */
    static Comparator<JsonObject> newestFirst(String path) {
        return Comparator.comparing((JsonObject item) -> read(item, path).orElse(Instant.MIN))
                .reversed();
    }
}
