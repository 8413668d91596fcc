package brandai.adapter.in.dto;

import java.util.List;
import java.util.Map;

import io.vertx.core.json.JsonObject;

/**
 * Converts raw GitHub JSON items to plain maps for Jackson serialization.
 */
public final class GitHubItems {

    private GitHubItems() {
        // Utility class
    }

    public static List<Map<String, Object>> toMaps(List<JsonObject> items) {
        return items.stream().map(JsonObject::getMap).toList();
    }
}
