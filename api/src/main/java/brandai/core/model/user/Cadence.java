package brandai.core.model.user;

import java.util.Arrays;

/**
 * How often a user wants content suggestions.
 */
public enum Cadence {
    DAILY("daily"),
    WEEKLY("weekly"),
    BI_WEEKLY("bi-weekly"),
    MONTHLY("monthly");

    private final String value;

    Cadence(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolve a stored value such as {@code bi-weekly}.
     *
     * @throws IllegalArgumentException if the value is unknown
     */
    public static Cadence fromValue(String value) {
        return Arrays.stream(values())
                .filter(c -> c.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown cadence: " + value));
    }
}
