package brandai.core.model.user;

import java.util.Arrays;

/**
 * Writing tone preferred by a user.
 */
public enum Tone {
    FORMAL("formal"),
    INFORMAL("informal"),
    CASUAL("casual");

    private final String value;

    Tone(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Tone fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown tone: " + value));
    }
}
