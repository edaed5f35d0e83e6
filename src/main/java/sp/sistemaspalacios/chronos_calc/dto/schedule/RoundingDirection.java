package sp.sistemaspalacios.chronos_calc.dto.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum RoundingDirection {
    NONE("none"),
    UP("up"),
    DOWN("down"),
    NEAREST("nearest");

    private final String code;

    RoundingDirection(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static RoundingDirection fromCode(String code) {
        if (code == null || code.isBlank()) {
            return NONE;
        }
        return Arrays.stream(values())
                .filter(d -> d.code.equalsIgnoreCase(code.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown rounding direction: " + code));
    }
}
