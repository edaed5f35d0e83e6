package sp.sistemaspalacios.chronos_calc.dto.daily;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum DayType {
    WORKDAY("workday"),
    ABSENCE("absence"),
    HOLIDAY("holiday"),
    OFF_DAY("off_day"),
    NO_BOOKINGS("no_bookings");

    private final String code;

    DayType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static DayType fromCode(String code) {
        return Arrays.stream(values())
                .filter(t -> t.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown day type: " + code));
    }
}
