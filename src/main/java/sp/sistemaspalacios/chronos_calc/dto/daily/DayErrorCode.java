package sp.sistemaspalacios.chronos_calc.dto.daily;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Problemas bloqueantes de un día calculado. Mandan el día a corrección manual; nunca se lanzan.
 */
public enum DayErrorCode {
    MISSING_COME,
    MISSING_GO,
    MISSING_BREAK_START,
    MISSING_BREAK_END,
    CAME_BEFORE_ALLOWED,
    LEFT_AFTER_ALLOWED,
    MISSED_CORE_TIME,
    OVERLAPPING_BOOKINGS,
    NEGATIVE_DURATION,
    BELOW_MIN_WORK_TIME,
    NO_BOOKINGS,
    NO_MATCHING_SHIFT;

    @JsonValue
    public String getCode() {
        return name();
    }

    @JsonCreator
    public static DayErrorCode fromCode(String code) {
        return Arrays.stream(values())
                .filter(c -> c.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown error code: " + code));
    }
}
