package sp.sistemaspalacios.chronos_calc.dto.daily;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum DayWarningCode {
    LATE_ARRIVAL,
    EARLY_DEPARTURE,
    LONG_WORK_DAY,
    NET_TIME_CAPPED,
    OUTSIDE_WINDOW_CAPPED,
    AUTO_BREAK_APPLIED,
    MINIMUM_BREAK_ENFORCED,
    MANUAL_BREAK,
    OFF_DAY,
    BOOKINGS_ON_OFF_DAY,
    HOLIDAY,
    WORKED_ON_HOLIDAY,
    ABSENCE_ON_HOLIDAY,
    NO_BOOKINGS_CREDITED,
    NO_BOOKINGS_DEDUCTED,
    SHIFT_SWITCHED;

    @JsonValue
    public String getCode() {
        return name();
    }

    @JsonCreator
    public static DayWarningCode fromCode(String code) {
        return Arrays.stream(values())
                .filter(c -> c.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown warning code: " + code));
    }
}
