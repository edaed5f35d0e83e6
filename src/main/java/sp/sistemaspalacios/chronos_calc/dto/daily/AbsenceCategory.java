package sp.sistemaspalacios.chronos_calc.dto.daily;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum AbsenceCategory {
    VACATION("vacation"),
    SICK("sick"),
    OTHER("other");

    private final String code;

    AbsenceCategory(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static AbsenceCategory fromCode(String code) {
        return Arrays.stream(values())
                .filter(c -> c.code.equalsIgnoreCase(code))
                .findFirst()
                .orElse(OTHER);
    }
}
