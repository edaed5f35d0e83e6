package sp.sistemaspalacios.chronos_calc.dto.shift;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ShiftMatchKind {
    NONE("none"),
    ARRIVAL("arrival"),
    DEPARTURE("departure"),
    BOTH("both");

    private final String code;

    ShiftMatchKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
