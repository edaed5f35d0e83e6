package sp.sistemaspalacios.chronos_calc.dto.booking;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PairKind {
    WORK("work"),
    BREAK("break");

    private final String code;

    PairKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
