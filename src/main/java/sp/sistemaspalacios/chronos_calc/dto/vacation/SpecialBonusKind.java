package sp.sistemaspalacios.chronos_calc.dto.vacation;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SpecialBonusKind {
    AGE("age"),
    TENURE("tenure"),
    DISABILITY("disability");

    private final String code;

    SpecialBonusKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
