package sp.sistemaspalacios.chronos_calc.dto.schedule;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PlanKind {
    FIXED("fixed"),
    FLEXTIME("flextime");

    private final String code;

    PlanKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
