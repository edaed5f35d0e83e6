package sp.sistemaspalacios.chronos_calc.dto.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum AccountKind {
    /** Minutos. */
    FLEXTIME("flextime"),
    /** Días. */
    VACATION("vacation"),
    /** Minutos abonados por recargos. */
    BONUS("bonus");

    private final String code;

    AccountKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static AccountKind fromCode(String code) {
        return Arrays.stream(values())
                .filter(k -> k.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown account kind: " + code));
    }
}
