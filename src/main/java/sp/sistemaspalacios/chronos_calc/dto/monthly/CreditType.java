package sp.sistemaspalacios.chronos_calc.dto.monthly;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Cómo llegan las horas extra del mes a la cuenta de flextime.
 */
public enum CreditType {
    /** Horas extra y horas faltantes pasan 1:1. */
    NO_EVALUATION("no_evaluation"),
    /** Transferencia con tope mensual y topes de saldo positivo/negativo. */
    COMPLETE_CARRYOVER("complete_carryover"),
    /** Sólo se abonan las horas extra por encima del umbral. */
    AFTER_THRESHOLD("after_threshold"),
    /** El saldo vuelve a cero cada mes. */
    NO_CARRYOVER("no_carryover");

    private final String code;

    CreditType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static CreditType fromCode(String code) {
        return Arrays.stream(values())
                .filter(t -> t.code.equalsIgnoreCase(code))
                .findFirst()
                .orElse(NO_EVALUATION);
    }
}
