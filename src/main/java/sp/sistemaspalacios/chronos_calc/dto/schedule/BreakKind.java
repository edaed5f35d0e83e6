package sp.sistemaspalacios.chronos_calc.dto.schedule;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BreakKind {
    /** Se descuenta siempre que el trabajo solapa la franja configurada. */
    FIXED("fixed"),
    /** La pausa marcada si existe; si no, la duración configurada cuando hay descuento automático. */
    VARIABLE("variable"),
    /** Mínimo exigido cuando el trabajo supera un umbral. */
    MINIMUM("minimum");

    private final String code;

    BreakKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
