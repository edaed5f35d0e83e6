package sp.sistemaspalacios.chronos_calc.dto.vacation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum VacationBasis {
    /** Del 1 de enero al 31 de diciembre. */
    CALENDAR_YEAR("calendar_year"),
    /** El año que empieza en el aniversario de ingreso. */
    ENTRY_DATE("entry_date");

    private final String code;

    VacationBasis(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static VacationBasis fromCode(String code) {
        return Arrays.stream(values())
                .filter(b -> b.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown vacation basis: " + code));
    }
}
