package sp.sistemaspalacios.chronos_calc.dto.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Cómo se reparte un turno que cruza la medianoche entre los dos días.
 */
public enum DayChangeBehavior {
    /** Cada día sólo ve sus propias marcaciones. */
    NONE("none"),
    /** El turno completo cuenta en el día de la entrada. */
    AT_ARRIVAL("at_arrival"),
    /** El turno completo cuenta en el día de la salida. */
    AT_DEPARTURE("at_departure"),
    /** Se corta a las 24:00: cada día cuenta su parte. */
    AUTO_COMPLETE("auto_complete");

    private final String code;

    DayChangeBehavior(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static DayChangeBehavior fromCode(String code) {
        return Arrays.stream(values())
                .filter(b -> b.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown day change behavior: " + code));
    }
}
