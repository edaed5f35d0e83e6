package sp.sistemaspalacios.chronos_calc.dto.daily;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Ausencia aprobada en el día que se calcula.
 *
 * @param typeCode         tipo de ausencia, p. ej. "UL" para vacaciones
 * @param category         cómo cuenta el día el resumen mensual
 * @param creditsHours     si el tipo de ausencia abona el tiempo objetivo
 * @param durationFraction 1.0 para día completo, 0.5 para medio día
 * @param priority         gana al festivo salvo que la prioridad del festivo sea mayor
 */
public record AbsenceFact(String typeCode,
                          AbsenceCategory category,
                          boolean creditsHours,
                          BigDecimal durationFraction,
                          int priority) {

    public AbsenceFact {
        Objects.requireNonNull(typeCode, "typeCode");
        if (category == null) {
            category = AbsenceCategory.OTHER;
        }
        if (durationFraction == null) {
            durationFraction = BigDecimal.ONE;
        }
        if (durationFraction.signum() < 0 || durationFraction.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("durationFraction must be within [0,1]: " + durationFraction);
        }
    }

    public static AbsenceFact fullDay(String typeCode, AbsenceCategory category) {
        return new AbsenceFact(typeCode, category, true, BigDecimal.ONE, 0);
    }

    public static AbsenceFact halfDay(String typeCode, AbsenceCategory category) {
        return new AbsenceFact(typeCode, category, true, new BigDecimal("0.5"), 0);
    }
}
