package sp.sistemaspalacios.chronos_calc.dto.daily;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import sp.sistemaspalacios.chronos_calc.dto.booking.BookingPair;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Métricas calculadas de un (empleado, fecha). Siempre se reconstruye desde sus entradas, nunca se parchea.
 */
@Value
@Builder(toBuilder = true)
public class DailyResult {
    Long employeeId;
    LocalDate date;
    DayType dayType;
    String effectivePlanCode;

    int grossMinutes;
    int netMinutes;
    int targetMinutes;
    int overtimeMinutes;
    int undertimeMinutes;
    int breakMinutes;
    int paidBreakMinutes;
    /** Total recortado: ventana de evaluación más tope de tiempo neto. */
    int cappedMinutes;
    /** Parte de {@code cappedMinutes} recortada fuera de la ventana de evaluación. */
    int windowCappedMinutes;

    Integer firstCome;
    Integer lastGo;
    int bookingCount;

    @Builder.Default
    List<BookingPair> pairs = List.of();
    @Builder.Default
    Set<DayErrorCode> errors = Set.of();
    @Builder.Default
    Set<DayWarningCode> warnings = Set.of();

    /** Sólo en días de ausencia; el resumen mensual los cuenta por categoría. */
    AbsenceCategory absenceCategory;
    BigDecimal absenceFraction;
    Integer holidayCategory;

    @JsonProperty("hasError")
    public boolean hasError() {
        return !errors.isEmpty();
    }

    public boolean hasWarning(DayWarningCode code) {
        return warnings.contains(code);
    }

    /**
     * Copia con la unión de los códigos existentes y los dados. Aplicar dos veces los mismos códigos
     * da un resultado igual.
     */
    public DailyResult withCodes(Collection<DayErrorCode> extraErrors, Collection<DayWarningCode> extraWarnings) {
        return toBuilder()
                .errors(CodeSets.union(DayErrorCode.class, errors, extraErrors))
                .warnings(CodeSets.union(DayWarningCode.class, warnings, extraWarnings))
                .build();
    }

    public static DailyResult empty(DailyInput input, DayType type) {
        return DailyResult.builder()
                .employeeId(input.getEmployeeId())
                .date(input.getDate())
                .dayType(type)
                .effectivePlanCode(input.getSchedule() == null ? null : input.getSchedule().getCode())
                .bookingCount(input.getBookings().size())
                .build();
    }
}
