package sp.sistemaspalacios.chronos_calc.dto.recalculation;

import sp.sistemaspalacios.chronos_calc.dto.daily.DailyResult;

import java.time.LocalDate;

public record DayOutcome(Long employeeId, LocalDate date, RecalculationStatus status, DailyResult result,
                         String message) {

    public static DayOutcome calculated(DailyResult result) {
        return new DayOutcome(result.getEmployeeId(), result.getDate(), RecalculationStatus.CALCULATED, result, null);
    }

    public static DayOutcome skipped(Long employeeId, LocalDate date) {
        return new DayOutcome(employeeId, date, RecalculationStatus.SKIPPED, null, null);
    }

    public static DayOutcome of(Long employeeId, LocalDate date, RecalculationStatus status, String message) {
        return new DayOutcome(employeeId, date, status, null, message);
    }
}
