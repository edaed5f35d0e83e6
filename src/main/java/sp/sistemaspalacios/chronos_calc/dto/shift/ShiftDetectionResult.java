package sp.sistemaspalacios.chronos_calc.dto.shift;

import sp.sistemaspalacios.chronos_calc.dto.schedule.ScheduleConfig;

/**
 * Resultado de la detección de turno. Con {@code hasError} el plan usado es el asignado y el día
 * requiere corrección manual.
 */
public record ShiftDetectionResult(ScheduleConfig matchedPlan,
                                   boolean original,
                                   ShiftMatchKind matchKind,
                                   boolean hasError,
                                   String message) {

    public static ShiftDetectionResult original(ScheduleConfig plan, ShiftMatchKind kind) {
        return new ShiftDetectionResult(plan, true, kind, false, null);
    }

    public static ShiftDetectionResult alternative(ScheduleConfig plan, ShiftMatchKind kind) {
        return new ShiftDetectionResult(plan, false, kind, false, null);
    }

    public static ShiftDetectionResult noMatch(ScheduleConfig assigned, String message) {
        return new ShiftDetectionResult(assigned, true, ShiftMatchKind.NONE, true, message);
    }

    public String matchedPlanCode() {
        return matchedPlan == null ? null : matchedPlan.getCode();
    }
}
