package sp.sistemaspalacios.chronos_calc.dto.recalculation;

public enum RecalculationStatus {
    CALCULATED,
    /** La política sin marcaciones del plan no produjo resultado. */
    SKIPPED,
    /** El mes o el año están cerrados. */
    REJECTED,
    FAILED
}
