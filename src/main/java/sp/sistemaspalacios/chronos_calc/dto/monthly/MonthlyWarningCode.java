package sp.sistemaspalacios.chronos_calc.dto.monthly;

public enum MonthlyWarningCode {
    MONTHLY_CAP_REACHED,
    FLEXTIME_CAPPED,
    BELOW_THRESHOLD,
    NO_CARRYOVER
}
