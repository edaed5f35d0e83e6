package sp.sistemaspalacios.chronos_calc.dto.monthly;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import sp.sistemaspalacios.chronos_calc.dto.daily.DailyResult;

import java.util.List;

@Value
@Builder
public class MonthlyCalcInput {
    Long employeeId;
    int year;
    int month;
    @Singular
    List<DailyResult> days;
    /** Saldo de flextime que viene del mes anterior, en minutos. */
    int previousCarryover;
    /** {@code null} transfiere las horas extra 1:1. */
    MonthlyEvaluationRules rules;
}
