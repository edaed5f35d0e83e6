package sp.sistemaspalacios.chronos_calc.service.breakDeduction;

import sp.sistemaspalacios.chronos_calc.dto.daily.CodeSets;
import sp.sistemaspalacios.chronos_calc.dto.daily.DayWarningCode;

import java.util.Set;

/**
 * @param deductedMinutes minutos restados del tiempo bruto
 * @param bookedMinutes   minutos de los pares de pausa marcados
 * @param paidMinutes     minutos de pausa concedidos por reglas pagadas, no descontados
 */
public record BreakDeductionResult(int deductedMinutes, int bookedMinutes, int paidMinutes,
                                   Set<DayWarningCode> warnings) {

    public BreakDeductionResult {
        warnings = CodeSets.copyOf(DayWarningCode.class, warnings);
    }

    public int netMinutes(int grossMinutes) {
        return Math.max(0, grossMinutes - deductedMinutes);
    }
}
