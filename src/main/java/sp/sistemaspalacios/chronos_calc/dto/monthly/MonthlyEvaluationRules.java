package sp.sistemaspalacios.chronos_calc.dto.monthly;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reglas de evaluación de flextime de un convenio. Los topes van en minutos; {@code null} desactiva
 * el tope. El tope negativo y el piso anual se guardan como números positivos.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonthlyEvaluationRules {

    @Builder.Default
    private CreditType creditType = CreditType.NO_EVALUATION;

    private Integer flextimeThreshold;
    private Integer maxFlextimePerMonth;
    private Integer flextimeCapPositive;
    private Integer flextimeCapNegative;
    private Integer annualFloorBalance;
}
