package sp.sistemaspalacios.chronos_calc.dto.vacation;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class VacationCalcOutput {
    BigDecimal baseEntitlement;
    BigDecimal proRatedEntitlement;
    BigDecimal partTimeAdjusted;

    BigDecimal ageBonus;
    BigDecimal tenureBonus;
    BigDecimal disabilityBonus;

    /** Redondeado al medio día más cercano. */
    BigDecimal totalEntitlement;

    int monthsEmployed;
    int ageAtReference;
    int tenureYears;
}
