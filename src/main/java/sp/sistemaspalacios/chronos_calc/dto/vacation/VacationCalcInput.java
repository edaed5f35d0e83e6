package sp.sistemaspalacios.chronos_calc.dto.vacation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VacationCalcInput {

    // empleado
    private LocalDate birthDate;
    private LocalDate entryDate;
    private LocalDate exitDate;
    private BigDecimal weeklyHours;
    private boolean disability;

    // convenio
    private BigDecimal baseEntitlement;
    private BigDecimal standardWeeklyHours;
    @Builder.Default
    private VacationBasis basis = VacationBasis.CALENDAR_YEAR;
    @Builder.Default
    private List<SpecialBonusRule> specialRules = new ArrayList<>();

    private int year;
    /** Fecha en que se evalúan edad y antigüedad; 31 de diciembre de {@code year} si falta. */
    private LocalDate referenceDate;
}
