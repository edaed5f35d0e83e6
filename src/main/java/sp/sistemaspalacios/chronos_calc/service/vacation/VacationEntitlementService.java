package sp.sistemaspalacios.chronos_calc.service.vacation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.chronos_calc.dto.vacation.SpecialBonusRule;
import sp.sistemaspalacios.chronos_calc.dto.vacation.VacationBasis;
import sp.sistemaspalacios.chronos_calc.dto.vacation.VacationCalcInput;
import sp.sistemaspalacios.chronos_calc.dto.vacation.VacationCalcOutput;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.Period;
import java.util.List;

/**
 * Derecho anual de vacaciones: prorrateo por meses trabajados, escala por jornada parcial, bonos
 * especiales acumulables y redondeo al medio día más cercano. Toda la aritmética es decimal.
 */
@Slf4j
@Service
public class VacationEntitlementService {

    private static final BigDecimal TWELVE = BigDecimal.valueOf(12);
    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final int SCALE = 10;

    public VacationCalcOutput calculate(VacationCalcInput input) {
        LocalDate reference = input.getReferenceDate() != null
                ? input.getReferenceDate()
                : LocalDate.of(input.getYear(), 12, 31);

        int age = ageAt(input.getBirthDate(), reference);
        int tenure = tenureAt(input.getEntryDate(), reference);
        int months = monthsEmployed(input.getEntryDate(), input.getExitDate(), input.getYear(), input.getBasis());

        BigDecimal base = nz(input.getBaseEntitlement());
        BigDecimal proRated = months >= 12
                ? base
                : base.multiply(BigDecimal.valueOf(months)).divide(TWELVE, SCALE, RoundingMode.HALF_UP);

        BigDecimal partTime = proRated;
        BigDecimal standard = input.getStandardWeeklyHours();
        if (standard != null && standard.signum() > 0 && input.getWeeklyHours() != null) {
            partTime = proRated.multiply(input.getWeeklyHours()).divide(standard, SCALE, RoundingMode.HALF_UP);
        }

        BigDecimal ageBonus = BigDecimal.ZERO;
        BigDecimal tenureBonus = BigDecimal.ZERO;
        BigDecimal disabilityBonus = BigDecimal.ZERO;
        List<SpecialBonusRule> rules = input.getSpecialRules() != null ? input.getSpecialRules() : List.of();
        for (SpecialBonusRule rule : rules) {
            switch (rule.kind()) {
                case AGE -> {
                    if (age >= rule.threshold()) ageBonus = ageBonus.add(rule.bonusDays());
                }
                case TENURE -> {
                    if (tenure >= rule.threshold()) tenureBonus = tenureBonus.add(rule.bonusDays());
                }
                case DISABILITY -> {
                    if (input.isDisability()) disabilityBonus = disabilityBonus.add(rule.bonusDays());
                }
            }
        }

        BigDecimal total = roundToHalfDay(partTime.add(ageBonus).add(tenureBonus).add(disabilityBonus));
        log.debug("Vacaciones {}: meses={} edad={} antigüedad={} total={}", input.getYear(), months, age, tenure, total);

        return VacationCalcOutput.builder()
                .baseEntitlement(base)
                .proRatedEntitlement(proRated.stripTrailingZeros())
                .partTimeAdjusted(partTime.stripTrailingZeros())
                .ageBonus(ageBonus)
                .tenureBonus(tenureBonus)
                .disabilityBonus(disabilityBonus)
                .totalEntitlement(total)
                .monthsEmployed(months)
                .ageAtReference(age)
                .tenureYears(tenure)
                .build();
    }

    /** Días que pasan al año siguiente. Nada si el saldo no es positivo; un tope no positivo es sin tope. */
    public BigDecimal carryover(BigDecimal available, BigDecimal maxCarryover) {
        if (available == null || available.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        if (maxCarryover != null && maxCarryover.signum() > 0 && available.compareTo(maxCarryover) > 0) {
            return maxCarryover;
        }
        return available;
    }

    /** Descuento del saldo por una ausencia, p. ej. 1.0 por día por 0.5 días. */
    public BigDecimal deduction(BigDecimal deductionValue, BigDecimal durationDays) {
        return nz(deductionValue).multiply(nz(durationDays));
    }

    /** Redondea al 0.5 más cercano; los empates se alejan de cero. */
    public static BigDecimal roundToHalfDay(BigDecimal value) {
        return value.multiply(TWO)
                .setScale(0, RoundingMode.HALF_UP)
                .divide(TWO, 1, RoundingMode.UNNECESSARY);
    }

    /**
     * Meses trabajados dentro del año de vacaciones. Un mes empezado cuenta completo.
     */
    int monthsEmployed(LocalDate entry, LocalDate exit, int year, VacationBasis basis) {
        LocalDate periodStart;
        LocalDate periodEnd;
        if (basis == VacationBasis.ENTRY_DATE && entry != null) {
            periodStart = anniversaryIn(entry, year);
            periodEnd = periodStart.plusYears(1).minusDays(1);
        } else {
            periodStart = LocalDate.of(year, 1, 1);
            periodEnd = LocalDate.of(year, 12, 31);
        }

        LocalDate start = entry != null && entry.isAfter(periodStart) ? entry : periodStart;
        LocalDate end = exit != null && exit.isBefore(periodEnd) ? exit : periodEnd;
        if (start.isAfter(end)) {
            return 0;
        }

        int months = 0;
        LocalDate current = start;
        while (!current.isAfter(end) && months < 12) {
            months++;
            current = start.plusMonths(months);
        }
        return months;
    }

    int ageAt(LocalDate birthDate, LocalDate reference) {
        if (birthDate == null || reference.isBefore(birthDate)) {
            return 0;
        }
        return Period.between(birthDate, reference).getYears();
    }

    int tenureAt(LocalDate entryDate, LocalDate reference) {
        if (entryDate == null || reference.isBefore(entryDate)) {
            return 0;
        }
        return Period.between(entryDate, reference).getYears();
    }

    private LocalDate anniversaryIn(LocalDate entry, int year) {
        // un ingreso el 29 de febrero pasa al 28 en años no bisiestos
        return entry.withYear(year);
    }

    private static BigDecimal nz(BigDecimal v) {
        return v != null ? v : BigDecimal.ZERO;
    }
}
