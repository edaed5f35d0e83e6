package sp.sistemaspalacios.chronos_calc.service.monthly;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.chronos_calc.dto.daily.DailyResult;
import sp.sistemaspalacios.chronos_calc.dto.daily.DayType;
import sp.sistemaspalacios.chronos_calc.dto.monthly.CreditType;
import sp.sistemaspalacios.chronos_calc.dto.monthly.MonthlyCalcInput;
import sp.sistemaspalacios.chronos_calc.dto.monthly.MonthlyEvaluationRules;
import sp.sistemaspalacios.chronos_calc.dto.monthly.MonthlyResult;
import sp.sistemaspalacios.chronos_calc.dto.monthly.MonthlyWarningCode;
import sp.sistemaspalacios.chronos_calc.exception.InvalidPeriodStateException;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Suma los días de un mes y pasa el resultado al saldo de flextime según el tipo de abono del
 * convenio. También gobierna las transiciones abierto/cerrado del mes.
 */
@Slf4j
@Service
public class MonthlyAggregationService {

    public MonthlyResult calculateMonth(MonthlyCalcInput input) {
        int gross = 0, net = 0, target = 0, overtime = 0, undertime = 0, breaks = 0;
        int workDays = 0, errorDays = 0, sickDays = 0, otherDays = 0;
        BigDecimal vacationDays = BigDecimal.ZERO;

        for (DailyResult day : input.getDays()) {
            gross += day.getGrossMinutes();
            net += day.getNetMinutes();
            target += day.getTargetMinutes();
            overtime += day.getOvertimeMinutes();
            undertime += day.getUndertimeMinutes();
            breaks += day.getBreakMinutes();

            if (day.getGrossMinutes() > 0 || day.getNetMinutes() > 0) {
                workDays++;
            }
            if (day.hasError()) {
                errorDays++;
            }
            if (day.getDayType() == DayType.ABSENCE && day.getAbsenceCategory() != null) {
                switch (day.getAbsenceCategory()) {
                    case VACATION -> vacationDays = vacationDays.add(
                            day.getAbsenceFraction() != null ? day.getAbsenceFraction() : BigDecimal.ONE);
                    case SICK -> sickDays++;
                    case OTHER -> otherDays++;
                }
            }
        }

        int start = input.getPreviousCarryover();
        int change = overtime - undertime;
        Flextime flextime = applyCreditType(start, change, input.getRules());

        log.debug("Mes {}-{} empleado {}: cambio={} abonado={} final={}", input.getYear(), input.getMonth(),
                input.getEmployeeId(), change, flextime.credited, flextime.end);

        return MonthlyResult.builder()
                .employeeId(input.getEmployeeId())
                .year(input.getYear())
                .month(input.getMonth())
                .totalGrossMinutes(gross)
                .totalNetMinutes(net)
                .totalTargetMinutes(target)
                .totalOvertimeMinutes(overtime)
                .totalUndertimeMinutes(undertime)
                .totalBreakMinutes(breaks)
                .flextimeStart(start)
                .flextimeChange(change)
                .flextimeRaw(start + change)
                .flextimeCredited(flextime.credited)
                .flextimeForfeited(flextime.forfeited)
                .flextimeEnd(flextime.end)
                .workDays(workDays)
                .errorDays(errorDays)
                .vacationDays(vacationDays)
                .sickDays(sickDays)
                .otherAbsenceDays(otherDays)
                .warnings(Collections.unmodifiableSet(flextime.warnings))
                .build();
    }

    // ==========================================
    // TRANSICIONES DE ESTADO
    // ==========================================

    /**
     * Congela un mes recién recalculado. Se rechaza si el mes guardado ya está cerrado.
     */
    public MonthlyResult close(MonthlyResult current, MonthlyResult recomputed, String actor, LocalDateTime at) {
        if (current != null && current.isClosed()) {
            throw new InvalidPeriodStateException(String.format("Month %d-%02d of employee %d is already closed",
                    current.getYear(), current.getMonth(), current.getEmployeeId()));
        }
        return recomputed.toBuilder()
                .closed(true)
                .closedBy(actor)
                .closedAt(at)
                .reopenedBy(current != null ? current.getReopenedBy() : null)
                .reopenedAt(current != null ? current.getReopenedAt() : null)
                .build();
    }

    public MonthlyResult reopen(MonthlyResult current, String actor, LocalDateTime at) {
        if (current == null || !current.isClosed()) {
            throw new InvalidPeriodStateException("Only a closed month can be reopened");
        }
        return current.toBuilder()
                .closed(false)
                .reopenedBy(actor)
                .reopenedAt(at)
                .build();
    }

    /**
     * Saldo de flextime de fin de año con el piso anual aplicado. El piso es una magnitud positiva;
     * los saldos por debajo de su negativo suben hasta él.
     */
    public int annualCarryover(Integer currentBalance, Integer annualFloor) {
        if (currentBalance == null) {
            return 0;
        }
        if (annualFloor != null && currentBalance < -annualFloor) {
            return -annualFloor;
        }
        return currentBalance;
    }

    // ==========================================
    // TIPOS DE ABONO
    // ==========================================

    private static final class Flextime {
        int credited;
        int forfeited;
        int end;
        final Set<MonthlyWarningCode> warnings = EnumSet.noneOf(MonthlyWarningCode.class);
    }

    private Flextime applyCreditType(int start, int change, MonthlyEvaluationRules rules) {
        Flextime f = new Flextime();
        CreditType type = rules != null && rules.getCreditType() != null ? rules.getCreditType() : CreditType.NO_EVALUATION;

        switch (type) {
            case NO_EVALUATION -> {
                f.credited = change;
                f.end = start + change;
            }
            case COMPLETE_CARRYOVER -> {
                int credited = change;
                if (rules.getMaxFlextimePerMonth() != null && credited > rules.getMaxFlextimePerMonth()) {
                    f.forfeited = credited - rules.getMaxFlextimePerMonth();
                    credited = rules.getMaxFlextimePerMonth();
                    f.warnings.add(MonthlyWarningCode.MONTHLY_CAP_REACHED);
                }
                f.credited = credited;
                applyBalanceCaps(f, start + credited, rules);
            }
            case AFTER_THRESHOLD -> {
                int threshold = rules.getFlextimeThreshold() != null ? rules.getFlextimeThreshold() : 0;
                if (change > threshold) {
                    f.credited = change - threshold;
                    f.forfeited = threshold;
                } else if (change > 0) {
                    f.credited = 0;
                    f.forfeited = change;
                    f.warnings.add(MonthlyWarningCode.BELOW_THRESHOLD);
                } else {
                    // las horas faltantes siempre se descuentan completas
                    f.credited = change;
                }
                if (rules.getMaxFlextimePerMonth() != null && f.credited > rules.getMaxFlextimePerMonth()) {
                    f.forfeited += f.credited - rules.getMaxFlextimePerMonth();
                    f.credited = rules.getMaxFlextimePerMonth();
                    f.warnings.add(MonthlyWarningCode.MONTHLY_CAP_REACHED);
                }
                applyBalanceCaps(f, start + f.credited, rules);
            }
            case NO_CARRYOVER -> {
                f.credited = 0;
                f.end = 0;
                f.forfeited = change;
                f.warnings.add(MonthlyWarningCode.NO_CARRYOVER);
            }
        }
        return f;
    }

    private void applyBalanceCaps(Flextime f, int balance, MonthlyEvaluationRules rules) {
        int capped = balance;
        if (rules.getFlextimeCapPositive() != null && capped > rules.getFlextimeCapPositive()) {
            f.forfeited += capped - rules.getFlextimeCapPositive();
            capped = rules.getFlextimeCapPositive();
        }
        if (rules.getFlextimeCapNegative() != null && capped < -rules.getFlextimeCapNegative()) {
            capped = -rules.getFlextimeCapNegative();
        }
        if (capped != balance) {
            f.warnings.add(MonthlyWarningCode.FLEXTIME_CAPPED);
        }
        f.end = capped;
    }
}
