package sp.sistemaspalacios.chronos_calc.service.monthlyValue;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.chronos_calc.dto.daily.DailyResult;
import sp.sistemaspalacios.chronos_calc.dto.ledger.AccountKind;
import sp.sistemaspalacios.chronos_calc.dto.monthly.MonthlyCalcInput;
import sp.sistemaspalacios.chronos_calc.dto.monthly.MonthlyEvaluationRules;
import sp.sistemaspalacios.chronos_calc.dto.monthly.MonthlyResult;
import sp.sistemaspalacios.chronos_calc.dto.monthly.MonthlyWarningCode;
import sp.sistemaspalacios.chronos_calc.dto.daily.CodeSets;
import sp.sistemaspalacios.chronos_calc.entity.ledger.AccountLedgerEntry;
import sp.sistemaspalacios.chronos_calc.entity.monthlyValue.MonthlyValue;
import sp.sistemaspalacios.chronos_calc.exception.PeriodClosedException;
import sp.sistemaspalacios.chronos_calc.exception.ResourceNotFoundException;
import sp.sistemaspalacios.chronos_calc.repository.ledger.AccountLedgerEntryRepository;
import sp.sistemaspalacios.chronos_calc.repository.monthlyValue.MonthlyValueRepository;
import sp.sistemaspalacios.chronos_calc.service.dailyValue.DailyValueService;
import sp.sistemaspalacios.chronos_calc.service.monthly.MonthlyAggregationService;

import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Estado persistido del mes: los meses abiertos siguen a sus días y los cerrados quedan congelados
 * hasta reabrirlos. La versión de la entidad hace fallar cierres/reaperturas concurrentes en vez de
 * pisarse.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MonthlyValueService {

    private final MonthlyValueRepository monthlyValueRepository;
    private final AccountLedgerEntryRepository ledgerRepository;
    private final DailyValueService dailyValueService;
    private final MonthlyAggregationService aggregationService;

    /** Reconstruye un mes abierto desde sus días guardados. */
    @Transactional
    public MonthlyResult recalculate(Long employeeId, YearMonth month, MonthlyEvaluationRules rules) {
        Optional<MonthlyValue> existing = find(employeeId, month);
        if (existing.isPresent() && existing.get().isClosed()) {
            throw new PeriodClosedException(String.format("Month %s of employee %d is closed", month, employeeId));
        }
        MonthlyResult result = compute(employeeId, month, rules);
        MonthlyValue value = existing.orElseGet(MonthlyValue::new);
        copy(result, value);
        monthlyValueRepository.save(value);
        log.debug("Mes {} de empleado {} recalculado: flextime final {}", month, employeeId, result.getFlextimeEnd());
        return result;
    }

    @Transactional
    public MonthlyResult close(Long employeeId, YearMonth month, MonthlyEvaluationRules rules, String actor) {
        Optional<MonthlyValue> existing = find(employeeId, month);
        MonthlyResult current = existing.map(this::toResult).orElse(null);
        MonthlyResult closed = aggregationService.close(current, compute(employeeId, month, rules),
                actor, LocalDateTime.now());

        MonthlyValue value = existing.orElseGet(MonthlyValue::new);
        copy(closed, value);
        monthlyValueRepository.save(value);
        log.info("🔒 Mes {} de empleado {} cerrado por {}", month, employeeId, actor);
        return closed;
    }

    @Transactional
    public MonthlyResult reopen(Long employeeId, YearMonth month, String actor) {
        Optional<MonthlyValue> existing = find(employeeId, month);
        MonthlyResult reopened = aggregationService.reopen(existing.map(this::toResult).orElse(null),
                actor, LocalDateTime.now());

        MonthlyValue value = existing.orElseThrow();
        copy(reopened, value);
        monthlyValueRepository.save(value);
        log.info("🔓 Mes {} de empleado {} reabierto por {}", month, employeeId, actor);
        return reopened;
    }

    @Transactional(readOnly = true)
    public MonthlyResult getMonth(Long employeeId, YearMonth month) {
        return find(employeeId, month)
                .map(this::toResult)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "No monthly value for employee " + employeeId + " in " + month));
    }

    @Transactional(readOnly = true)
    public boolean isClosed(Long employeeId, YearMonth month) {
        return monthlyValueRepository.existsByEmployeeIdAndPeriodYearAndPeriodMonthAndClosedTrue(
                employeeId, month.getYear(), month.getMonthValue());
    }

    /** Meses ya guardados del empleado posteriores a {@code month}, en orden cronológico. */
    @Transactional(readOnly = true)
    public List<YearMonth> storedMonthsAfter(Long employeeId, YearMonth month) {
        return monthlyValueRepository.findByEmployeeIdOrderByPeriodYearAscPeriodMonthAsc(employeeId).stream()
                .map(v -> YearMonth.of(v.getPeriodYear(), v.getPeriodMonth()))
                .filter(m -> m.isAfter(month))
                .toList();
    }

    /** Saldo final de flextime del último mes guardado del año, abierto o cerrado. */
    @Transactional(readOnly = true)
    public Optional<Integer> latestFlextimeEnd(Long employeeId, int year) {
        List<MonthlyValue> months = monthlyValueRepository
                .findByEmployeeIdAndPeriodYearOrderByPeriodMonthAsc(employeeId, year);
        return months.isEmpty()
                ? Optional.empty()
                : Optional.of(months.get(months.size() - 1).getFlextimeEnd());
    }

    /**
     * Flextime que entra al mes: el saldo final del mes anterior. Enero parte del saldo de apertura
     * de la cuenta de flextime sólo cuando el año anterior ya está cerrado.
     */
    @Transactional(readOnly = true)
    public int previousCarryover(Long employeeId, YearMonth month) {
        if (month.getMonthValue() == 1 && previousYearClosed(employeeId, month.getYear())) {
            Optional<Integer> opening = ledgerRepository
                    .findByEmployeeIdAndAccountKindAndLedgerYear(employeeId, AccountKind.FLEXTIME, month.getYear())
                    .map(e -> e.getOpeningBalance().intValue());
            if (opening.isPresent()) {
                return opening.get();
            }
        }
        return find(employeeId, month.minusMonths(1))
                .map(MonthlyValue::getFlextimeEnd)
                .orElse(0);
    }

    private boolean previousYearClosed(Long employeeId, int year) {
        return ledgerRepository
                .findByEmployeeIdAndAccountKindAndLedgerYear(employeeId, AccountKind.FLEXTIME, year - 1)
                .map(AccountLedgerEntry::isClosed)
                .orElse(false);
    }

    private MonthlyResult compute(Long employeeId, YearMonth month, MonthlyEvaluationRules rules) {
        List<DailyResult> days = dailyValueService.getMonth(employeeId, month);
        return aggregationService.calculateMonth(MonthlyCalcInput.builder()
                .employeeId(employeeId)
                .year(month.getYear())
                .month(month.getMonthValue())
                .days(days)
                .previousCarryover(previousCarryover(employeeId, month))
                .rules(rules)
                .build());
    }

    private Optional<MonthlyValue> find(Long employeeId, YearMonth month) {
        return monthlyValueRepository.findByEmployeeIdAndPeriodYearAndPeriodMonth(
                employeeId, month.getYear(), month.getMonthValue());
    }

    private void copy(MonthlyResult r, MonthlyValue v) {
        v.setEmployeeId(r.getEmployeeId());
        v.setPeriodYear(r.getYear());
        v.setPeriodMonth(r.getMonth());
        v.setTotalGrossMinutes(r.getTotalGrossMinutes());
        v.setTotalNetMinutes(r.getTotalNetMinutes());
        v.setTotalTargetMinutes(r.getTotalTargetMinutes());
        v.setTotalOvertimeMinutes(r.getTotalOvertimeMinutes());
        v.setTotalUndertimeMinutes(r.getTotalUndertimeMinutes());
        v.setTotalBreakMinutes(r.getTotalBreakMinutes());
        v.setFlextimeStart(r.getFlextimeStart());
        v.setFlextimeChange(r.getFlextimeChange());
        v.setFlextimeRaw(r.getFlextimeRaw());
        v.setFlextimeCredited(r.getFlextimeCredited());
        v.setFlextimeForfeited(r.getFlextimeForfeited());
        v.setFlextimeEnd(r.getFlextimeEnd());
        v.setWorkDays(r.getWorkDays());
        v.setErrorDays(r.getErrorDays());
        v.setVacationDays(r.getVacationDays());
        v.setSickDays(r.getSickDays());
        v.setOtherAbsenceDays(r.getOtherAbsenceDays());
        v.setWarningCodes(r.getWarnings().isEmpty()
                ? EnumSet.noneOf(MonthlyWarningCode.class) : EnumSet.copyOf(r.getWarnings()));
        v.setClosed(r.isClosed());
        v.setClosedBy(r.getClosedBy());
        v.setClosedAt(r.getClosedAt());
        v.setReopenedBy(r.getReopenedBy());
        v.setReopenedAt(r.getReopenedAt());
    }

    private MonthlyResult toResult(MonthlyValue v) {
        return MonthlyResult.builder()
                .employeeId(v.getEmployeeId())
                .year(v.getPeriodYear())
                .month(v.getPeriodMonth())
                .totalGrossMinutes(v.getTotalGrossMinutes())
                .totalNetMinutes(v.getTotalNetMinutes())
                .totalTargetMinutes(v.getTotalTargetMinutes())
                .totalOvertimeMinutes(v.getTotalOvertimeMinutes())
                .totalUndertimeMinutes(v.getTotalUndertimeMinutes())
                .totalBreakMinutes(v.getTotalBreakMinutes())
                .flextimeStart(v.getFlextimeStart())
                .flextimeChange(v.getFlextimeChange())
                .flextimeRaw(v.getFlextimeRaw())
                .flextimeCredited(v.getFlextimeCredited())
                .flextimeForfeited(v.getFlextimeForfeited())
                .flextimeEnd(v.getFlextimeEnd())
                .workDays(v.getWorkDays())
                .errorDays(v.getErrorDays())
                .vacationDays(v.getVacationDays())
                .sickDays(v.getSickDays())
                .otherAbsenceDays(v.getOtherAbsenceDays())
                .warnings(CodeSets.copyOf(MonthlyWarningCode.class, v.getWarningCodes()))
                .closed(v.isClosed())
                .closedBy(v.getClosedBy())
                .closedAt(v.getClosedAt())
                .reopenedBy(v.getReopenedBy())
                .reopenedAt(v.getReopenedAt())
                .build();
    }
}
