package sp.sistemaspalacios.chronos_calc.service.recalculation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.chronos_calc.dto.daily.DailyInput;
import sp.sistemaspalacios.chronos_calc.dto.daily.DailyResult;
import sp.sistemaspalacios.chronos_calc.dto.ledger.AccountKind;
import sp.sistemaspalacios.chronos_calc.dto.monthly.MonthlyEvaluationRules;
import sp.sistemaspalacios.chronos_calc.dto.recalculation.DayOutcome;
import sp.sistemaspalacios.chronos_calc.dto.recalculation.RecalculationReport;
import sp.sistemaspalacios.chronos_calc.dto.recalculation.RecalculationStatus;
import sp.sistemaspalacios.chronos_calc.exception.PeriodClosedException;
import sp.sistemaspalacios.chronos_calc.service.dailyCalculation.DailyCalculationService;
import sp.sistemaspalacios.chronos_calc.service.dailyValue.DailyValueService;
import sp.sistemaspalacios.chronos_calc.service.ledger.AccountLedgerService;
import sp.sistemaspalacios.chronos_calc.service.monthlyValue.MonthlyValueService;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Orquesta el recálculo: calcula el día, lo guarda y recalcula su mes y los meses abiertos
 * posteriores. Al final deja la cuenta de flextime de cada año tocado con el saldo de su último mes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TimeAccountingService {

    private final DailyCalculationService dailyCalculationService;
    private final DailyValueService dailyValueService;
    private final MonthlyValueService monthlyValueService;
    private final AccountLedgerService ledgerService;

    /**
     * @return el día guardado, o vacío cuando la política sin marcaciones lo omite
     * @throws PeriodClosedException si el mes del día o el año de flextime están cerrados
     */
    @Transactional
    public Optional<DailyResult> recalculateDay(DailyInput input, MonthlyEvaluationRules rules) {
        Optional<DailyResult> result = storeDay(input);
        refreshFrom(input.getEmployeeId(), YearMonth.from(input.getDate()), rules);
        return result;
    }

    /**
     * Recalcula un lote de días en orden. Un día fallido se reporta y el resto continúa. Al final
     * cada empleado se recalcula una sola vez desde su mes más antiguo tocado.
     */
    public RecalculationReport recalculateRange(List<DailyInput> inputs, MonthlyEvaluationRules rules) {
        List<DayOutcome> outcomes = new ArrayList<>();
        Map<Long, YearMonth> earliest = new LinkedHashMap<>();

        for (DailyInput input : inputs) {
            try {
                Optional<DailyResult> stored = storeDay(input);
                outcomes.add(stored.map(DayOutcome::calculated)
                        .orElseGet(() -> DayOutcome.skipped(input.getEmployeeId(), input.getDate())));
                earliest.merge(input.getEmployeeId(), YearMonth.from(input.getDate()),
                        (a, b) -> a.isBefore(b) ? a : b);
            } catch (PeriodClosedException e) {
                log.warn("⚠️ Recálculo del {} para empleado {} rechazado: {}",
                        input.getDate(), input.getEmployeeId(), e.getMessage());
                outcomes.add(DayOutcome.of(input.getEmployeeId(), input.getDate(),
                        RecalculationStatus.REJECTED, e.getMessage()));
            } catch (RuntimeException e) {
                log.error("❌ Error recalculando el {} para empleado {}", input.getDate(), input.getEmployeeId(), e);
                outcomes.add(DayOutcome.of(input.getEmployeeId(), input.getDate(),
                        RecalculationStatus.FAILED, e.getMessage()));
            }
        }

        earliest.forEach((employeeId, month) -> {
            try {
                refreshFrom(employeeId, month, rules);
            } catch (PeriodClosedException e) {
                log.warn("⚠️ Meses de empleado {} desde {} sin actualizar: {}", employeeId, month, e.getMessage());
            }
        });

        RecalculationReport report = new RecalculationReport(outcomes);
        log.info("✅ Recalculados {} días: {} calculados, {} omitidos, {} rechazados, {} fallidos", inputs.size(),
                report.count(RecalculationStatus.CALCULATED), report.count(RecalculationStatus.SKIPPED),
                report.count(RecalculationStatus.REJECTED), report.count(RecalculationStatus.FAILED));
        return report;
    }

    private Optional<DailyResult> storeDay(DailyInput input) {
        Optional<DailyResult> result = dailyCalculationService.calculateDay(input);
        if (result.isEmpty()) {
            dailyValueService.delete(input.getEmployeeId(), input.getDate());
            return Optional.empty();
        }
        return Optional.of(dailyValueService.upsert(result.get()));
    }

    /**
     * Recalcula {@code from} y cada mes guardado posterior, saltando los cerrados. Un mes cerrado
     * conserva su saldo y el siguiente arranca de él.
     */
    private void refreshFrom(Long employeeId, YearMonth from, MonthlyEvaluationRules rules) {
        List<YearMonth> months = new ArrayList<>();
        months.add(from);
        months.addAll(monthlyValueService.storedMonthsAfter(employeeId, from));

        TreeSet<Integer> years = new TreeSet<>();
        for (YearMonth month : months) {
            years.add(month.getYear());
            if (monthlyValueService.isClosed(employeeId, month)) {
                log.debug("Mes {} de empleado {} cerrado, se conserva", month, employeeId);
                continue;
            }
            monthlyValueService.recalculate(employeeId, month, rules);
        }
        if (months.size() > 1) {
            log.info("🔄 Recalculados {} meses de empleado {} desde {}", months.size(), employeeId, from);
        }

        for (int year : years) {
            // los años posteriores ya cerrados no se tocan; el del día sí debe estar abierto
            if (year != from.getYear() && ledgerService.isClosed(employeeId, AccountKind.FLEXTIME, year)) {
                continue;
            }
            monthlyValueService.latestFlextimeEnd(employeeId, year)
                    .ifPresent(end -> ledgerService.syncFlextime(employeeId, year, end));
        }
    }
}
