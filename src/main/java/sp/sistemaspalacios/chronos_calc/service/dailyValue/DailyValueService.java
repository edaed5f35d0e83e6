package sp.sistemaspalacios.chronos_calc.service.dailyValue;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.chronos_calc.dto.daily.CodeSets;
import sp.sistemaspalacios.chronos_calc.dto.daily.DailyResult;
import sp.sistemaspalacios.chronos_calc.dto.daily.DayErrorCode;
import sp.sistemaspalacios.chronos_calc.dto.daily.DayWarningCode;
import sp.sistemaspalacios.chronos_calc.entity.dailyValue.DailyValue;
import sp.sistemaspalacios.chronos_calc.exception.PeriodClosedException;
import sp.sistemaspalacios.chronos_calc.exception.ResourceNotFoundException;
import sp.sistemaspalacios.chronos_calc.repository.dailyValue.DailyValueRepository;
import sp.sistemaspalacios.chronos_calc.repository.monthlyValue.MonthlyValueRepository;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * Guarda los días calculados, una fila por (empleado, fecha). Se rechazan escrituras en meses cerrados.
 * <p>
 * Los pares de marcaciones no se guardan; se reconstruyen en el siguiente recálculo.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DailyValueService {

    private final DailyValueRepository dailyValueRepository;
    private final MonthlyValueRepository monthlyValueRepository;

    @Transactional
    public DailyResult upsert(DailyResult result) {
        Objects.requireNonNull(result.getEmployeeId(), "employeeId");
        Objects.requireNonNull(result.getDate(), "date");
        ensureMonthOpen(result.getEmployeeId(), result.getDate());

        DailyValue value = dailyValueRepository
                .findByEmployeeIdAndValueDate(result.getEmployeeId(), result.getDate())
                .orElseGet(DailyValue::new);
        boolean created = value.getId() == null;
        copy(result, value);
        dailyValueRepository.save(value);

        log.info("✅ Día {} de empleado {} {} (errores={})", result.getDate(), result.getEmployeeId(),
                created ? "creado" : "actualizado",
                result.getErrors());
        return result;
    }

    /** Borra un día guardado, p. ej. cuando su política sin marcaciones pasó a omitirlo. */
    @Transactional
    public boolean delete(Long employeeId, LocalDate date) {
        ensureMonthOpen(employeeId, date);
        return dailyValueRepository.findByEmployeeIdAndValueDate(employeeId, date)
                .map(v -> {
                    dailyValueRepository.delete(v);
                    log.info("🗑️ Día {} de empleado {} eliminado", date, employeeId);
                    return true;
                })
                .orElse(false);
    }

    @Transactional(readOnly = true)
    public DailyResult getDay(Long employeeId, LocalDate date) {
        return dailyValueRepository.findByEmployeeIdAndValueDate(employeeId, date)
                .map(this::toResult)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "No daily value for employee " + employeeId + " on " + date));
    }

    @Transactional(readOnly = true)
    public List<DailyResult> getMonth(Long employeeId, YearMonth month) {
        return dailyValueRepository
                .findByEmployeeIdAndValueDateBetweenOrderByValueDateAsc(employeeId, month.atDay(1), month.atEndOfMonth())
                .stream()
                .map(this::toResult)
                .toList();
    }

    /** Días que requieren corrección manual. */
    @Transactional(readOnly = true)
    public List<DailyResult> getErrorDays(Long employeeId, LocalDate from, LocalDate to) {
        return dailyValueRepository
                .findByEmployeeIdAndHasErrorTrueAndValueDateBetweenOrderByValueDateAsc(employeeId, from, to)
                .stream()
                .map(this::toResult)
                .toList();
    }

    private void ensureMonthOpen(Long employeeId, LocalDate date) {
        if (monthlyValueRepository.existsByEmployeeIdAndPeriodYearAndPeriodMonthAndClosedTrue(
                employeeId, date.getYear(), date.getMonthValue())) {
            throw new PeriodClosedException(String.format("Month %d-%02d of employee %d is closed",
                    date.getYear(), date.getMonthValue(), employeeId));
        }
    }

    private void copy(DailyResult r, DailyValue v) {
        v.setEmployeeId(r.getEmployeeId());
        v.setValueDate(r.getDate());
        v.setDayType(r.getDayType());
        v.setPlanCode(r.getEffectivePlanCode());
        v.setGrossMinutes(r.getGrossMinutes());
        v.setNetMinutes(r.getNetMinutes());
        v.setTargetMinutes(r.getTargetMinutes());
        v.setOvertimeMinutes(r.getOvertimeMinutes());
        v.setUndertimeMinutes(r.getUndertimeMinutes());
        v.setBreakMinutes(r.getBreakMinutes());
        v.setPaidBreakMinutes(r.getPaidBreakMinutes());
        v.setCappedMinutes(r.getCappedMinutes());
        v.setWindowCappedMinutes(r.getWindowCappedMinutes());
        v.setFirstCome(r.getFirstCome());
        v.setLastGo(r.getLastGo());
        v.setBookingCount(r.getBookingCount());
        v.setErrorCodes(r.getErrors().isEmpty() ? EnumSet.noneOf(DayErrorCode.class) : EnumSet.copyOf(r.getErrors()));
        v.setWarningCodes(r.getWarnings().isEmpty() ? EnumSet.noneOf(DayWarningCode.class) : EnumSet.copyOf(r.getWarnings()));
        v.setHasError(r.hasError());
        v.setAbsenceCategory(r.getAbsenceCategory());
        v.setAbsenceFraction(r.getAbsenceFraction());
        v.setHolidayCategory(r.getHolidayCategory());
    }

    DailyResult toResult(DailyValue v) {
        return DailyResult.builder()
                .employeeId(v.getEmployeeId())
                .date(v.getValueDate())
                .dayType(v.getDayType())
                .effectivePlanCode(v.getPlanCode())
                .grossMinutes(v.getGrossMinutes())
                .netMinutes(v.getNetMinutes())
                .targetMinutes(v.getTargetMinutes())
                .overtimeMinutes(v.getOvertimeMinutes())
                .undertimeMinutes(v.getUndertimeMinutes())
                .breakMinutes(v.getBreakMinutes())
                .paidBreakMinutes(v.getPaidBreakMinutes())
                .cappedMinutes(v.getCappedMinutes())
                .windowCappedMinutes(v.getWindowCappedMinutes())
                .firstCome(v.getFirstCome())
                .lastGo(v.getLastGo())
                .bookingCount(v.getBookingCount())
                .errors(CodeSets.copyOf(DayErrorCode.class, v.getErrorCodes()))
                .warnings(CodeSets.copyOf(DayWarningCode.class, v.getWarningCodes()))
                .absenceCategory(v.getAbsenceCategory())
                .absenceFraction(v.getAbsenceFraction())
                .holidayCategory(v.getHolidayCategory())
                .build();
    }
}
