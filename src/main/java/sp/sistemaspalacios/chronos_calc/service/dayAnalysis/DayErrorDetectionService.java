package sp.sistemaspalacios.chronos_calc.service.dayAnalysis;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.chronos_calc.config.CalculationProperties;
import sp.sistemaspalacios.chronos_calc.dto.booking.BookingEvent;
import sp.sistemaspalacios.chronos_calc.dto.daily.DailyInput;
import sp.sistemaspalacios.chronos_calc.dto.daily.DailyResult;
import sp.sistemaspalacios.chronos_calc.dto.daily.DayErrorCode;
import sp.sistemaspalacios.chronos_calc.dto.daily.DayType;
import sp.sistemaspalacios.chronos_calc.dto.daily.DayWarningCode;
import sp.sistemaspalacios.chronos_calc.dto.schedule.DayChangeBehavior;
import sp.sistemaspalacios.chronos_calc.dto.schedule.ScheduleConfig;
import sp.sistemaspalacios.chronos_calc.dto.schedule.Tolerance;
import sp.sistemaspalacios.chronos_calc.service.common.TimeService;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Marca las infracciones de un día de trabajo ya calculado. Los días de ausencia, festivo, libres
 * o sin marcaciones se devuelven sin tocar. Anotar dos veces el mismo día da el mismo resultado.
 * <p>
 * En planes nocturnos las horas se comparan sobre la línea de tiempo del turno (la salida cae al
 * día siguiente). Con {@code AUTO_COMPLETE} los cortes de las 24:00 no son marcaciones reales y no
 * se revisan las ventanas.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DayErrorDetectionService {

    private final CalculationProperties properties;

    public DailyResult annotate(DailyResult result, DailyInput input, ScheduleConfig plan) {
        if (result.getDayType() != DayType.WORKDAY || plan == null) {
            return result;
        }

        Set<DayErrorCode> errors = EnumSet.noneOf(DayErrorCode.class);
        Set<DayWarningCode> warnings = EnumSet.noneOf(DayWarningCode.class);
        int grace = properties.getWindowGraceMinutes();
        boolean night = plan.crossesMidnight();
        Integer firstCome = result.getFirstCome();
        Integer lastGo = result.getLastGo();
        if (night && firstCome != null && firstCome < 0) {
            firstCome += TimeService.MINUTES_PER_DAY;
        }
        if (night && firstCome != null && lastGo != null && lastGo < firstCome) {
            lastGo += TimeService.MINUTES_PER_DAY;
        }
        boolean checkTimes = !night || plan.effectiveDayChange() != DayChangeBehavior.AUTO_COMPLETE;

        // ventanas
        Integer latestGo = onShiftLine(plan, plan.expectedGo());
        if (checkTimes && firstCome != null && plan.getComeFrom() != null && firstCome < plan.getComeFrom() - grace) {
            errors.add(DayErrorCode.CAME_BEFORE_ALLOWED);
        }
        if (checkTimes && lastGo != null && latestGo != null && lastGo > latestGo + grace) {
            errors.add(DayErrorCode.LEFT_AFTER_ALLOWED);
        }

        // tramo primera entrada - última salida; las pausas dentro del núcleo no cuentan
        if (!night && plan.isFlextime() && plan.hasCoreTime() && firstCome != null && lastGo != null
                && (firstCome > plan.getCoreStart() || lastGo < plan.getCoreEnd())) {
            errors.add(DayErrorCode.MISSED_CORE_TIME);
        }

        if (hasDuplicateBookings(input.getBookings())) {
            errors.add(DayErrorCode.OVERLAPPING_BOOKINGS);
        }
        if (result.getPairs().stream().anyMatch(p -> p.duration() < 0)) {
            errors.add(DayErrorCode.NEGATIVE_DURATION);
        }

        // avisos, relativos a la tolerancia
        Tolerance tolerance = plan.effectiveTolerance();
        Integer latestCome = plan.getComeTo() != null ? plan.getComeTo() : plan.getComeFrom();
        if (checkTimes && firstCome != null && latestCome != null && firstCome > latestCome + tolerance.comePlus()) {
            warnings.add(DayWarningCode.LATE_ARRIVAL);
        }
        Integer earliestGo = onShiftLine(plan, plan.getGoFrom() != null ? plan.getGoFrom() : plan.getGoTo());
        if (checkTimes && lastGo != null && earliestGo != null && lastGo < earliestGo - tolerance.goMinus()) {
            warnings.add(DayWarningCode.EARLY_DEPARTURE);
        }
        if (result.getGrossMinutes() > properties.getLongWorkDayMinutes()) {
            warnings.add(DayWarningCode.LONG_WORK_DAY);
        }
        if (result.getCappedMinutes() > result.getWindowCappedMinutes()) {
            warnings.add(DayWarningCode.NET_TIME_CAPPED);
        }

        if (!errors.isEmpty()) {
            log.debug("Día {} de empleado {} marcado con {}", result.getDate(), result.getEmployeeId(), errors);
        }
        return result.withCodes(errors, warnings);
    }

    /** En un plan nocturno las salidas anteriores a la entrada pertenecen al día siguiente. */
    private Integer onShiftLine(ScheduleConfig plan, Integer goTime) {
        if (goTime == null || !plan.crossesMidnight() || goTime >= plan.getComeFrom()) {
            return goTime;
        }
        return goTime + TimeService.MINUTES_PER_DAY;
    }

    private boolean hasDuplicateBookings(List<BookingEvent> bookings) {
        Set<String> seen = new HashSet<>();
        for (BookingEvent e : bookings) {
            if (!seen.add(e.category() + "@" + e.effectiveTime())) {
                return true;
            }
        }
        return false;
    }
}
