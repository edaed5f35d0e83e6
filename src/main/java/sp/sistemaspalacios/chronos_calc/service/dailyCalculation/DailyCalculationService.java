package sp.sistemaspalacios.chronos_calc.service.dailyCalculation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.chronos_calc.dto.booking.BookingCategory;
import sp.sistemaspalacios.chronos_calc.dto.booking.BookingEvent;
import sp.sistemaspalacios.chronos_calc.dto.booking.BookingPair;
import sp.sistemaspalacios.chronos_calc.dto.booking.PairingResult;
import sp.sistemaspalacios.chronos_calc.dto.daily.AbsenceFact;
import sp.sistemaspalacios.chronos_calc.dto.daily.CodeSets;
import sp.sistemaspalacios.chronos_calc.dto.daily.DailyInput;
import sp.sistemaspalacios.chronos_calc.dto.daily.DailyResult;
import sp.sistemaspalacios.chronos_calc.dto.daily.DayErrorCode;
import sp.sistemaspalacios.chronos_calc.dto.daily.DayType;
import sp.sistemaspalacios.chronos_calc.dto.daily.DayWarningCode;
import sp.sistemaspalacios.chronos_calc.dto.daily.HolidayFact;
import sp.sistemaspalacios.chronos_calc.dto.schedule.NoBookingPolicy;
import sp.sistemaspalacios.chronos_calc.dto.schedule.ScheduleConfig;
import sp.sistemaspalacios.chronos_calc.dto.shift.ShiftDetectionResult;
import sp.sistemaspalacios.chronos_calc.service.booking.BookingPairingService;
import sp.sistemaspalacios.chronos_calc.service.breakDeduction.BreakDeductionResult;
import sp.sistemaspalacios.chronos_calc.service.breakDeduction.BreakDeductionService;
import sp.sistemaspalacios.chronos_calc.service.common.TimeService;
import sp.sistemaspalacios.chronos_calc.service.dayAnalysis.DayErrorDetectionService;
import sp.sistemaspalacios.chronos_calc.service.dayChange.DayChangeService;
import sp.sistemaspalacios.chronos_calc.service.dayChange.DayChangeService.DayChangeResolution;
import sp.sistemaspalacios.chronos_calc.service.normalization.TimeNormalizationService;
import sp.sistemaspalacios.chronos_calc.service.normalization.TimeNormalizationService.WindowCapping;
import sp.sistemaspalacios.chronos_calc.service.shift.ShiftDetectionService;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Calcula un {@link DailyResult} a partir de un {@link DailyInput}.
 * <p>
 * Orden de despacho: ausencia, festivo, día libre, día sin marcaciones, día de trabajo normal. Un
 * festivo sólo gana a una ausencia si su prioridad es mayor. Los días de trabajo pasan por cambio de
 * día, detección de turno, emparejado, tolerancia/redondeo, recorte a la ventana, descuento de
 * pausas y al final el detector de errores.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DailyCalculationService {

    private final BookingPairingService pairingService;
    private final TimeNormalizationService normalizationService;
    private final BreakDeductionService breakDeductionService;
    private final ShiftDetectionService shiftDetectionService;
    private final DayErrorDetectionService errorDetectionService;
    private final DayChangeService dayChangeService;

    /**
     * @return el día calculado, o vacío cuando la política sin marcaciones del plan lo omite
     */
    public Optional<DailyResult> calculateDay(DailyInput input) {
        ScheduleConfig schedule = input.getSchedule();
        AbsenceFact absence = input.getAbsence();
        HolidayFact holiday = input.getHoliday();

        if (absence != null && (holiday == null || holiday.priority() <= absence.priority())) {
            return Optional.of(absenceDay(input, absence));
        }
        if (holiday != null) {
            return Optional.of(holidayDay(input, holiday));
        }
        if (schedule == null) {
            return Optional.of(offDay(input));
        }
        if (input.getBookings().isEmpty()) {
            return noBookingDay(input);
        }
        return Optional.of(workDay(input, Set.of()));
    }

    // ==========================================
    // DÍAS ESPECIALES
    // ==========================================

    private DailyResult absenceDay(DailyInput input, AbsenceFact absence) {
        ScheduleConfig schedule = input.getSchedule();
        int target = schedule != null ? schedule.getTargetMinutes() : 0;
        int credit = absence.creditsHours() ? absenceCredit(target, absence.durationFraction()) : 0;

        Set<DayWarningCode> warnings = EnumSet.noneOf(DayWarningCode.class);
        if (input.isHoliday()) {
            warnings.add(DayWarningCode.ABSENCE_ON_HOLIDAY);
        }

        log.debug("Ausencia {} el {}: abonados {} de {} minutos", absence.typeCode(), input.getDate(), credit, target);
        return DailyResult.empty(input, DayType.ABSENCE).toBuilder()
                .grossMinutes(credit)
                .netMinutes(credit)
                .targetMinutes(target)
                .absenceCategory(absence.category())
                .absenceFraction(absence.durationFraction())
                .holidayCategory(input.isHoliday() ? input.getHoliday().category() : null)
                .warnings(CodeSets.copyOf(DayWarningCode.class, warnings))
                .build();
    }

    private DailyResult holidayDay(DailyInput input, HolidayFact holiday) {
        ScheduleConfig schedule = input.getSchedule();
        if (schedule == null) {
            return DailyResult.empty(input, DayType.HOLIDAY).toBuilder()
                    .holidayCategory(holiday.category())
                    .warnings(Set.of(DayWarningCode.HOLIDAY))
                    .build();
        }
        if (!input.getBookings().isEmpty()) {
            DailyResult worked = workDay(input, Set.of(DayWarningCode.WORKED_ON_HOLIDAY));
            return worked.toBuilder().holidayCategory(holiday.category()).build();
        }

        int target = schedule.getTargetMinutes();
        int credit = schedule.holidayCredit(holiday.category());
        return DailyResult.empty(input, DayType.HOLIDAY).toBuilder()
                .grossMinutes(credit)
                .netMinutes(credit)
                .targetMinutes(target)
                .undertimeMinutes(Math.max(0, target - credit))
                .holidayCategory(holiday.category())
                .warnings(Set.of(DayWarningCode.HOLIDAY))
                .build();
    }

    private DailyResult offDay(DailyInput input) {
        Set<DayWarningCode> warnings = EnumSet.of(DayWarningCode.OFF_DAY);
        if (!input.getBookings().isEmpty()) {
            log.warn("⚠️ Empleado {} tiene {} marcaciones en el día libre {}",
                    input.getEmployeeId(), input.getBookings().size(), input.getDate());
            warnings.add(DayWarningCode.BOOKINGS_ON_OFF_DAY);
        }
        return DailyResult.empty(input, DayType.OFF_DAY).toBuilder()
                .warnings(CodeSets.copyOf(DayWarningCode.class, warnings))
                .build();
    }

    private Optional<DailyResult> noBookingDay(DailyInput input) {
        ScheduleConfig schedule = input.getSchedule();
        int target = schedule.getTargetMinutes();
        DailyResult base = DailyResult.empty(input, DayType.NO_BOOKINGS).toBuilder()
                .targetMinutes(target)
                .build();

        NoBookingPolicy policy = schedule.getNoBookingPolicy() != null
                ? schedule.getNoBookingPolicy() : NoBookingPolicy.ERROR;
        return switch (policy) {
            case SKIP -> {
                log.debug("Sin marcaciones el {} para empleado {}: se omite", input.getDate(), input.getEmployeeId());
                yield Optional.empty();
            }
            case CREDIT_TARGET -> Optional.of(base.toBuilder()
                    .grossMinutes(target)
                    .netMinutes(target)
                    .warnings(Set.of(DayWarningCode.NO_BOOKINGS_CREDITED))
                    .build());
            case CREDIT_ZERO -> Optional.of(base.toBuilder()
                    .undertimeMinutes(target)
                    .warnings(Set.of(DayWarningCode.NO_BOOKINGS_DEDUCTED))
                    .build());
            case USE_ABSENCE -> schedule.getNoBookingAbsence() != null
                    ? Optional.of(absenceDay(input, schedule.getNoBookingAbsence()))
                    : Optional.of(noBookingError(base, target));
            case ERROR -> Optional.of(noBookingError(base, target));
        };
    }

    private DailyResult noBookingError(DailyResult base, int target) {
        return base.toBuilder()
                .undertimeMinutes(target)
                .errors(Set.of(DayErrorCode.NO_BOOKINGS))
                .build();
    }

    // ==========================================
    // DÍA DE TRABAJO
    // ==========================================

    private DailyResult workDay(DailyInput input, Set<DayWarningCode> extraWarnings) {
        ScheduleConfig assigned = input.getSchedule();
        Set<DayErrorCode> errors = EnumSet.noneOf(DayErrorCode.class);
        Set<DayWarningCode> warnings = EnumSet.noneOf(DayWarningCode.class);
        warnings.addAll(extraWarnings);

        DayChangeResolution dayChange = dayChangeService.resolve(input, assigned);
        List<BookingEvent> bookings = dayChange.bookings();
        List<BookingPair> carried = dayChange.carriedPairs();

        ShiftDetectionResult shift = shiftDetectionService.detect(assigned,
                clock(earliest(rawFirst(bookings, BookingCategory.COME), carried.stream().map(BookingPair::start))),
                clock(latest(rawLast(bookings, BookingCategory.GO), carried.stream().map(BookingPair::end))));
        ScheduleConfig plan = shift.matchedPlan() != null ? shift.matchedPlan() : assigned;
        if (shift.hasError()) {
            errors.add(DayErrorCode.NO_MATCHING_SHIFT);
        } else if (!shift.original()) {
            warnings.add(DayWarningCode.SHIFT_SWITCHED);
        }

        PairingResult pairing = pairingService.pair(bookings);
        errors.addAll(pairing.errors());

        List<BookingPair> workPairs = new ArrayList<>(pairing.workPairs());
        workPairs.addAll(carried);
        List<BookingPair> normalized = normalizationService.normalize(workPairs, plan);
        WindowCapping capping = normalizationService.capToEvaluationWindow(normalized, plan);
        List<BookingPair> work = capping.pairs();
        List<BookingPair> breaks = pairing.breakPairs();
        List<BookingPair> validWork = work.stream().filter(p -> p.duration() >= 0).toList();
        if (capping.cappedMinutes() > 0) {
            warnings.add(DayWarningCode.OUTSIDE_WINDOW_CAPPED);
        }

        int gross = validWork.stream().mapToInt(BookingPair::duration).sum();
        BreakDeductionResult breakResult = breakDeductionService.deduct(validWork, breaks, gross, plan.getBreakRules());
        warnings.addAll(breakResult.warnings());

        int uncappedNet = breakResult.netMinutes(gross);
        int net = uncappedNet;
        if (plan.getMaxNetWorkTime() != null && uncappedNet > plan.getMaxNetWorkTime()) {
            net = plan.getMaxNetWorkTime();
            warnings.add(DayWarningCode.NET_TIME_CAPPED);
        }
        if (plan.getMinNetWorkTime() != null && net < plan.getMinNetWorkTime()) {
            errors.add(DayErrorCode.BELOW_MIN_WORK_TIME);
        }

        int target = plan.getTargetMinutes();
        List<BookingPair> pairs = new ArrayList<>(work);
        pairs.addAll(breaks);
        pairs.sort(Comparator.comparing(BookingPair::kind)
                .thenComparingInt(BookingPair::start)
                .thenComparingInt(BookingPair::end));

        // primera entrada y última salida antes del recorte, para que el detector vea la marcación real
        DailyResult result = DailyResult.empty(input, DayType.WORKDAY).toBuilder()
                .effectivePlanCode(plan.getCode())
                .grossMinutes(gross)
                .netMinutes(net)
                .targetMinutes(target)
                .overtimeMinutes(Math.max(0, net - target))
                .undertimeMinutes(Math.max(0, target - net))
                .breakMinutes(breakResult.deductedMinutes())
                .paidBreakMinutes(breakResult.paidMinutes())
                .windowCappedMinutes(capping.cappedMinutes())
                .cappedMinutes(capping.cappedMinutes() + uncappedNet - net)
                .firstCome(normalized.stream().map(BookingPair::start).min(Integer::compare).orElse(null))
                .lastGo(normalized.stream().map(BookingPair::end).max(Integer::compare).orElse(null))
                .pairs(List.copyOf(pairs))
                .errors(CodeSets.copyOf(DayErrorCode.class, errors))
                .warnings(CodeSets.copyOf(DayWarningCode.class, warnings))
                .build();

        log.debug("Día {} empleado {} plan {}: bruto={} pausa={} neto={} objetivo={} recortado={}",
                input.getDate(), input.getEmployeeId(), plan.getCode(), gross, result.getBreakMinutes(), net, target,
                result.getCappedMinutes());
        return errorDetectionService.annotate(result, input, plan);
    }

    private int absenceCredit(int target, BigDecimal fraction) {
        return BigDecimal.valueOf(target)
                .multiply(fraction)
                .setScale(0, RoundingMode.HALF_UP)
                .intValueExact();
    }

    private Integer earliest(Integer raw, Stream<Integer> carried) {
        return Stream.concat(Stream.ofNullable(raw), carried).min(Integer::compare).orElse(null);
    }

    private Integer latest(Integer raw, Stream<Integer> carried) {
        return Stream.concat(Stream.ofNullable(raw), carried).max(Integer::compare).orElse(null);
    }

    private Integer clock(Integer minutes) {
        return minutes != null ? TimeService.toClock(minutes) : null;
    }

    private Integer rawFirst(List<BookingEvent> bookings, BookingCategory category) {
        return bookings.stream().filter(b -> b.category() == category)
                .map(BookingEvent::effectiveTime).min(Integer::compare).orElse(null);
    }

    private Integer rawLast(List<BookingEvent> bookings, BookingCategory category) {
        return bookings.stream().filter(b -> b.category() == category)
                .map(BookingEvent::effectiveTime).max(Integer::compare).orElse(null);
    }
}
