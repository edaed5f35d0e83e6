package sp.sistemaspalacios.chronos_calc;

import sp.sistemaspalacios.chronos_calc.config.CalculationProperties;
import sp.sistemaspalacios.chronos_calc.dto.booking.BookingCategory;
import sp.sistemaspalacios.chronos_calc.dto.booking.BookingEvent;
import sp.sistemaspalacios.chronos_calc.dto.daily.DailyInput;
import sp.sistemaspalacios.chronos_calc.dto.schedule.ScheduleConfig;
import sp.sistemaspalacios.chronos_calc.service.booking.BookingPairingService;
import sp.sistemaspalacios.chronos_calc.service.breakDeduction.BreakDeductionService;
import sp.sistemaspalacios.chronos_calc.service.common.TimeService;
import sp.sistemaspalacios.chronos_calc.service.common.WorkingTimeCalculatorService;
import sp.sistemaspalacios.chronos_calc.service.dailyCalculation.DailyCalculationService;
import sp.sistemaspalacios.chronos_calc.service.dayAnalysis.DayErrorDetectionService;
import sp.sistemaspalacios.chronos_calc.service.dayChange.DayChangeService;
import sp.sistemaspalacios.chronos_calc.service.normalization.TimeNormalizationService;
import sp.sistemaspalacios.chronos_calc.service.shift.ShiftDetectionService;

import java.time.LocalDate;
import java.util.List;

/**
 * Builders shared by the unit tests.
 */
public final class Fixtures {

    public static final Long EMPLOYEE = 42L;
    public static final LocalDate DAY = LocalDate.of(2024, 3, 12);

    private Fixtures() {
    }

    public static BookingEvent come(String id, int time) {
        return BookingEvent.of(id, BookingCategory.COME, time);
    }

    public static BookingEvent go(String id, int time) {
        return BookingEvent.of(id, BookingCategory.GO, time);
    }

    public static BookingEvent breakStart(String id, int time) {
        return BookingEvent.of(id, BookingCategory.BREAK_START, time);
    }

    public static BookingEvent breakEnd(String id, int time) {
        return BookingEvent.of(id, BookingCategory.BREAK_END, time);
    }

    public static ScheduleConfig.ScheduleConfigBuilder plan(int targetMinutes) {
        return ScheduleConfig.builder().code("P" + targetMinutes).name("Plan").targetMinutes(targetMinutes);
    }

    public static DailyInput.DailyInputBuilder day(ScheduleConfig schedule, BookingEvent... bookings) {
        return DailyInput.builder()
                .employeeId(EMPLOYEE)
                .date(DAY)
                .schedule(schedule)
                .bookings(List.of(bookings));
    }

    public static CalculationProperties properties() {
        return new CalculationProperties();
    }

    public static ShiftDetectionService shiftDetectionService() {
        return new ShiftDetectionService(properties(), new TimeService());
    }

    public static DayErrorDetectionService errorDetectionService() {
        return new DayErrorDetectionService(properties());
    }

    public static DailyCalculationService dailyCalculationService() {
        return new DailyCalculationService(
                new BookingPairingService(),
                new TimeNormalizationService(),
                new BreakDeductionService(new WorkingTimeCalculatorService()),
                shiftDetectionService(),
                errorDetectionService(),
                new DayChangeService());
    }
}
