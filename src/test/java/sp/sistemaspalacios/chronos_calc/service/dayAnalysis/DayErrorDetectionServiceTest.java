package sp.sistemaspalacios.chronos_calc.service.dayAnalysis;

import org.junit.jupiter.api.Test;
import sp.sistemaspalacios.chronos_calc.Fixtures;
import sp.sistemaspalacios.chronos_calc.dto.booking.BookingPair;
import sp.sistemaspalacios.chronos_calc.dto.booking.PairKind;
import sp.sistemaspalacios.chronos_calc.dto.daily.DailyInput;
import sp.sistemaspalacios.chronos_calc.dto.daily.DailyResult;
import sp.sistemaspalacios.chronos_calc.dto.daily.DayErrorCode;
import sp.sistemaspalacios.chronos_calc.dto.daily.DayType;
import sp.sistemaspalacios.chronos_calc.dto.daily.DayWarningCode;
import sp.sistemaspalacios.chronos_calc.dto.schedule.PlanKind;
import sp.sistemaspalacios.chronos_calc.dto.schedule.ScheduleConfig;
import sp.sistemaspalacios.chronos_calc.dto.schedule.Tolerance;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static sp.sistemaspalacios.chronos_calc.Fixtures.*;

class DayErrorDetectionServiceTest {

    private final DayErrorDetectionService service = Fixtures.errorDetectionService();

    private static final ScheduleConfig FIXED = plan(480)
            .comeFrom(480).comeTo(540)
            .goFrom(960).goTo(1020)
            .tolerance(new Tolerance(5, 5, 5, 5))
            .build();

    private static DailyResult workDay(List<BookingPair> pairs) {
        int gross = pairs.stream().filter(BookingPair::isWork).mapToInt(p -> Math.max(0, p.duration())).sum();
        return DailyResult.builder()
                .employeeId(EMPLOYEE)
                .date(DAY)
                .dayType(DayType.WORKDAY)
                .grossMinutes(gross)
                .netMinutes(gross)
                .firstCome(pairs.stream().filter(BookingPair::isWork).mapToInt(BookingPair::start).min().orElse(0))
                .lastGo(pairs.stream().filter(BookingPair::isWork).mapToInt(BookingPair::end).max().orElse(0))
                .pairs(pairs)
                .build();
    }

    private static BookingPair work(int start, int end) {
        return new BookingPair("s" + start, "e" + end, PairKind.WORK, start, end);
    }

    private DailyResult annotate(ScheduleConfig plan, int start, int end) {
        DailyInput input = day(plan, come("c", start), go("g", end)).build();
        return service.annotate(workDay(List.of(work(start, end))), input, plan);
    }

    @Test
    void dayInsideTheWindowsIsClean() {
        DailyResult result = annotate(FIXED, 500, 1000);

        assertTrue(result.getErrors().isEmpty());
        assertTrue(result.getWarnings().isEmpty());
    }

    @Test
    void comingBeforeTheGracePeriodIsAnError() {
        assertTrue(annotate(FIXED, 449, 1000).getErrors().contains(DayErrorCode.CAME_BEFORE_ALLOWED));
        assertFalse(annotate(FIXED, 450, 1000).getErrors().contains(DayErrorCode.CAME_BEFORE_ALLOWED));
    }

    @Test
    void leavingAfterTheGracePeriodIsAnError() {
        assertTrue(annotate(FIXED, 500, 1051).getErrors().contains(DayErrorCode.LEFT_AFTER_ALLOWED));
        assertFalse(annotate(FIXED, 500, 1050).getErrors().contains(DayErrorCode.LEFT_AFTER_ALLOWED));
    }

    @Test
    void lateArrivalIsMeasuredAgainstTheLatestComePlusTolerance() {
        assertTrue(annotate(FIXED, 546, 1000).hasWarning(DayWarningCode.LATE_ARRIVAL));
        assertFalse(annotate(FIXED, 545, 1000).hasWarning(DayWarningCode.LATE_ARRIVAL));
    }

    @Test
    void earlyDepartureIsMeasuredAgainstTheEarliestGoMinusTolerance() {
        assertTrue(annotate(FIXED, 500, 954).hasWarning(DayWarningCode.EARLY_DEPARTURE));
        assertFalse(annotate(FIXED, 500, 955).hasWarning(DayWarningCode.EARLY_DEPARTURE));
    }

    @Test
    void longWorkDayIsFlagged() {
        ScheduleConfig plan = plan(480).build();

        assertTrue(annotate(plan, 360, 961).hasWarning(DayWarningCode.LONG_WORK_DAY));
        assertFalse(annotate(plan, 360, 960).hasWarning(DayWarningCode.LONG_WORK_DAY));
    }

    @Test
    void flextimeMustCoverTheCoreTime() {
        ScheduleConfig flex = plan(480).planKind(PlanKind.FLEXTIME).coreStart(600).coreEnd(840).build();

        assertTrue(annotate(flex, 620, 1000).getErrors().contains(DayErrorCode.MISSED_CORE_TIME));
        assertFalse(annotate(flex, 600, 840).getErrors().contains(DayErrorCode.MISSED_CORE_TIME));
    }

    @Test
    void lunchGapInsideTheCoreTimeIsAllowed() {
        ScheduleConfig flex = plan(480).planKind(PlanKind.FLEXTIME).coreStart(540).coreEnd(900).build();
        List<BookingPair> pairs = List.of(work(480, 720), work(750, 1020));
        DailyInput input = day(flex, come("c1", 480), go("g1", 720), come("c2", 750), go("g2", 1020)).build();

        DailyResult result = service.annotate(workDay(pairs), input, flex);

        assertFalse(result.getErrors().contains(DayErrorCode.MISSED_CORE_TIME));
    }

    @Test
    void splitDayEndingBeforeTheCoreEndIsAnError() {
        ScheduleConfig flex = plan(480).planKind(PlanKind.FLEXTIME).coreStart(540).coreEnd(900).build();
        List<BookingPair> pairs = List.of(work(480, 720), work(750, 880));
        DailyInput input = day(flex, come("c1", 480), go("g1", 720), come("c2", 750), go("g2", 880)).build();

        DailyResult result = service.annotate(workDay(pairs), input, flex);

        assertTrue(result.getErrors().contains(DayErrorCode.MISSED_CORE_TIME));
    }

    @Test
    void coreTimeIsIgnoredOnFixedPlans() {
        ScheduleConfig fixed = plan(480).coreStart(600).coreEnd(840).build();

        assertFalse(annotate(fixed, 620, 1000).getErrors().contains(DayErrorCode.MISSED_CORE_TIME));
    }

    @Test
    void duplicateBookingsAreFlagged() {
        ScheduleConfig plan = plan(480).build();
        DailyInput input = day(plan, come("c1", 480), come("c2", 480), go("g", 960)).build();

        DailyResult result = service.annotate(workDay(List.of(work(480, 960))), input, plan);

        assertTrue(result.getErrors().contains(DayErrorCode.OVERLAPPING_BOOKINGS));
    }

    @Test
    void negativePairIsFlagged() {
        ScheduleConfig plan = plan(480).build();
        DailyInput input = day(plan, come("c", 487), go("g", 490)).build();

        DailyResult result = service.annotate(workDay(List.of(work(495, 480))), input, plan);

        assertTrue(result.getErrors().contains(DayErrorCode.NEGATIVE_DURATION));
    }

    @Test
    void existingCodesAreKept() {
        DailyResult prior = workDay(List.of(work(500, 1000))).toBuilder()
                .errors(Set.of(DayErrorCode.MISSING_BREAK_END))
                .warnings(Set.of(DayWarningCode.MANUAL_BREAK))
                .build();

        DailyResult result = service.annotate(prior, day(FIXED, come("c", 500), go("g", 1000)).build(), FIXED);

        assertTrue(result.getErrors().contains(DayErrorCode.MISSING_BREAK_END));
        assertTrue(result.hasWarning(DayWarningCode.MANUAL_BREAK));
    }

    @Test
    void annotatingTwiceGivesTheSameResult() {
        DailyInput input = day(FIXED, come("c", 440), go("g", 1100)).build();
        DailyResult once = service.annotate(workDay(List.of(work(440, 1100))), input, FIXED);
        DailyResult twice = service.annotate(once, input, FIXED);

        assertEquals(once, twice);
        assertTrue(once.getErrors().containsAll(Set.of(DayErrorCode.CAME_BEFORE_ALLOWED, DayErrorCode.LEFT_AFTER_ALLOWED)));
    }

    @Test
    void nonWorkDaysAreUntouched() {
        DailyResult holiday = DailyResult.builder().employeeId(EMPLOYEE).date(DAY).dayType(DayType.HOLIDAY).build();

        assertSame(holiday, service.annotate(holiday, day(FIXED).build(), FIXED));
    }
}
