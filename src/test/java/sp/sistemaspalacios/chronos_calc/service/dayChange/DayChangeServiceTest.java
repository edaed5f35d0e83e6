package sp.sistemaspalacios.chronos_calc.service.dayChange;

import org.junit.jupiter.api.Test;
import sp.sistemaspalacios.chronos_calc.dto.booking.BookingPair;
import sp.sistemaspalacios.chronos_calc.dto.booking.PairKind;
import sp.sistemaspalacios.chronos_calc.dto.daily.DailyInput;
import sp.sistemaspalacios.chronos_calc.dto.schedule.DayChangeBehavior;
import sp.sistemaspalacios.chronos_calc.dto.schedule.ScheduleConfig;
import sp.sistemaspalacios.chronos_calc.service.dayChange.DayChangeService.DayChangeResolution;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static sp.sistemaspalacios.chronos_calc.Fixtures.*;

class DayChangeServiceTest {

    private final DayChangeService service = new DayChangeService();

    private ScheduleConfig withBehavior(DayChangeBehavior behavior) {
        return plan(480).dayChangeBehavior(behavior).build();
    }

    @Test
    void noneReturnsTheBookingsUntouched() {
        DailyInput input = day(withBehavior(DayChangeBehavior.NONE), come("c", 1320))
                .nextDayBookings(List.of(go("g", 360)))
                .build();

        DayChangeResolution resolution = service.resolve(input, input.getSchedule());

        assertEquals(input.getBookings(), resolution.bookings());
        assertTrue(resolution.carriedPairs().isEmpty());
    }

    @Test
    void atArrivalCarriesTheNextDayGoPastMidnight() {
        DailyInput input = day(withBehavior(DayChangeBehavior.AT_ARRIVAL), come("c", 1320))
                .nextDayBookings(List.of(go("g", 360)))
                .build();

        DayChangeResolution resolution = service.resolve(input, input.getSchedule());

        assertTrue(resolution.bookings().isEmpty());
        assertEquals(List.of(new BookingPair("c", "g", PairKind.WORK, 1320, 1800)), resolution.carriedPairs());
    }

    @Test
    void atDepartureCarriesThePreviousDayComeBeforeMidnight() {
        DailyInput input = day(withBehavior(DayChangeBehavior.AT_DEPARTURE), go("g", 360), come("c2", 480), go("g2", 900))
                .previousDayBookings(List.of(come("c", 1320)))
                .build();

        DayChangeResolution resolution = service.resolve(input, input.getSchedule());

        assertEquals(List.of(come("c2", 480), go("g2", 900)), resolution.bookings());
        assertEquals(List.of(new BookingPair("c", "g", PairKind.WORK, -120, 360)), resolution.carriedPairs());
    }

    @Test
    void autoCompleteCutsBothEndsAtMidnight() {
        DailyInput input = day(withBehavior(DayChangeBehavior.AUTO_COMPLETE), go("g0", 300), come("c1", 1380))
                .previousDayBookings(List.of(come("c0", 1300)))
                .nextDayBookings(List.of(go("g1", 240)))
                .build();

        DayChangeResolution resolution = service.resolve(input, input.getSchedule());

        assertTrue(resolution.bookings().isEmpty());
        assertEquals(List.of(
                new BookingPair("c0", "g0", PairKind.WORK, 0, 300),
                new BookingPair("c1", "g1", PairKind.WORK, 1380, 1440)), resolution.carriedPairs());
    }

    @Test
    void previousDayPairsThatCloseOnThatDayAreIgnored() {
        DailyInput input = day(withBehavior(DayChangeBehavior.AT_DEPARTURE), come("c", 480), go("g", 1020))
                .previousDayBookings(List.of(come("pc", 1200), go("pg", 1400)))
                .build();

        DayChangeResolution resolution = service.resolve(input, input.getSchedule());

        assertEquals(2, resolution.bookings().size());
        assertTrue(resolution.carriedPairs().isEmpty());
    }
}
