package sp.sistemaspalacios.chronos_calc.service.dailyCalculation;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import sp.sistemaspalacios.chronos_calc.Fixtures;
import sp.sistemaspalacios.chronos_calc.dto.booking.BookingEvent;
import sp.sistemaspalacios.chronos_calc.dto.daily.AbsenceCategory;
import sp.sistemaspalacios.chronos_calc.dto.daily.AbsenceFact;
import sp.sistemaspalacios.chronos_calc.dto.daily.DailyInput;
import sp.sistemaspalacios.chronos_calc.dto.daily.DailyResult;
import sp.sistemaspalacios.chronos_calc.dto.daily.DayErrorCode;
import sp.sistemaspalacios.chronos_calc.dto.daily.DayType;
import sp.sistemaspalacios.chronos_calc.dto.daily.DayWarningCode;
import sp.sistemaspalacios.chronos_calc.dto.daily.HolidayFact;
import sp.sistemaspalacios.chronos_calc.dto.schedule.BreakRule;
import sp.sistemaspalacios.chronos_calc.dto.schedule.DayChangeBehavior;
import sp.sistemaspalacios.chronos_calc.dto.schedule.NoBookingPolicy;
import sp.sistemaspalacios.chronos_calc.dto.schedule.PlanKind;
import sp.sistemaspalacios.chronos_calc.dto.schedule.RoundingDirection;
import sp.sistemaspalacios.chronos_calc.dto.schedule.RoundingPolicy;
import sp.sistemaspalacios.chronos_calc.dto.schedule.ScheduleConfig;
import sp.sistemaspalacios.chronos_calc.dto.schedule.Tolerance;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static sp.sistemaspalacios.chronos_calc.Fixtures.*;

class DailyCalculationServiceTest {

    private final DailyCalculationService service = Fixtures.dailyCalculationService();

    private DailyResult calculate(DailyInput input) {
        return service.calculateDay(input).orElseThrow();
    }

    @Nested
    class WorkDays {

        @Test
        void fullDayWithoutBreakRules() {
            DailyResult result = calculate(day(plan(480).build(), come("c", 480), go("g", 1020)).build());

            assertEquals(DayType.WORKDAY, result.getDayType());
            assertEquals(540, result.getGrossMinutes());
            assertEquals(540, result.getNetMinutes());
            assertEquals(60, result.getOvertimeMinutes());
            assertEquals(0, result.getUndertimeMinutes());
            assertEquals(480, result.getFirstCome());
            assertEquals(1020, result.getLastGo());
            assertFalse(result.hasError());
        }

        @Test
        void fixedBreakIsDeducted() {
            ScheduleConfig schedule = plan(480).breakRules(List.of(BreakRule.fixed(720, 750, 30))).build();

            DailyResult result = calculate(day(schedule, come("c", 480), go("g", 1020)).build());

            assertEquals(540, result.getGrossMinutes());
            assertEquals(30, result.getBreakMinutes());
            assertEquals(510, result.getNetMinutes());
            assertEquals(30, result.getOvertimeMinutes());
        }

        @Test
        void onlyComeIsAnError() {
            DailyResult result = calculate(day(plan(480).build(), come("c", 480)).build());

            assertTrue(result.getErrors().contains(DayErrorCode.MISSING_GO));
            assertEquals(0, result.getGrossMinutes());
            assertEquals(480, result.getUndertimeMinutes());
        }

        @Test
        void shortDayProducesUndertime() {
            DailyResult result = calculate(day(plan(480).build(), come("c", 480), go("g", 840)).build());

            assertEquals(360, result.getNetMinutes());
            assertEquals(0, result.getOvertimeMinutes());
            assertEquals(120, result.getUndertimeMinutes());
        }

        @Test
        void splitShiftSumsBothBlocks() {
            DailyResult result = calculate(day(plan(480).build(),
                    come("c1", 420), go("g1", 660), come("c2", 780), go("g2", 1020)).build());

            assertEquals(480, result.getGrossMinutes());
            assertEquals(2, result.getPairs().size());
            assertEquals(420, result.getFirstCome());
            assertEquals(1020, result.getLastGo());
        }

        @Test
        void roundingIsAppliedBeforeTotals() {
            ScheduleConfig schedule = plan(480)
                    .roundingCome(RoundingPolicy.of(RoundingDirection.UP, 15))
                    .roundingGo(RoundingPolicy.of(RoundingDirection.DOWN, 15))
                    .build();

            DailyResult result = calculate(day(schedule, come("c", 487), go("g", 1013)).build());

            assertEquals(495, result.getFirstCome());
            assertEquals(1005, result.getLastGo());
            assertEquals(510, result.getGrossMinutes());
        }

        @Test
        void roundingThatInvertsAPairIsFlaggedAndNotCounted() {
            ScheduleConfig schedule = plan(480)
                    .roundingCome(RoundingPolicy.of(RoundingDirection.UP, 15))
                    .roundingGo(RoundingPolicy.of(RoundingDirection.DOWN, 15))
                    .build();

            DailyResult result = calculate(day(schedule, come("c", 487), go("g", 490)).build());

            assertTrue(result.getErrors().contains(DayErrorCode.NEGATIVE_DURATION));
            assertEquals(0, result.getGrossMinutes());
        }

        @Test
        void maxNetWorkTimeCapsTheDay() {
            ScheduleConfig schedule = plan(480).maxNetWorkTime(600).build();

            DailyResult result = calculate(day(schedule, come("c", 360), go("g", 1080)).build());

            assertEquals(720, result.getGrossMinutes());
            assertEquals(600, result.getNetMinutes());
            assertEquals(120, result.getCappedMinutes());
            assertEquals(120, result.getOvertimeMinutes());
            assertTrue(result.hasWarning(DayWarningCode.NET_TIME_CAPPED));
            assertTrue(result.hasWarning(DayWarningCode.LONG_WORK_DAY));
        }

        @Test
        void belowMinimumNetWorkTimeIsAnError() {
            ScheduleConfig schedule = plan(480).minNetWorkTime(240).build();

            DailyResult result = calculate(day(schedule, come("c", 480), go("g", 600)).build());

            assertTrue(result.getErrors().contains(DayErrorCode.BELOW_MIN_WORK_TIME));
        }

        @Test
        void switchesShiftBeforeApplyingThePlan() {
            ScheduleConfig early = plan(420).code("EARLY").shiftArriveFrom(300).shiftArriveTo(420).build();
            ScheduleConfig assigned = plan(480).code("DAY").shiftArriveFrom(420).shiftArriveTo(600)
                    .alternativePlans(List.of(early)).build();

            DailyResult result = calculate(day(assigned, come("c", 360), go("g", 780)).build());

            assertEquals("EARLY", result.getEffectivePlanCode());
            assertEquals(420, result.getTargetMinutes());
            assertTrue(result.hasWarning(DayWarningCode.SHIFT_SWITCHED));
            assertFalse(result.hasError());
        }

        @Test
        void unmatchedShiftIsAnError() {
            ScheduleConfig assigned = plan(480).code("DAY").shiftArriveFrom(420).shiftArriveTo(600).build();

            DailyResult result = calculate(day(assigned, come("c", 1200), go("g", 1380)).build());

            assertEquals("DAY", result.getEffectivePlanCode());
            assertTrue(result.getErrors().contains(DayErrorCode.NO_MATCHING_SHIFT));
        }

        @Test
        void editedBookingsWinOverOriginalOnes() {
            BookingEvent corrected = come("c", 300).withEditedTime(480);

            DailyResult result = calculate(day(plan(480).build(), corrected, go("g", 960)).build());

            assertEquals(480, result.getNetMinutes());
        }

        @Test
        void netNeverExceedsGross() {
            Random random = new Random(7);
            ScheduleConfig schedule = plan(480)
                    .breakRules(List.of(BreakRule.fixed(720, 750, 30), BreakRule.minimum(360, 45)))
                    .roundingCome(RoundingPolicy.of(RoundingDirection.NEAREST, 10))
                    .roundingGo(RoundingPolicy.of(RoundingDirection.NEAREST, 10))
                    .build();

            for (int i = 0; i < 500; i++) {
                List<BookingEvent> events = new ArrayList<>();
                int n = 1 + random.nextInt(6);
                for (int k = 0; k < n; k++) {
                    int t = random.nextInt(1440);
                    events.add(k % 2 == 0 ? come("c" + k, t) : go("g" + k, t));
                }
                DailyResult result = calculate(day(schedule).bookings(events).build());

                assertTrue(result.getNetMinutes() <= result.getGrossMinutes(), "run " + i);
                assertTrue(result.getGrossMinutes() >= 0, "run " + i);
                assertEquals(result.getNetMinutes() - result.getTargetMinutes(),
                        result.getOvertimeMinutes() - result.getUndertimeMinutes(), "run " + i);
            }
        }
    }

    @Nested
    class EvaluationWindowCapping {

        private final ScheduleConfig windows = plan(480).comeFrom(480).comeTo(540).goFrom(960).goTo(1020).build();

        @Test
        void earlyArrivalOutsideTheWindowIsNotCounted() {
            DailyResult result = calculate(day(windows, come("c", 360), go("g", 1020)).build());

            assertEquals(540, result.getGrossMinutes());
            assertEquals(540, result.getNetMinutes());
            assertEquals(120, result.getCappedMinutes());
            assertEquals(120, result.getWindowCappedMinutes());
            assertEquals(360, result.getFirstCome());
            assertTrue(result.hasWarning(DayWarningCode.OUTSIDE_WINDOW_CAPPED));
            assertFalse(result.hasWarning(DayWarningCode.NET_TIME_CAPPED));
            assertTrue(result.getErrors().contains(DayErrorCode.CAME_BEFORE_ALLOWED));
        }

        @Test
        void flextimeWindowStartsComeMinusBeforeComeFrom() {
            ScheduleConfig flextime = windows.toBuilder()
                    .planKind(PlanKind.FLEXTIME)
                    .tolerance(new Tolerance(0, 60, 0, 0))
                    .build();

            DailyResult result = calculate(day(flextime, come("c", 360), go("g", 1020)).build());

            assertEquals(600, result.getGrossMinutes());
            assertEquals(60, result.getWindowCappedMinutes());
        }

        @Test
        void departureIsCappedAfterGoPlus() {
            ScheduleConfig withGoPlus = windows.toBuilder().tolerance(new Tolerance(0, 0, 30, 0)).build();

            DailyResult result = calculate(day(withGoPlus, come("c", 480), go("g", 1140)).build());

            assertEquals(570, result.getGrossMinutes());
            assertEquals(90, result.getWindowCappedMinutes());
            assertEquals(1140, result.getLastGo());
        }

        @Test
        void windowAndNetCapAddUp() {
            ScheduleConfig capped = windows.toBuilder().maxNetWorkTime(480).build();

            DailyResult result = calculate(day(capped, come("c", 360), go("g", 1020)).build());

            assertEquals(540, result.getGrossMinutes());
            assertEquals(480, result.getNetMinutes());
            assertEquals(180, result.getCappedMinutes());
            assertEquals(120, result.getWindowCappedMinutes());
            assertTrue(result.hasWarning(DayWarningCode.NET_TIME_CAPPED));
        }
    }

    @Nested
    class DayChange {

        private ScheduleConfig nightPlan(DayChangeBehavior behavior) {
            return plan(480).code("NIGHT").comeFrom(1320).goTo(360).dayChangeBehavior(behavior).build();
        }

        private DailyResult arrivalDay(DayChangeBehavior behavior) {
            return calculate(day(nightPlan(behavior), come("c", 1320))
                    .nextDayBookings(List.of(go("g", 360)))
                    .build());
        }

        private DailyResult departureDay(DayChangeBehavior behavior) {
            return calculate(day(nightPlan(behavior), go("g", 360))
                    .previousDayBookings(List.of(come("c", 1320)))
                    .build());
        }

        @Test
        void withoutDayChangeTheShiftIsIncompleteOnBothDays() {
            DailyResult arrival = arrivalDay(DayChangeBehavior.NONE);
            DailyResult departure = departureDay(DayChangeBehavior.NONE);

            assertTrue(arrival.getErrors().contains(DayErrorCode.MISSING_GO));
            assertTrue(departure.getErrors().contains(DayErrorCode.MISSING_COME));
            assertEquals(0, arrival.getGrossMinutes());
        }

        @Test
        void atArrivalCountsTheWholeShiftOnTheArrivalDay() {
            DailyResult arrival = arrivalDay(DayChangeBehavior.AT_ARRIVAL);
            DailyResult departure = departureDay(DayChangeBehavior.AT_ARRIVAL);

            assertEquals(480, arrival.getGrossMinutes());
            assertEquals(1320, arrival.getFirstCome());
            assertEquals(1800, arrival.getLastGo());
            assertFalse(arrival.hasError());

            assertEquals(0, departure.getGrossMinutes());
            assertFalse(departure.hasError());
            assertEquals(480, departure.getUndertimeMinutes());
        }

        @Test
        void atDepartureCountsTheWholeShiftOnTheDepartureDay() {
            DailyResult arrival = arrivalDay(DayChangeBehavior.AT_DEPARTURE);
            DailyResult departure = departureDay(DayChangeBehavior.AT_DEPARTURE);

            assertEquals(0, arrival.getGrossMinutes());
            assertFalse(arrival.hasError());

            assertEquals(480, departure.getGrossMinutes());
            assertEquals(-120, departure.getFirstCome());
            assertEquals(360, departure.getLastGo());
            assertFalse(departure.hasError());
        }

        @Test
        void autoCompleteSplitsTheShiftAtMidnight() {
            DailyResult arrival = arrivalDay(DayChangeBehavior.AUTO_COMPLETE);
            DailyResult departure = departureDay(DayChangeBehavior.AUTO_COMPLETE);

            assertEquals(120, arrival.getGrossMinutes());
            assertEquals(1440, arrival.getLastGo());
            assertFalse(arrival.hasError());

            assertEquals(360, departure.getGrossMinutes());
            assertEquals(0, departure.getFirstCome());
            assertFalse(departure.hasError());
        }

        @Test
        void sameDayShiftsAreNotMoved() {
            ScheduleConfig schedule = plan(480).dayChangeBehavior(DayChangeBehavior.AT_ARRIVAL).build();

            DailyResult result = calculate(day(schedule, come("c", 480), go("g", 1020))
                    .previousDayBookings(List.of(come("pc", 480), go("pg", 1020)))
                    .nextDayBookings(List.of(come("nc", 480), go("ng", 1020)))
                    .build());

            assertEquals(540, result.getGrossMinutes());
            assertFalse(result.hasError());
        }

        @Test
        void forgottenGoIsNotMatchedAFullDayLater() {
            ScheduleConfig schedule = plan(480).dayChangeBehavior(DayChangeBehavior.AT_ARRIVAL).build();

            DailyResult result = calculate(day(schedule, come("c", 480))
                    .nextDayBookings(List.of(come("nc", 480), go("ng", 1020)))
                    .build());

            assertTrue(result.getErrors().contains(DayErrorCode.MISSING_GO));
            assertEquals(0, result.getGrossMinutes());
        }

        @Test
        void dayShiftAndTrailingNightShiftOnTheSameDay() {
            ScheduleConfig schedule = plan(480).dayChangeBehavior(DayChangeBehavior.AUTO_COMPLETE).build();

            DailyResult result = calculate(day(schedule, come("c1", 360), go("g1", 600), come("c2", 1380))
                    .nextDayBookings(List.of(go("g2", 120)))
                    .build());

            assertEquals(300, result.getGrossMinutes());
            assertFalse(result.hasError());
        }
    }

    @Nested
    class Absences {

        @Test
        void fullDayAbsenceCreditsTheTarget() {
            DailyInput input = day(plan(480).build())
                    .absence(AbsenceFact.fullDay("UL", AbsenceCategory.VACATION))
                    .build();

            DailyResult result = calculate(input);

            assertEquals(DayType.ABSENCE, result.getDayType());
            assertEquals(480, result.getNetMinutes());
            assertEquals(0, result.getUndertimeMinutes());
            assertEquals(AbsenceCategory.VACATION, result.getAbsenceCategory());
        }

        @Test
        void halfDayAbsenceCreditsHalfTheTarget() {
            DailyInput input = day(plan(450).build())
                    .absence(AbsenceFact.halfDay("UL", AbsenceCategory.VACATION))
                    .build();

            DailyResult result = calculate(input);

            assertEquals(225, result.getNetMinutes());
            assertEquals(0, new BigDecimal("0.5").compareTo(result.getAbsenceFraction()));
        }

        @Test
        void absenceWithoutCreditCreditsNothing() {
            AbsenceFact unpaid = new AbsenceFact("UU", AbsenceCategory.OTHER, false, BigDecimal.ONE, 0);

            DailyResult result = calculate(day(plan(480).build()).absence(unpaid).build());

            assertEquals(0, result.getNetMinutes());
            assertEquals(480, result.getTargetMinutes());
        }

        @Test
        void absenceWinsOverHolidayOfEqualPriority() {
            DailyInput input = day(plan(480).build())
                    .absence(AbsenceFact.fullDay("KR", AbsenceCategory.SICK))
                    .holiday(HolidayFact.of(1))
                    .build();

            DailyResult result = calculate(input);

            assertEquals(DayType.ABSENCE, result.getDayType());
            assertTrue(result.hasWarning(DayWarningCode.ABSENCE_ON_HOLIDAY));
            assertEquals(1, result.getHolidayCategory());
        }

        @Test
        void holidayWithHigherPriorityWins() {
            DailyInput input = day(plan(480).build())
                    .absence(AbsenceFact.fullDay("KR", AbsenceCategory.SICK))
                    .holiday(new HolidayFact(1, "New Year", 5))
                    .build();

            assertEquals(DayType.HOLIDAY, calculate(input).getDayType());
        }

        @Test
        void absenceIgnoresBookings() {
            DailyInput input = day(plan(480).build(), come("c", 480), go("g", 600))
                    .absence(AbsenceFact.fullDay("UL", AbsenceCategory.VACATION))
                    .build();

            DailyResult result = calculate(input);

            assertEquals(480, result.getNetMinutes());
            assertTrue(result.getPairs().isEmpty());
        }
    }

    @Nested
    class Holidays {

        @ParameterizedTest
        @CsvSource({"1, 480, 0", "2, 240, 240", "3, 0, 480"})
        void creditsByCategory(int category, int credited, int undertime) {
            DailyResult result = calculate(day(plan(480).build()).holiday(HolidayFact.of(category)).build());

            assertEquals(DayType.HOLIDAY, result.getDayType());
            assertEquals(credited, result.getNetMinutes());
            assertEquals(undertime, result.getUndertimeMinutes());
            assertEquals(category, result.getHolidayCategory());
            assertTrue(result.hasWarning(DayWarningCode.HOLIDAY));
        }

        @Test
        void configuredCreditOverridesTheDefault() {
            ScheduleConfig schedule = plan(480).holidayCredits(Map.of(2, 300)).build();

            DailyResult result = calculate(day(schedule).holiday(HolidayFact.of(2)).build());

            assertEquals(300, result.getNetMinutes());
        }

        @Test
        void workOnHolidayIsCalculatedLikeAWorkDay() {
            DailyResult result = calculate(day(plan(480).build(), come("c", 480), go("g", 720))
                    .holiday(HolidayFact.of(1)).build());

            assertEquals(DayType.WORKDAY, result.getDayType());
            assertEquals(240, result.getNetMinutes());
            assertEquals(1, result.getHolidayCategory());
            assertTrue(result.hasWarning(DayWarningCode.WORKED_ON_HOLIDAY));
        }

        @Test
        void holidayOnOffDayCreditsNothing() {
            DailyResult result = calculate(day(null).holiday(HolidayFact.of(1)).build());

            assertEquals(DayType.HOLIDAY, result.getDayType());
            assertEquals(0, result.getNetMinutes());
            assertEquals(0, result.getTargetMinutes());
        }
    }

    @Nested
    class OffDaysAndMissingBookings {

        @Test
        void offDayHasNoTarget() {
            DailyResult result = calculate(day(null).build());

            assertEquals(DayType.OFF_DAY, result.getDayType());
            assertEquals(0, result.getTargetMinutes());
            assertTrue(result.hasWarning(DayWarningCode.OFF_DAY));
            assertFalse(result.hasError());
        }

        @Test
        void bookingsOnOffDayAreOnlyFlagged() {
            DailyResult result = calculate(day(null, come("c", 480), go("g", 600)).build());

            assertEquals(0, result.getNetMinutes());
            assertTrue(result.hasWarning(DayWarningCode.BOOKINGS_ON_OFF_DAY));
        }

        @Test
        void missingBookingsAreAnErrorByDefault() {
            DailyResult result = calculate(day(plan(480).build()).build());

            assertEquals(DayType.NO_BOOKINGS, result.getDayType());
            assertTrue(result.getErrors().contains(DayErrorCode.NO_BOOKINGS));
            assertEquals(480, result.getUndertimeMinutes());
        }

        @Test
        void creditTargetPolicy() {
            ScheduleConfig schedule = plan(480).noBookingPolicy(NoBookingPolicy.CREDIT_TARGET).build();

            DailyResult result = calculate(day(schedule).build());

            assertEquals(480, result.getNetMinutes());
            assertEquals(0, result.getUndertimeMinutes());
            assertTrue(result.hasWarning(DayWarningCode.NO_BOOKINGS_CREDITED));
            assertFalse(result.hasError());
        }

        @Test
        void creditZeroPolicy() {
            ScheduleConfig schedule = plan(480).noBookingPolicy(NoBookingPolicy.CREDIT_ZERO).build();

            DailyResult result = calculate(day(schedule).build());

            assertEquals(0, result.getNetMinutes());
            assertEquals(480, result.getUndertimeMinutes());
            assertTrue(result.hasWarning(DayWarningCode.NO_BOOKINGS_DEDUCTED));
            assertFalse(result.hasError());
        }

        @Test
        void skipPolicyProducesNoResult() {
            ScheduleConfig schedule = plan(480).noBookingPolicy(NoBookingPolicy.SKIP).build();

            Optional<DailyResult> result = service.calculateDay(day(schedule).build());

            assertTrue(result.isEmpty());
        }

        @Test
        void useAbsencePolicyCreditsTheConfiguredAbsence() {
            ScheduleConfig schedule = plan(480)
                    .noBookingPolicy(NoBookingPolicy.USE_ABSENCE)
                    .noBookingAbsence(AbsenceFact.fullDay("BS", AbsenceCategory.OTHER))
                    .build();

            DailyResult result = calculate(day(schedule).build());

            assertEquals(DayType.ABSENCE, result.getDayType());
            assertEquals(480, result.getNetMinutes());
            assertEquals(AbsenceCategory.OTHER, result.getAbsenceCategory());
        }

        @Test
        void useAbsencePolicyWithoutAbsenceFallsBackToError() {
            ScheduleConfig schedule = plan(480).noBookingPolicy(NoBookingPolicy.USE_ABSENCE).build();

            assertTrue(calculate(day(schedule).build()).getErrors().contains(DayErrorCode.NO_BOOKINGS));
        }
    }
}
