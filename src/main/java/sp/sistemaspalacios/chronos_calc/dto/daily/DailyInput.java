package sp.sistemaspalacios.chronos_calc.dto.daily;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import sp.sistemaspalacios.chronos_calc.dto.booking.BookingEvent;
import sp.sistemaspalacios.chronos_calc.dto.schedule.ScheduleConfig;

import java.time.LocalDate;
import java.util.List;

/**
 * Todo lo que necesita el cálculo diario para un (empleado, fecha). Un plan {@code null} marca un
 * día libre.
 */
@Value
@Builder(toBuilder = true)
public class DailyInput {
    Long employeeId;
    LocalDate date;
    ScheduleConfig schedule;
    @Singular
    List<BookingEvent> bookings;
    /** Marcaciones de los días vecinos; sólo se leen cuando el plan tiene cambio de día. */
    @Builder.Default
    List<BookingEvent> previousDayBookings = List.of();
    @Builder.Default
    List<BookingEvent> nextDayBookings = List.of();
    AbsenceFact absence;
    HolidayFact holiday;

    public boolean isOffDay() {
        return schedule == null;
    }

    public boolean isHoliday() {
        return holiday != null;
    }

    public boolean hasAbsence() {
        return absence != null;
    }
}
