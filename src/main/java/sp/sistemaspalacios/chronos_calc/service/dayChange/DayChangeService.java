package sp.sistemaspalacios.chronos_calc.service.dayChange;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.chronos_calc.dto.booking.BookingCategory;
import sp.sistemaspalacios.chronos_calc.dto.booking.BookingEvent;
import sp.sistemaspalacios.chronos_calc.dto.booking.BookingPair;
import sp.sistemaspalacios.chronos_calc.dto.booking.PairKind;
import sp.sistemaspalacios.chronos_calc.dto.daily.DailyInput;
import sp.sistemaspalacios.chronos_calc.dto.schedule.DayChangeBehavior;
import sp.sistemaspalacios.chronos_calc.dto.schedule.ScheduleConfig;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static sp.sistemaspalacios.chronos_calc.service.common.TimeService.MINUTES_PER_DAY;

/**
 * Reparte los turnos que cruzan la medianoche según el cambio de día del plan.
 * <p>
 * Empareja entradas y salidas de ayer, hoy y mañana en una sola línea de tiempo
 * ({@code desplazamiento * 1440 + hora}), por orden de llegada. Cada entrada toma la primera
 * salida libre posterior a menos de un día. Sólo los pares que cruzan la medianoche cambian algo:
 * <ul>
 *     <li>{@code AT_ARRIVAL}: el turno entero cuenta el día de la entrada.</li>
 *     <li>{@code AT_DEPARTURE}: el turno entero cuenta el día de la salida.</li>
 *     <li>{@code AUTO_COMPLETE}: el turno se corta a las 24:00 y cada día cuenta su parte.</li>
 * </ul>
 * Las marcaciones movidas salen de la lista del día; el tramo que le toca al día vuelve como un par
 * ya formado, con horas fuera de {@code [0,1440]} cuando viene del día vecino.
 */
@Slf4j
@Service
public class DayChangeService {

    /** Marcaciones que quedan para el emparejado normal y pares de trabajo ya resueltos. */
    public record DayChangeResolution(List<BookingEvent> bookings, List<BookingPair> carriedPairs) {

        public DayChangeResolution {
            bookings = List.copyOf(bookings);
            carriedPairs = List.copyOf(carriedPairs);
        }

        public static DayChangeResolution unchanged(List<BookingEvent> bookings) {
            return new DayChangeResolution(bookings, List.of());
        }
    }

    private record Stamp(BookingEvent event, int offset) {

        int absolute() {
            return offset * MINUTES_PER_DAY + event.effectiveTime();
        }
    }

    private static final Comparator<Stamp> TIMELINE = Comparator
            .comparingInt(Stamp::absolute)
            .thenComparing(s -> s.event().id());

    public DayChangeResolution resolve(DailyInput input, ScheduleConfig plan) {
        DayChangeBehavior behavior = plan != null ? plan.effectiveDayChange() : DayChangeBehavior.NONE;
        if (behavior == DayChangeBehavior.NONE) {
            return DayChangeResolution.unchanged(input.getBookings());
        }

        Set<String> removed = new HashSet<>();
        List<BookingPair> carried = new ArrayList<>();
        for (Stamp[] pair : crossingPairs(input)) {
            Stamp come = pair[0];
            Stamp go = pair[1];
            boolean leavesToday = come.offset() == 0;
            int comeTime = come.event().effectiveTime();
            int goTime = go.event().effectiveTime();

            switch (behavior) {
                case AT_ARRIVAL -> {
                    if (leavesToday) {
                        removed.add(come.event().id());
                        carried.add(work(come, go, comeTime, goTime + MINUTES_PER_DAY));
                    } else {
                        removed.add(go.event().id());
                    }
                }
                case AT_DEPARTURE -> {
                    if (leavesToday) {
                        removed.add(come.event().id());
                    } else {
                        removed.add(go.event().id());
                        carried.add(work(come, go, comeTime - MINUTES_PER_DAY, goTime));
                    }
                }
                case AUTO_COMPLETE -> {
                    if (leavesToday) {
                        removed.add(come.event().id());
                        carried.add(work(come, go, comeTime, MINUTES_PER_DAY));
                    } else {
                        removed.add(go.event().id());
                        carried.add(work(come, go, 0, goTime));
                    }
                }
                default -> throw new IllegalStateException("Unexpected day change behavior: " + behavior);
            }
        }

        if (!carried.isEmpty() || !removed.isEmpty()) {
            log.debug("Cambio de día {} el {} para empleado {}: {} marcaciones movidas, {} tramos resueltos",
                    behavior, input.getDate(), input.getEmployeeId(), removed.size(), carried.size());
        }
        List<BookingEvent> remaining = input.getBookings().stream()
                .filter(b -> !removed.contains(b.id()))
                .toList();
        return new DayChangeResolution(remaining, carried);
    }

    /** Pares entrada/salida que tocan hoy y cruzan una medianoche. */
    private List<Stamp[]> crossingPairs(DailyInput input) {
        List<Stamp> comes = new ArrayList<>();
        List<Stamp> goes = new ArrayList<>();
        collect(input.getPreviousDayBookings(), -1, comes, goes);
        collect(input.getBookings(), 0, comes, goes);
        collect(input.getNextDayBookings(), 1, comes, goes);
        comes.sort(TIMELINE);
        goes.sort(TIMELINE);

        List<Stamp[]> crossing = new ArrayList<>();
        boolean[] used = new boolean[goes.size()];
        for (Stamp come : comes) {
            for (int i = 0; i < goes.size(); i++) {
                Stamp go = goes.get(i);
                if (used[i] || go.absolute() <= come.absolute()) {
                    continue;
                }
                if (go.absolute() - come.absolute() < MINUTES_PER_DAY) {
                    used[i] = true;
                    if (go.offset() - come.offset() == 1 && (come.offset() == 0 || go.offset() == 0)) {
                        crossing.add(new Stamp[]{come, go});
                    }
                }
                break;
            }
        }
        return crossing;
    }

    private void collect(List<BookingEvent> events, int offset, List<Stamp> comes, List<Stamp> goes) {
        if (events == null) {
            return;
        }
        for (BookingEvent event : events) {
            if (event.category() == BookingCategory.COME) {
                comes.add(new Stamp(event, offset));
            } else if (event.category() == BookingCategory.GO) {
                goes.add(new Stamp(event, offset));
            }
        }
    }

    private BookingPair work(Stamp come, Stamp go, int start, int end) {
        return new BookingPair(come.event().id(), go.event().id(), PairKind.WORK, start, end);
    }
}
