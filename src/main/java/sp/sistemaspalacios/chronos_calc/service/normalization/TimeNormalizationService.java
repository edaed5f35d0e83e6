package sp.sistemaspalacios.chronos_calc.service.normalization;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.chronos_calc.dto.booking.BookingPair;
import sp.sistemaspalacios.chronos_calc.dto.schedule.RoundingDirection;
import sp.sistemaspalacios.chronos_calc.dto.schedule.RoundingPolicy;
import sp.sistemaspalacios.chronos_calc.dto.schedule.ScheduleConfig;
import sp.sistemaspalacios.chronos_calc.dto.schedule.Tolerance;
import sp.sistemaspalacios.chronos_calc.service.common.TimeService;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ajusta los límites de los pares de trabajo: primero tolerancia, después redondeo y, por último,
 * el recorte a la ventana de evaluación del plan.
 * <p>
 * La tolerancia sólo toca la primera entrada y la última salida del día. El redondeo toca esos
 * mismos dos límites salvo que el plan redondee todas las marcaciones. Nunca modifica los pares de
 * entrada; siempre devuelve una lista nueva.
 */
@Slf4j
@Service
public class TimeNormalizationService {

    /** Pares recortados y minutos descartados fuera de la ventana. */
    public record WindowCapping(List<BookingPair> pairs, int cappedMinutes) {

        public WindowCapping {
            pairs = List.copyOf(pairs);
        }
    }

    public List<BookingPair> normalize(List<BookingPair> workPairs, ScheduleConfig schedule) {
        if (workPairs.isEmpty() || schedule == null) {
            return List.copyOf(workPairs);
        }

        List<BookingPair> sorted = new ArrayList<>(workPairs);
        sorted.sort(Comparator.comparingInt(BookingPair::start).thenComparingInt(BookingPair::end));

        int firstIdx = 0;
        int lastIdx = indexOfLastGo(sorted);
        Tolerance tolerance = schedule.effectiveTolerance();

        List<BookingPair> out = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            BookingPair p = sorted.get(i);
            int start = p.start();
            int end = p.end();

            if (i == firstIdx) {
                start = applyComeTolerance(start, onSameDay(schedule.getComeFrom(), start), tolerance);
            }
            if (i == lastIdx) {
                end = applyGoTolerance(end, onSameDay(schedule.expectedGo(), end), tolerance);
            }
            if (schedule.isRoundAllBookings() || i == firstIdx) {
                start = round(start, schedule.getRoundingCome());
            }
            if (schedule.isRoundAllBookings() || i == lastIdx) {
                end = round(end, schedule.getRoundingGo());
            }

            if (start != p.start() || end != p.end()) {
                log.debug("Par normalizado {}->{}: [{},{}] -> [{},{}]",
                        p.startEventId(), p.endEventId(), p.start(), p.end(), start, end);
            }
            out.add(p.withBounds(start, end));
        }
        return List.copyOf(out);
    }

    /**
     * Recorta cada par de trabajo a la ventana de evaluación {@code [come_from, go_to + go_plus]}.
     * En planes flextime la ventana empieza {@code come_minus} antes. Los pares negativos se
     * devuelven tal cual; un par fuera de la ventana queda en duración cero. Las ventanas de planes
     * nocturnos no se recortan.
     */
    public WindowCapping capToEvaluationWindow(List<BookingPair> workPairs, ScheduleConfig schedule) {
        if (schedule == null || schedule.crossesMidnight()
                || (schedule.getComeFrom() == null && schedule.getGoTo() == null)) {
            return new WindowCapping(workPairs, 0);
        }
        Tolerance tolerance = schedule.effectiveTolerance();
        Integer windowStart = schedule.getComeFrom() == null ? null
                : schedule.getComeFrom() - (schedule.isFlextime() ? tolerance.comeMinus() : 0);
        Integer windowEnd = schedule.getGoTo() == null ? null : schedule.getGoTo() + tolerance.goPlus();

        List<BookingPair> out = new ArrayList<>(workPairs.size());
        int capped = 0;
        for (BookingPair p : workPairs) {
            if (p.duration() < 0) {
                out.add(p);
                continue;
            }
            int start = p.start();
            int end = p.end();
            if (windowStart != null) {
                start = Math.max(start, windowStart);
                end = Math.max(end, windowStart);
            }
            if (windowEnd != null) {
                start = Math.min(start, windowEnd);
                end = Math.min(end, windowEnd);
            }
            capped += p.duration() - (end - start);
            out.add(p.withBounds(start, end));
        }

        if (capped > 0) {
            log.debug("Recortados {} minutos fuera de la ventana [{},{}] del plan {}",
                    capped, windowStart, windowEnd, schedule.getCode());
        }
        return new WindowCapping(out, capped);
    }

    /** Ajusta a {@code comeFrom} una entrada dentro de {@code [comeFrom - comeMinus, comeFrom + comePlus]}. */
    public int applyComeTolerance(int time, Integer comeFrom, Tolerance tolerance) {
        if (comeFrom == null) {
            return time;
        }
        Tolerance t = tolerance != null ? tolerance : Tolerance.NONE;
        if (time >= comeFrom - t.comeMinus() && time <= comeFrom + t.comePlus()) {
            return comeFrom;
        }
        return time;
    }

    /** Ajusta a la salida esperada una salida dentro de {@code [expected - goMinus, expected + goPlus]}. */
    public int applyGoTolerance(int time, Integer expectedGo, Tolerance tolerance) {
        if (expectedGo == null) {
            return time;
        }
        Tolerance t = tolerance != null ? tolerance : Tolerance.NONE;
        if (time >= expectedGo - t.goMinus() && time <= expectedGo + t.goPlus()) {
            return expectedGo;
        }
        return time;
    }

    /**
     * Redondea y luego suma el desplazamiento de la política; el resultado queda dentro del día.
     * <p>
     * Sin desplazamiento es idempotente. Con desplazamiento sólo lo es cuando la rejilla lo absorbe
     * (por ejemplo DOWN con {@code 0 < offset < interval}); en otro caso redondear dos veces vuelve a
     * sumar el desplazamiento. Por eso cada límite se redondea una sola vez en {@link #normalize}.
     */
    public int round(int time, RoundingPolicy policy) {
        if (policy == null) {
            return time;
        }
        int rounded = applyRounding(time, policy.direction(), policy.interval());
        if (policy.offset() != 0) {
            // límites de turnos trasladados de otro día quedan fuera de [0,1440] y no se acotan
            rounded = TimeService.isBound(time) ? TimeService.clampToDay(rounded + policy.offset()) : rounded + policy.offset();
        }
        return rounded;
    }

    /**
     * Redondea {@code time} a un múltiplo de {@code interval}. NEAREST sube cuando
     * {@code resto >= interval / 2}. Un intervalo no positivo o {@code NONE} no cambia nada.
     */
    public static int applyRounding(int time, RoundingDirection direction, int interval) {
        if (direction == null || direction == RoundingDirection.NONE || interval <= 0) {
            return time;
        }
        int remainder = Math.floorMod(time, interval);
        if (remainder == 0) {
            return time;
        }
        return switch (direction) {
            case UP -> time - remainder + interval;
            case DOWN -> time - remainder;
            case NEAREST -> remainder * 2 >= interval ? time - remainder + interval : time - remainder;
            case NONE -> time;
        };
    }

    /** Lleva la hora del plan al mismo día que un límite trasladado desde el día vecino. */
    private Integer onSameDay(Integer planTime, int bound) {
        if (planTime == null || TimeService.isBound(bound)) {
            return planTime;
        }
        return bound < 0 ? planTime - TimeService.MINUTES_PER_DAY : planTime + TimeService.MINUTES_PER_DAY;
    }

    private int indexOfLastGo(List<BookingPair> sorted) {
        int idx = 0;
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).end() >= sorted.get(idx).end()) {
                idx = i;
            }
        }
        return idx;
    }
}
