package sp.sistemaspalacios.chronos_calc.service.common;

import org.springframework.stereotype.Service;
import sp.sistemaspalacios.chronos_calc.dto.booking.BookingPair;

import java.util.List;

/**
 * Aritmética de intervalos en minutos del día. Los intervalos no cruzan la medianoche: uno con
 * {@code end <= start} está vacío.
 */
@Service
public class WorkingTimeCalculatorService {

    public record Interval(int start, int end) {

        public int duration() {
            return Math.max(0, end - start);
        }

        public boolean isEmpty() {
            return end <= start;
        }
    }

    public Interval of(BookingPair pair) {
        return new Interval(pair.start(), pair.end());
    }

    /** Minutos comunes a {@code [aStart, aEnd)} y {@code [bStart, bEnd)}. */
    public int overlap(int aStart, int aEnd, int bStart, int bEnd) {
        int s = Math.max(aStart, bStart);
        int e = Math.min(aEnd, bEnd);
        return Math.max(0, e - s);
    }

    /** Suma del solape de cada intervalo con la franja. */
    public int overlapWithWindow(List<Interval> intervals, int from, int to) {
        int total = 0;
        for (Interval i : intervals) {
            total += overlap(i.start(), i.end(), from, to);
        }
        return total;
    }
}
