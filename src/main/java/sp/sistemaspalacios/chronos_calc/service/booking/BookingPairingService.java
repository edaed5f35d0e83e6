package sp.sistemaspalacios.chronos_calc.service.booking;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.chronos_calc.dto.booking.BookingCategory;
import sp.sistemaspalacios.chronos_calc.dto.booking.BookingEvent;
import sp.sistemaspalacios.chronos_calc.dto.booking.BookingPair;
import sp.sistemaspalacios.chronos_calc.dto.booking.PairKind;
import sp.sistemaspalacios.chronos_calc.dto.booking.PairingResult;
import sp.sistemaspalacios.chronos_calc.dto.daily.DayErrorCode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Empareja las marcaciones de un día en intervalos de trabajo y de pausa.
 * <p>
 * Cada categoría se ordena por hora efectiva (el id desempata) y cada inicio toma el primer fin
 * libre estrictamente posterior. El orden hace que el resultado no dependa del orden de llegada.
 */
@Slf4j
@Service
public class BookingPairingService {

    static final Comparator<BookingEvent> BY_TIME = Comparator
            .comparingInt(BookingEvent::effectiveTime)
            .thenComparing(BookingEvent::id);

    static final Comparator<BookingPair> PAIR_ORDER = Comparator
            .comparing(BookingPair::kind)
            .thenComparingInt(BookingPair::start)
            .thenComparingInt(BookingPair::end)
            .thenComparing(BookingPair::startEventId);

    public PairingResult pair(List<BookingEvent> events) {
        List<BookingPair> pairs = new ArrayList<>();
        Set<DayErrorCode> errors = EnumSet.noneOf(DayErrorCode.class);
        List<String> unpaired = new ArrayList<>();

        pairCategory(events, BookingCategory.COME, BookingCategory.GO,
                DayErrorCode.MISSING_GO, DayErrorCode.MISSING_COME, pairs, errors, unpaired);
        pairCategory(events, BookingCategory.BREAK_START, BookingCategory.BREAK_END,
                DayErrorCode.MISSING_BREAK_END, DayErrorCode.MISSING_BREAK_START, pairs, errors, unpaired);

        pairs.sort(PAIR_ORDER);
        unpaired.sort(Comparator.naturalOrder());

        log.debug("Emparejadas {} marcaciones en {} pares, errores={}", events.size(), pairs.size(), errors);
        return new PairingResult(pairs, errors, unpaired);
    }

    private void pairCategory(List<BookingEvent> events,
                              BookingCategory startCategory,
                              BookingCategory endCategory,
                              DayErrorCode missingEnd,
                              DayErrorCode missingStart,
                              List<BookingPair> pairs,
                              Set<DayErrorCode> errors,
                              List<String> unpaired) {

        List<BookingEvent> starts = byCategory(events, startCategory);
        List<BookingEvent> ends = byCategory(events, endCategory);
        PairKind kind = startCategory.getPairKind();
        boolean[] used = new boolean[ends.size()];

        for (BookingEvent start : starts) {
            int match = -1;
            for (int i = 0; i < ends.size(); i++) {
                if (!used[i] && ends.get(i).effectiveTime() > start.effectiveTime()) {
                    match = i;
                    break;
                }
            }
            if (match < 0) {
                errors.add(missingEnd);
                unpaired.add(start.id());
                continue;
            }
            used[match] = true;
            BookingEvent end = ends.get(match);
            pairs.add(new BookingPair(start.id(), end.id(), kind, start.effectiveTime(), end.effectiveTime()));
        }

        for (int i = 0; i < ends.size(); i++) {
            if (!used[i]) {
                errors.add(missingStart);
                unpaired.add(ends.get(i).id());
            }
        }
    }

    private List<BookingEvent> byCategory(List<BookingEvent> events, BookingCategory category) {
        return events.stream()
                .filter(e -> e.category() == category)
                .sorted(BY_TIME)
                .toList();
    }
}
