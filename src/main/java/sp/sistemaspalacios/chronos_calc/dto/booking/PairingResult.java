package sp.sistemaspalacios.chronos_calc.dto.booking;

import sp.sistemaspalacios.chronos_calc.dto.daily.CodeSets;
import sp.sistemaspalacios.chronos_calc.dto.daily.DayErrorCode;

import java.util.List;
import java.util.Set;

public record PairingResult(List<BookingPair> pairs, Set<DayErrorCode> errors, List<String> unpairedEventIds) {

    public PairingResult {
        pairs = List.copyOf(pairs);
        errors = CodeSets.copyOf(DayErrorCode.class, errors);
        unpairedEventIds = List.copyOf(unpairedEventIds);
    }

    public List<BookingPair> workPairs() {
        return pairs.stream().filter(BookingPair::isWork).toList();
    }

    public List<BookingPair> breakPairs() {
        return pairs.stream().filter(p -> p.kind() == PairKind.BREAK).toList();
    }
}
