package sp.sistemaspalacios.chronos_calc.dto.booking;

/**
 * Par inicio/fin emparejado. La duración puede quedar negativa tras normalizar; el análisis del día
 * lo reporta como error, aquí nunca se corrige.
 */
public record BookingPair(String startEventId, String endEventId, PairKind kind, int start, int end) {

    public int duration() {
        return end - start;
    }

    public boolean isWork() {
        return kind == PairKind.WORK;
    }

    public BookingPair withBounds(int newStart, int newEnd) {
        return new BookingPair(startEventId, endEventId, kind, newStart, newEnd);
    }
}
