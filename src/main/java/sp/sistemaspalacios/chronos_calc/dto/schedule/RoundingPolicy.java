package sp.sistemaspalacios.chronos_calc.dto.schedule;

/**
 * Redondeo de un sentido de marcación. {@code offset} son minutos con signo que se suman después
 * de redondear (negativo resta).
 */
public record RoundingPolicy(RoundingDirection direction, int interval, int offset) {

    public static final RoundingPolicy NONE = new RoundingPolicy(RoundingDirection.NONE, 0, 0);

    public RoundingPolicy {
        if (direction == null) {
            direction = RoundingDirection.NONE;
        }
    }

    public static RoundingPolicy of(RoundingDirection direction, int interval) {
        return new RoundingPolicy(direction, interval, 0);
    }
}
