package sp.sistemaspalacios.chronos_calc.exception;

/**
 * Se intentó escribir en un mes o en un año de cuenta congelados.
 */
public class PeriodClosedException extends RuntimeException {

    public PeriodClosedException(String message) {
        super(message);
    }
}
