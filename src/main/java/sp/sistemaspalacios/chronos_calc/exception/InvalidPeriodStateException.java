package sp.sistemaspalacios.chronos_calc.exception;

/**
 * Transición de cierre/reapertura inválida, p. ej. reabrir un mes que nunca se cerró.
 */
public class InvalidPeriodStateException extends IllegalStateException {

    public InvalidPeriodStateException(String message) {
        super(message);
    }
}
