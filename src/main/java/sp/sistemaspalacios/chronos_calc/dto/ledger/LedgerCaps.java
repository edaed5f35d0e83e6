package sp.sistemaspalacios.chronos_calc.dto.ledger;

import java.math.BigDecimal;

/**
 * Límites aplicados a un saldo al cerrar el año. Todos los valores son magnitudes positivas y
 * {@code null} desactiva el límite.
 *
 * @param positiveCap saldo máximo que pasa al año siguiente
 * @param negativeCap saldo negativo máximo que pasa al año siguiente
 * @param annualFloor piso de fin de año para flextime, aplicado después de los topes
 */
public record LedgerCaps(BigDecimal positiveCap, BigDecimal negativeCap, BigDecimal annualFloor) {

    public static final LedgerCaps NONE = new LedgerCaps(null, null, null);

    public static LedgerCaps ofMinutes(Integer positive, Integer negative, Integer floor) {
        return new LedgerCaps(toDecimal(positive), toDecimal(negative), toDecimal(floor));
    }

    private static BigDecimal toDecimal(Integer v) {
        return v == null ? null : BigDecimal.valueOf(v);
    }
}
