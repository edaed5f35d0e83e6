package sp.sistemaspalacios.chronos_calc.dto.schedule;

/**
 * Márgenes en minutos alrededor de las horas esperadas de entrada y salida.
 */
public record Tolerance(int comePlus, int comeMinus, int goPlus, int goMinus) {

    public static final Tolerance NONE = new Tolerance(0, 0, 0, 0);
}
