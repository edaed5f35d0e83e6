package sp.sistemaspalacios.chronos_calc.dto.daily;

/**
 * Festivo que cae en el día calculado. Categoría 1 es festivo completo, 2 medio festivo y 3 festivo
 * sin abono.
 */
public record HolidayFact(int category, String name, int priority) {

    public HolidayFact {
        if (category < 1 || category > 3) {
            throw new IllegalArgumentException("Holiday category must be 1, 2 or 3: " + category);
        }
    }

    public static HolidayFact of(int category) {
        return new HolidayFact(category, null, 0);
    }
}
