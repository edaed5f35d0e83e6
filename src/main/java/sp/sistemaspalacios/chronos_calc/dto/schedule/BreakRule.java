package sp.sistemaspalacios.chronos_calc.dto.schedule;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BreakRule {

    private BreakKind kind;

    // franja de las reglas FIXED, minutos desde medianoche
    private Integer startTime;
    private Integer endTime;

    private int duration;

    // umbral de las reglas MINIMUM
    private Integer afterWorkMinutes;

    private boolean autoDeduct;
    private boolean paid;

    /** Sólo MINIMUM: descuenta los minutos trabajados por encima del umbral, hasta la duración. */
    private boolean proportional;

    public static BreakRule fixed(int start, int end, int duration) {
        return BreakRule.builder().kind(BreakKind.FIXED).startTime(start).endTime(end).duration(duration).build();
    }

    public static BreakRule variable(int duration, boolean autoDeduct) {
        return BreakRule.builder().kind(BreakKind.VARIABLE).duration(duration).autoDeduct(autoDeduct).build();
    }

    public static BreakRule minimum(int afterWorkMinutes, int duration) {
        return BreakRule.builder().kind(BreakKind.MINIMUM).afterWorkMinutes(afterWorkMinutes)
                .duration(duration).autoDeduct(true).build();
    }
}
