package sp.sistemaspalacios.chronos_calc.dto.schedule;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.chronos_calc.dto.daily.AbsenceFact;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Plan diario: la política declarativa de jornada para un día del calendario.
 * <p>
 * Todas las horas son minutos desde medianoche. Cada {@code Integer} nulo significa "sin
 * configurar" y apaga la regla correspondiente.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleConfig {

    public static final int HOLIDAY_FULL = 1;
    public static final int HOLIDAY_HALF = 2;
    public static final int HOLIDAY_NONE = 3;

    private String code;
    private String name;

    @Builder.Default
    private PlanKind planKind = PlanKind.FIXED;

    private int targetMinutes;

    // ventanas de entrada / salida
    private Integer comeFrom;
    private Integer comeTo;
    private Integer goFrom;
    private Integer goTo;

    // tiempo núcleo, sólo planes flextime
    private Integer coreStart;
    private Integer coreEnd;

    @Builder.Default
    private Tolerance tolerance = Tolerance.NONE;

    private RoundingPolicy roundingCome;
    private RoundingPolicy roundingGo;

    /** Redondea todas las marcaciones de trabajo y no sólo la primera entrada y la última salida. */
    private boolean roundAllBookings;

    @Builder.Default
    private List<BreakRule> breakRules = new ArrayList<>();

    private Integer minNetWorkTime;
    private Integer maxNetWorkTime;

    /** Categoría de festivo (1..3) a minutos abonados; las que faltan usan los valores por defecto. */
    @Builder.Default
    private Map<Integer, Integer> holidayCredits = new HashMap<>();

    @Builder.Default
    private DayChangeBehavior dayChangeBehavior = DayChangeBehavior.NONE;

    @Builder.Default
    private NoBookingPolicy noBookingPolicy = NoBookingPolicy.ERROR;

    /** Ausencia abonada por {@link NoBookingPolicy#USE_ABSENCE}, p. ej. días de escuela profesional. */
    private AbsenceFact noBookingAbsence;

    // ventanas de detección de turno
    private Integer shiftArriveFrom;
    private Integer shiftArriveTo;
    private Integer shiftDepartFrom;
    private Integer shiftDepartTo;

    @Builder.Default
    private List<ScheduleConfig> alternativePlans = new ArrayList<>();

    public boolean isFlextime() {
        return planKind == PlanKind.FLEXTIME;
    }

    public Tolerance effectiveTolerance() {
        return tolerance != null ? tolerance : Tolerance.NONE;
    }

    /** Referencia de la tolerancia de salida y de las ventanas: go_to, o go_from si falta. */
    public Integer expectedGo() {
        return goTo != null ? goTo : goFrom;
    }

    public DayChangeBehavior effectiveDayChange() {
        return dayChangeBehavior != null ? dayChangeBehavior : DayChangeBehavior.NONE;
    }

    /** Plan nocturno: la salida esperada cae antes de la entrada, es decir, al día siguiente. */
    public boolean crossesMidnight() {
        Integer go = expectedGo();
        return comeFrom != null && go != null && go < comeFrom;
    }

    public boolean hasCoreTime() {
        return coreStart != null && coreEnd != null;
    }

    public boolean hasArrivalDetection() {
        return shiftArriveFrom != null && shiftArriveTo != null;
    }

    public boolean hasDepartureDetection() {
        return shiftDepartFrom != null && shiftDepartTo != null;
    }

    public boolean hasShiftDetection() {
        return hasArrivalDetection() || hasDepartureDetection();
    }

    /**
     * Minutos abonados por un festivo de la categoría dada. Sin configuración se abona el objetivo
     * completo (1), la mitad (2) o nada (3).
     */
    public int holidayCredit(int category) {
        if (holidayCredits != null && holidayCredits.get(category) != null) {
            return holidayCredits.get(category);
        }
        return switch (category) {
            case HOLIDAY_FULL -> targetMinutes;
            case HOLIDAY_HALF -> targetMinutes / 2;
            default -> 0;
        };
    }
}
