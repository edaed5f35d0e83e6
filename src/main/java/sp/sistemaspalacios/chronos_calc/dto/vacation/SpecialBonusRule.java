package sp.sistemaspalacios.chronos_calc.dto.vacation;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Días de vacaciones extra al alcanzar el umbral. El umbral va en años para edad y antigüedad y no
 * se usa para discapacidad.
 */
public record SpecialBonusRule(SpecialBonusKind kind, int threshold, BigDecimal bonusDays) {

    public SpecialBonusRule {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(bonusDays, "bonusDays");
    }

    public static SpecialBonusRule age(int years, String days) {
        return new SpecialBonusRule(SpecialBonusKind.AGE, years, new BigDecimal(days));
    }

    public static SpecialBonusRule tenure(int years, String days) {
        return new SpecialBonusRule(SpecialBonusKind.TENURE, years, new BigDecimal(days));
    }

    public static SpecialBonusRule disability(String days) {
        return new SpecialBonusRule(SpecialBonusKind.DISABILITY, 0, new BigDecimal(days));
    }
}
