package sp.sistemaspalacios.chronos_calc.dto.surcharge;

import java.util.List;

public record SurchargeCalculationResult(List<SurchargeResult> surcharges, int totalMinutes) {

    public SurchargeCalculationResult {
        surcharges = List.copyOf(surcharges);
    }

    public static SurchargeCalculationResult of(List<SurchargeResult> surcharges) {
        return new SurchargeCalculationResult(surcharges,
                surcharges.stream().mapToInt(SurchargeResult::minutes).sum());
    }
}
