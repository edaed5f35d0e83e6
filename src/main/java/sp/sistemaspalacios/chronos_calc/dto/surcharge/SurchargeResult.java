package sp.sistemaspalacios.chronos_calc.dto.surcharge;

public record SurchargeResult(String accountCode, int minutes) {
}
