package sp.sistemaspalacios.chronos_calc.validator.surcharge;

import org.springframework.stereotype.Component;
import sp.sistemaspalacios.chronos_calc.dto.common.ValidationResult;
import sp.sistemaspalacios.chronos_calc.dto.surcharge.SurchargeRule;
import sp.sistemaspalacios.chronos_calc.service.common.TimeService;

import java.util.ArrayList;
import java.util.List;

/**
 * Las franjas de recargo deben caer dentro de un día. Una franja que cruza la medianoche se parte
 * antes en las 00:00.
 */
@Component
public class SurchargeRuleValidator {

    public ValidationResult validate(SurchargeRule rule) {
        List<String> errors = new ArrayList<>();
        if (rule == null) {
            return ValidationResult.fail(List.of("Surcharge rule is required"));
        }
        if (rule.getAccountCode() == null || rule.getAccountCode().isBlank()) {
            errors.add("Surcharge account is required");
        }
        if (!TimeService.isBound(rule.getTimeFrom())) {
            errors.add("time_from must be between 0 and 1440: " + rule.getTimeFrom());
        }
        if (!TimeService.isBound(rule.getTimeTo())) {
            errors.add("time_to must be between 0 and 1440: " + rule.getTimeTo());
        }
        if (rule.getTimeFrom() >= rule.getTimeTo()) {
            errors.add(String.format("time_from (%d) must be before time_to (%d); split windows crossing midnight",
                    rule.getTimeFrom(), rule.getTimeTo()));
        }
        if (rule.getHolidayCategories() != null) {
            for (Integer category : rule.getHolidayCategories()) {
                if (category == null || category < 1 || category > 3) {
                    errors.add("Holiday category must be 1, 2 or 3: " + category);
                }
            }
        }
        return ValidationResult.of(errors);
    }

    public void validateOrThrow(SurchargeRule rule) {
        validate(rule).throwIfInvalid();
    }
}
