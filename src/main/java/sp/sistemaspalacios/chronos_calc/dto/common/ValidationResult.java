package sp.sistemaspalacios.chronos_calc.dto.common;

import sp.sistemaspalacios.chronos_calc.exception.ConfigurationValidationException;

import java.util.List;

public record ValidationResult(boolean valid, List<String> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public static ValidationResult ok() { return new ValidationResult(true, List.of()); }

    public static ValidationResult fail(List<String> errs) { return new ValidationResult(false, errs); }

    public static ValidationResult of(List<String> errs) {
        return errs.isEmpty() ? ok() : fail(errs);
    }

    public void throwIfInvalid() {
        if (!valid) {
            throw new ConfigurationValidationException(errors);
        }
    }
}
