package sp.sistemaspalacios.chronos_calc.validator.shift;

import org.springframework.stereotype.Component;
import sp.sistemaspalacios.chronos_calc.dto.common.ValidationResult;
import sp.sistemaspalacios.chronos_calc.dto.schedule.ScheduleConfig;
import sp.sistemaspalacios.chronos_calc.service.common.TimeService;

import java.util.ArrayList;
import java.util.List;

/**
 * Ventanas de detección de entrada y salida: ambos límites o ninguno, dentro del día y desde antes que hasta.
 */
@Component
public class ShiftDetectionValidator {

    public ValidationResult validate(ScheduleConfig plan) {
        List<String> errors = new ArrayList<>();
        checkWindow(errors, "shift_arrive", plan.getShiftArriveFrom(), plan.getShiftArriveTo());
        checkWindow(errors, "shift_depart", plan.getShiftDepartFrom(), plan.getShiftDepartTo());
        return ValidationResult.of(errors);
    }

    private void checkWindow(List<String> errors, String name, Integer from, Integer to) {
        if (from == null && to == null) {
            return;
        }
        if (from == null || to == null) {
            errors.add("Both " + name + "_from and " + name + "_to must be set together");
            return;
        }
        if (!TimeService.isBound(from)) {
            errors.add(name + "_from must be between 0 and 1440");
        }
        if (!TimeService.isBound(to)) {
            errors.add(name + "_to must be between 0 and 1440");
        }
        if (from >= to) {
            errors.add(name + "_from must be before " + name + "_to");
        }
    }
}
