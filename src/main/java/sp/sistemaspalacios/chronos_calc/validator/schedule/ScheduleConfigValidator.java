package sp.sistemaspalacios.chronos_calc.validator.schedule;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import sp.sistemaspalacios.chronos_calc.config.CalculationProperties;
import sp.sistemaspalacios.chronos_calc.dto.common.ValidationResult;
import sp.sistemaspalacios.chronos_calc.dto.schedule.BreakRule;
import sp.sistemaspalacios.chronos_calc.dto.schedule.RoundingDirection;
import sp.sistemaspalacios.chronos_calc.dto.schedule.RoundingPolicy;
import sp.sistemaspalacios.chronos_calc.dto.schedule.ScheduleConfig;
import sp.sistemaspalacios.chronos_calc.dto.schedule.Tolerance;
import sp.sistemaspalacios.chronos_calc.service.common.TimeService;
import sp.sistemaspalacios.chronos_calc.validator.shift.ShiftDetectionValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Revisa un plan diario antes de guardarlo. Se reportan todos los problemas; nada se corrige.
 */
@Component
@RequiredArgsConstructor
public class ScheduleConfigValidator {

    private final ShiftDetectionValidator shiftDetectionValidator;
    private final CalculationProperties properties;

    public ValidationResult validate(ScheduleConfig plan) {
        if (plan == null) {
            return ValidationResult.fail(List.of("Day plan is required"));
        }
        List<String> errors = new ArrayList<>();
        collect(plan, "", errors);
        return ValidationResult.of(errors);
    }

    public void validateOrThrow(ScheduleConfig plan) {
        validate(plan).throwIfInvalid();
    }

    private void collect(ScheduleConfig plan, String prefix, List<String> errors) {
        if (plan.getCode() == null || plan.getCode().isBlank()) {
            errors.add(prefix + "code is required");
        }
        if (!TimeService.isBound(plan.getTargetMinutes())) {
            errors.add(prefix + "target minutes must be between 0 and 1440");
        }

        // ==========================================
        // VENTANAS
        // ==========================================
        checkBound(errors, prefix + "come_from", plan.getComeFrom());
        checkBound(errors, prefix + "come_to", plan.getComeTo());
        checkBound(errors, prefix + "go_from", plan.getGoFrom());
        checkBound(errors, prefix + "go_to", plan.getGoTo());
        checkOrder(errors, prefix + "come", plan.getComeFrom(), plan.getComeTo());
        checkOrder(errors, prefix + "go", plan.getGoFrom(), plan.getGoTo());

        if ((plan.getCoreStart() == null) != (plan.getCoreEnd() == null)) {
            errors.add(prefix + "both core_start and core_end must be set together");
        } else if (plan.hasCoreTime()) {
            checkBound(errors, prefix + "core_start", plan.getCoreStart());
            checkBound(errors, prefix + "core_end", plan.getCoreEnd());
            if (plan.getCoreStart() >= plan.getCoreEnd()) {
                errors.add(prefix + "core_start must be before core_end");
            }
        }

        Tolerance t = plan.effectiveTolerance();
        if (t.comePlus() < 0 || t.comeMinus() < 0 || t.goPlus() < 0 || t.goMinus() < 0) {
            errors.add(prefix + "tolerances must not be negative");
        }
        checkRounding(errors, prefix + "rounding_come", plan.getRoundingCome());
        checkRounding(errors, prefix + "rounding_go", plan.getRoundingGo());

        // ==========================================
        // PAUSAS Y TOPES
        // ==========================================
        List<BreakRule> rules = plan.getBreakRules() != null ? plan.getBreakRules() : List.of();
        for (int i = 0; i < rules.size(); i++) {
            checkBreak(errors, prefix + "break[" + i + "]", rules.get(i));
        }

        if (plan.getMinNetWorkTime() != null && plan.getMinNetWorkTime() < 0) {
            errors.add(prefix + "min_net_work_time must not be negative");
        }
        if (plan.getMaxNetWorkTime() != null && plan.getMaxNetWorkTime() < 0) {
            errors.add(prefix + "max_net_work_time must not be negative");
        }
        if (plan.getMinNetWorkTime() != null && plan.getMaxNetWorkTime() != null
                && plan.getMinNetWorkTime() > plan.getMaxNetWorkTime()) {
            errors.add(prefix + "min_net_work_time must not exceed max_net_work_time");
        }

        if (plan.getHolidayCredits() != null) {
            for (Map.Entry<Integer, Integer> e : plan.getHolidayCredits().entrySet()) {
                if (e.getKey() == null || e.getKey() < 1 || e.getKey() > 3) {
                    errors.add(prefix + "holiday credit category must be 1, 2 or 3: " + e.getKey());
                }
                if (e.getValue() == null || e.getValue() < 0 || e.getValue() > 1440) {
                    errors.add(prefix + "holiday credit must be between 0 and 1440 minutes");
                }
            }
        }

        // ==========================================
        // DETECCIÓN DE TURNO
        // ==========================================
        shiftDetectionValidator.validate(plan).errors().forEach(e -> errors.add(prefix + e));

        List<ScheduleConfig> alternatives = plan.getAlternativePlans() != null ? plan.getAlternativePlans() : List.of();
        if (alternatives.size() > properties.getMaxAlternativePlans()) {
            errors.add(prefix + "at most " + properties.getMaxAlternativePlans() + " alternative plans are allowed");
        }
        for (int i = 0; i < alternatives.size(); i++) {
            ScheduleConfig alternative = alternatives.get(i);
            if (alternative == null) {
                errors.add(prefix + "alternative[" + i + "] is empty");
            } else {
                collect(alternative, prefix + "alternative[" + i + "].", errors);
            }
        }
    }

    private void checkBreak(List<String> errors, String name, BreakRule rule) {
        if (rule == null || rule.getKind() == null) {
            errors.add(name + ": kind is required");
            return;
        }
        if (rule.getDuration() < 0) {
            errors.add(name + ": duration must not be negative");
        }
        switch (rule.getKind()) {
            case FIXED -> {
                if (rule.getStartTime() == null || rule.getEndTime() == null) {
                    errors.add(name + ": fixed breaks need a start and an end");
                } else {
                    checkBound(errors, name + ".start", rule.getStartTime());
                    checkBound(errors, name + ".end", rule.getEndTime());
                    if (rule.getStartTime() >= rule.getEndTime()) {
                        errors.add(name + ": start must be before end");
                    }
                }
            }
            case MINIMUM -> {
                if (rule.getAfterWorkMinutes() == null || rule.getAfterWorkMinutes() < 0) {
                    errors.add(name + ": minimum breaks need a non-negative after_work_minutes");
                }
            }
            case VARIABLE -> {
                // sin campos adicionales
            }
        }
    }

    private void checkRounding(List<String> errors, String name, RoundingPolicy policy) {
        if (policy == null) {
            return;
        }
        if (policy.interval() < 0) {
            errors.add(name + ": interval must not be negative");
        }
        if (policy.direction() != RoundingDirection.NONE && policy.interval() == 0) {
            errors.add(name + ": interval is required for direction " + policy.direction().getCode());
        }
    }

    private void checkBound(List<String> errors, String name, Integer value) {
        if (value != null && !TimeService.isBound(value)) {
            errors.add(name + " must be between 0 and 1440");
        }
    }

    private void checkOrder(List<String> errors, String name, Integer from, Integer to) {
        if (from != null && to != null && from >= to) {
            errors.add(name + "_from must be before " + name + "_to");
        }
    }
}
