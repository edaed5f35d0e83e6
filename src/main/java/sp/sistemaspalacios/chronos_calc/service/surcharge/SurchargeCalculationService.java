package sp.sistemaspalacios.chronos_calc.service.surcharge;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.chronos_calc.dto.booking.BookingPair;
import sp.sistemaspalacios.chronos_calc.dto.common.ValidationResult;
import sp.sistemaspalacios.chronos_calc.dto.daily.DailyResult;
import sp.sistemaspalacios.chronos_calc.dto.surcharge.SurchargeCalculationResult;
import sp.sistemaspalacios.chronos_calc.dto.surcharge.SurchargeResult;
import sp.sistemaspalacios.chronos_calc.dto.surcharge.SurchargeRule;
import sp.sistemaspalacios.chronos_calc.service.common.WorkingTimeCalculatorService;
import sp.sistemaspalacios.chronos_calc.service.common.WorkingTimeCalculatorService.Interval;
import sp.sistemaspalacios.chronos_calc.validator.surcharge.SurchargeRuleValidator;

import java.util.ArrayList;
import java.util.List;

import static sp.sistemaspalacios.chronos_calc.service.common.TimeService.MINUTES_PER_DAY;

/**
 * Minutos de recargo por trabajo dentro de las franjas configuradas, como la nocturna o la de festivo.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SurchargeCalculationService {

    private final WorkingTimeCalculatorService calculator;
    private final SurchargeRuleValidator validator;

    public SurchargeCalculationResult calculate(List<Interval> workIntervals,
                                                List<SurchargeRule> rules,
                                                boolean holiday,
                                                Integer holidayCategory) {
        List<SurchargeResult> results = new ArrayList<>();
        for (SurchargeRule rule : rules) {
            ValidationResult validation = validator.validate(rule);
            if (!validation.valid()) {
                log.warn("⚠️ Regla de recargo {} inválida, se omite: {}", rule != null ? rule.getAccountCode() : null,
                        validation.errors());
                continue;
            }
            if (!applies(rule, holiday, holidayCategory)) {
                continue;
            }
            int minutes = calculator.overlapWithWindow(workIntervals, rule.getTimeFrom(), rule.getTimeTo());
            if (minutes > 0) {
                results.add(new SurchargeResult(rule.getAccountCode(), minutes));
            }
        }
        return SurchargeCalculationResult.of(results);
    }

    /** Recargos de un día ya calculado; sólo el tiempo trabajado los genera. */
    public SurchargeCalculationResult calculate(DailyResult day, List<SurchargeRule> rules) {
        boolean holiday = day.getHolidayCategory() != null;
        return calculate(workIntervals(day.getPairs()), rules, holiday, day.getHolidayCategory());
    }

    /**
     * Pares de trabajo como intervalos de reloj; los de duración negativa se descartan. Un turno
     * trasladado desde el día vecino se parte en la medianoche para que las ventanas nocturnas lo
     * vean a su hora real.
     */
    public List<Interval> workIntervals(List<BookingPair> pairs) {
        return pairs.stream()
                .filter(BookingPair::isWork)
                .filter(p -> p.duration() >= 0)
                .map(calculator::of)
                .flatMap(i -> foldOntoClock(i).stream())
                .toList();
    }

    /**
     * Parte una franja como 22:00-06:00 en 22:00-24:00 y 00:00-06:00. Las que no cruzan la
     * medianoche se devuelven tal cual.
     */
    public List<SurchargeRule> splitOvernight(SurchargeRule rule) {
        if (rule.getTimeFrom() < rule.getTimeTo()) {
            return List.of(rule);
        }
        SurchargeRule evening = rule.toBuilder().timeTo(1440).holidayCategories(copy(rule)).build();
        SurchargeRule morning = rule.toBuilder().timeFrom(0).holidayCategories(copy(rule)).build();
        return List.of(evening, morning);
    }

    private List<Interval> foldOntoClock(Interval interval) {
        if (interval.end() > MINUTES_PER_DAY) {
            return List.of(new Interval(Math.min(interval.start(), MINUTES_PER_DAY), MINUTES_PER_DAY),
                    new Interval(Math.max(0, interval.start() - MINUTES_PER_DAY), interval.end() - MINUTES_PER_DAY));
        }
        if (interval.start() < 0) {
            return List.of(new Interval(interval.start() + MINUTES_PER_DAY, MINUTES_PER_DAY),
                    new Interval(0, Math.max(0, interval.end())));
        }
        return List.of(interval);
    }

    boolean applies(SurchargeRule rule, boolean holiday, Integer holidayCategory) {
        if (!holiday) {
            return rule.isAppliesOnWorkday();
        }
        if (!rule.isAppliesOnHoliday()) {
            return false;
        }
        List<Integer> categories = rule.getHolidayCategories();
        return categories == null || categories.isEmpty() || categories.contains(holidayCategory);
    }

    private List<Integer> copy(SurchargeRule rule) {
        return rule.getHolidayCategories() != null ? new ArrayList<>(rule.getHolidayCategories()) : new ArrayList<>();
    }
}
