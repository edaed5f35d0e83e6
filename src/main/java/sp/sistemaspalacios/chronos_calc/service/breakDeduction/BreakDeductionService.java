package sp.sistemaspalacios.chronos_calc.service.breakDeduction;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.chronos_calc.dto.booking.BookingPair;
import sp.sistemaspalacios.chronos_calc.dto.daily.DayWarningCode;
import sp.sistemaspalacios.chronos_calc.dto.schedule.BreakKind;
import sp.sistemaspalacios.chronos_calc.dto.schedule.BreakRule;
import sp.sistemaspalacios.chronos_calc.service.common.WorkingTimeCalculatorService;
import sp.sistemaspalacios.chronos_calc.service.common.WorkingTimeCalculatorService.Interval;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Calcula los minutos de pausa que se restan del tiempo bruto.
 * <p>
 * Las reglas se evalúan en el orden configurado:
 * <ul>
 *   <li>fija: la duración configurada, limitada a los minutos trabajados dentro de la franja;</li>
 *   <li>variable: las pausas marcadas, o la duración configurada si no se marcó nada y la regla
 *   descuenta sola. Sólo la primera regla variable consume las pausas marcadas;</li>
 *   <li>mínima: cuando el bruto supera el umbral, sube el total hasta el mínimo configurado.
 *   Nunca lo baja.</li>
 * </ul>
 * Sin regla variable las pausas marcadas se descuentan tal cual. Las reglas pagadas se informan pero
 * no se descuentan.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BreakDeductionService {

    private final WorkingTimeCalculatorService calculator;

    public BreakDeductionResult deduct(List<BookingPair> workPairs,
                                       List<BookingPair> breakPairs,
                                       int grossMinutes,
                                       List<BreakRule> rules) {

        int booked = breakPairs.stream().mapToInt(p -> Math.max(0, p.duration())).sum();
        List<Interval> work = workPairs.stream().map(calculator::of).toList();
        List<BreakRule> configured = rules != null ? rules : List.of();

        Set<DayWarningCode> warnings = EnumSet.noneOf(DayWarningCode.class);
        boolean hasVariable = configured.stream().anyMatch(r -> r.getKind() == BreakKind.VARIABLE);

        int total = 0;
        int paid = 0;
        if (!hasVariable && booked > 0) {
            total = booked;
            warnings.add(DayWarningCode.MANUAL_BREAK);
        }

        boolean bookedConsumed = false;
        for (BreakRule rule : configured) {
            if (rule.getKind() == null) {
                continue;
            }
            switch (rule.getKind()) {
                case FIXED -> {
                    if (rule.getStartTime() == null || rule.getEndTime() == null) {
                        continue;
                    }
                    int inside = calculator.overlapWithWindow(work, rule.getStartTime(), rule.getEndTime());
                    int amount = Math.min(rule.getDuration(), inside);
                    if (amount <= 0) {
                        continue;
                    }
                    if (rule.isPaid()) {
                        paid += amount;
                    } else {
                        total += amount;
                    }
                }
                case VARIABLE -> {
                    if (booked > 0) {
                        if (bookedConsumed) {
                            continue;
                        }
                        bookedConsumed = true;
                        warnings.add(DayWarningCode.MANUAL_BREAK);
                        if (rule.isPaid()) {
                            paid += booked;
                        } else {
                            total += booked;
                        }
                    } else if (rule.isAutoDeduct() && grossMinutes > 0 && rule.getDuration() > 0) {
                        if (rule.isPaid()) {
                            paid += rule.getDuration();
                        } else {
                            total += rule.getDuration();
                            warnings.add(DayWarningCode.AUTO_BREAK_APPLIED);
                        }
                    }
                }
                case MINIMUM -> {
                    Integer after = rule.getAfterWorkMinutes();
                    if (after == null || grossMinutes <= after) {
                        continue;
                    }
                    int floor = rule.isProportional()
                            ? Math.min(rule.getDuration(), grossMinutes - after)
                            : rule.getDuration();
                    int missing = floor - total;
                    if (missing <= 0) {
                        continue;
                    }
                    if (rule.isPaid()) {
                        paid += missing;
                    } else {
                        total = floor;
                        warnings.add(DayWarningCode.MINIMUM_BREAK_ENFORCED);
                    }
                }
            }
        }

        log.debug("Descuento de pausas: bruto={} marcado={} descontado={} pagado={}", grossMinutes, booked, total, paid);
        return new BreakDeductionResult(total, booked, paid, warnings);
    }
}
