package sp.sistemaspalacios.chronos_calc.service.shift;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.chronos_calc.config.CalculationProperties;
import sp.sistemaspalacios.chronos_calc.dto.schedule.ScheduleConfig;
import sp.sistemaspalacios.chronos_calc.dto.shift.ShiftDetectionResult;
import sp.sistemaspalacios.chronos_calc.dto.shift.ShiftMatchKind;
import sp.sistemaspalacios.chronos_calc.service.common.TimeService;

import java.util.List;

/**
 * Elige el plan diario que encaja con la entrada/salida observadas. Las ventanas de detección son
 * semiabiertas: {@code from <= t < to}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ShiftDetectionService {

    private final CalculationProperties properties;
    private final TimeService timeService;

    public ShiftDetectionResult detect(ScheduleConfig assigned, Integer firstCome, Integer lastGo) {
        if (assigned == null) {
            return new ShiftDetectionResult(null, true, ShiftMatchKind.NONE, false, null);
        }
        if (!assigned.hasShiftDetection() || (firstCome == null && lastGo == null)) {
            return ShiftDetectionResult.original(assigned, ShiftMatchKind.NONE);
        }

        ShiftMatchKind kind = match(assigned, firstCome, lastGo);
        if (kind != ShiftMatchKind.NONE) {
            return ShiftDetectionResult.original(assigned, kind);
        }

        List<ScheduleConfig> alternatives = assigned.getAlternativePlans() != null
                ? assigned.getAlternativePlans() : List.of();
        int limit = Math.min(alternatives.size(), properties.getMaxAlternativePlans());
        for (int i = 0; i < limit; i++) {
            ScheduleConfig alternative = alternatives.get(i);
            if (alternative == null) {
                continue;
            }
            ShiftMatchKind altKind = match(alternative, firstCome, lastGo);
            if (altKind != ShiftMatchKind.NONE) {
                log.debug("Turno cambiado de {} a {} ({})", assigned.getCode(), alternative.getCode(), altKind);
                return ShiftDetectionResult.alternative(alternative, altKind);
            }
        }

        String message = String.format("No day plan matches arrival %s / departure %s (assigned %s)",
                timeService.format(firstCome), timeService.format(lastGo), assigned.getCode());
        log.warn("⚠️ Ningún plan coincide con la entrada {} / salida {} (asignado {})",
                timeService.format(firstCome), timeService.format(lastGo), assigned.getCode());
        return ShiftDetectionResult.noMatch(assigned, message);
    }

    /** NONE si el plan no tiene ventanas o las horas caen fuera. Con ambas ventanas deben coincidir las dos. */
    ShiftMatchKind match(ScheduleConfig plan, Integer firstCome, Integer lastGo) {
        boolean hasArrival = plan.hasArrivalDetection();
        boolean hasDeparture = plan.hasDepartureDetection();

        boolean arrivalOk = hasArrival && inWindow(firstCome, plan.getShiftArriveFrom(), plan.getShiftArriveTo());
        boolean departureOk = hasDeparture && inWindow(lastGo, plan.getShiftDepartFrom(), plan.getShiftDepartTo());

        if (hasArrival && hasDeparture) {
            return arrivalOk && departureOk ? ShiftMatchKind.BOTH : ShiftMatchKind.NONE;
        }
        if (hasArrival) {
            return arrivalOk ? ShiftMatchKind.ARRIVAL : ShiftMatchKind.NONE;
        }
        if (hasDeparture) {
            return departureOk ? ShiftMatchKind.DEPARTURE : ShiftMatchKind.NONE;
        }
        return ShiftMatchKind.NONE;
    }

    private boolean inWindow(Integer time, int from, int to) {
        return time != null && time >= from && time < to;
    }
}
