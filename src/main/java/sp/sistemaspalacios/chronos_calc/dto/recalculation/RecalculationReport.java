package sp.sistemaspalacios.chronos_calc.dto.recalculation;

import java.util.List;

public record RecalculationReport(List<DayOutcome> outcomes) {

    public RecalculationReport {
        outcomes = List.copyOf(outcomes);
    }

    public long count(RecalculationStatus status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    public boolean allCalculated() {
        return outcomes.stream().allMatch(o -> o.status() == RecalculationStatus.CALCULATED
                || o.status() == RecalculationStatus.SKIPPED);
    }
}
