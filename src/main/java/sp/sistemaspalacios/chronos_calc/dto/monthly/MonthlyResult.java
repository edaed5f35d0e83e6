package sp.sistemaspalacios.chronos_calc.dto.monthly;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Set;

@Value
@Builder(toBuilder = true)
public class MonthlyResult {
    Long employeeId;
    int year;
    int month;

    int totalGrossMinutes;
    int totalNetMinutes;
    int totalTargetMinutes;
    int totalOvertimeMinutes;
    int totalUndertimeMinutes;
    int totalBreakMinutes;

    int flextimeStart;
    int flextimeChange;
    int flextimeRaw;
    int flextimeCredited;
    int flextimeForfeited;
    int flextimeEnd;

    int workDays;
    int errorDays;

    @Builder.Default
    BigDecimal vacationDays = BigDecimal.ZERO;
    int sickDays;
    int otherAbsenceDays;

    @Builder.Default
    Set<MonthlyWarningCode> warnings = Set.of();

    boolean closed;
    String closedBy;
    LocalDateTime closedAt;
    String reopenedBy;
    LocalDateTime reopenedAt;

    /** Saldo que pasa al mes siguiente. */
    public int getFlextimeCarryover() {
        return flextimeEnd;
    }
}
