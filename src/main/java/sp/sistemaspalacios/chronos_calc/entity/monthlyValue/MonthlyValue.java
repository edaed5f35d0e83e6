package sp.sistemaspalacios.chronos_calc.entity.monthlyValue;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import sp.sistemaspalacios.chronos_calc.dto.monthly.MonthlyWarningCode;
import sp.sistemaspalacios.chronos_calc.entity.converter.MonthlyWarningCodeSetConverter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;

@Entity
@Table(name = "monthly_value",
        uniqueConstraints = @UniqueConstraint(name = "uk_monthly_value_employee_period",
                columnNames = {"employee_id", "period_year", "period_month"}))
@Data
public class MonthlyValue {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_id", nullable = false)
    private Long employeeId;

    @Column(name = "period_year", nullable = false)
    private int periodYear;

    @Column(name = "period_month", nullable = false)
    private int periodMonth;

    @Column(name = "total_gross_minutes", nullable = false)
    private int totalGrossMinutes;

    @Column(name = "total_net_minutes", nullable = false)
    private int totalNetMinutes;

    @Column(name = "total_target_minutes", nullable = false)
    private int totalTargetMinutes;

    @Column(name = "total_overtime_minutes", nullable = false)
    private int totalOvertimeMinutes;

    @Column(name = "total_undertime_minutes", nullable = false)
    private int totalUndertimeMinutes;

    @Column(name = "total_break_minutes", nullable = false)
    private int totalBreakMinutes;

    @Column(name = "flextime_start", nullable = false)
    private int flextimeStart;

    @Column(name = "flextime_change", nullable = false)
    private int flextimeChange;

    @Column(name = "flextime_raw", nullable = false)
    private int flextimeRaw;

    @Column(name = "flextime_credited", nullable = false)
    private int flextimeCredited;

    @Column(name = "flextime_forfeited", nullable = false)
    private int flextimeForfeited;

    @Column(name = "flextime_end", nullable = false)
    private int flextimeEnd;

    @Column(name = "work_days", nullable = false)
    private int workDays;

    @Column(name = "error_days", nullable = false)
    private int errorDays;

    @Column(name = "vacation_days", precision = 6, scale = 2)
    private BigDecimal vacationDays = BigDecimal.ZERO;

    @Column(name = "sick_days", nullable = false)
    private int sickDays;

    @Column(name = "other_absence_days", nullable = false)
    private int otherAbsenceDays;

    @Convert(converter = MonthlyWarningCodeSetConverter.class)
    @Column(name = "warning_codes", length = 200)
    private Set<MonthlyWarningCode> warningCodes = new HashSet<>();

    @Column(name = "is_closed", nullable = false)
    private boolean closed;

    @Column(name = "closed_by", length = 100)
    private String closedBy;

    @Column(name = "closed_at")
    private LocalDateTime closedAt;

    @Column(name = "reopened_by", length = 100)
    private String reopenedBy;

    @Column(name = "reopened_at")
    private LocalDateTime reopenedAt;

    /** Control optimista de las transiciones de cierre/reapertura. */
    @Version
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
