package sp.sistemaspalacios.chronos_calc.entity.dailyValue;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import sp.sistemaspalacios.chronos_calc.dto.daily.AbsenceCategory;
import sp.sistemaspalacios.chronos_calc.dto.daily.DayErrorCode;
import sp.sistemaspalacios.chronos_calc.dto.daily.DayType;
import sp.sistemaspalacios.chronos_calc.dto.daily.DayWarningCode;
import sp.sistemaspalacios.chronos_calc.entity.converter.DayErrorCodeSetConverter;
import sp.sistemaspalacios.chronos_calc.entity.converter.DayWarningCodeSetConverter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;

@Entity
@Table(name = "daily_value",
        uniqueConstraints = @UniqueConstraint(name = "uk_daily_value_employee_date",
                columnNames = {"employee_id", "value_date"}))
@Data
public class DailyValue {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_id", nullable = false)
    private Long employeeId;

    @Column(name = "value_date", nullable = false)
    private LocalDate valueDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "day_type", nullable = false, length = 20)
    private DayType dayType;

    @Column(name = "plan_code", length = 50)
    private String planCode;

    @Column(name = "gross_minutes", nullable = false)
    private int grossMinutes;

    @Column(name = "net_minutes", nullable = false)
    private int netMinutes;

    @Column(name = "target_minutes", nullable = false)
    private int targetMinutes;

    @Column(name = "overtime_minutes", nullable = false)
    private int overtimeMinutes;

    @Column(name = "undertime_minutes", nullable = false)
    private int undertimeMinutes;

    @Column(name = "break_minutes", nullable = false)
    private int breakMinutes;

    @Column(name = "paid_break_minutes", nullable = false)
    private int paidBreakMinutes;

    @Column(name = "capped_minutes", nullable = false)
    private int cappedMinutes;

    @Column(name = "window_capped_minutes", nullable = false)
    private int windowCappedMinutes;

    @Column(name = "first_come")
    private Integer firstCome;

    @Column(name = "last_go")
    private Integer lastGo;

    @Column(name = "booking_count", nullable = false)
    private int bookingCount;

    @Convert(converter = DayErrorCodeSetConverter.class)
    @Column(name = "error_codes", length = 500)
    private Set<DayErrorCode> errorCodes = new HashSet<>();

    @Convert(converter = DayWarningCodeSetConverter.class)
    @Column(name = "warning_codes", length = 500)
    private Set<DayWarningCode> warningCodes = new HashSet<>();

    @Column(name = "has_error", nullable = false)
    private boolean hasError;

    @Enumerated(EnumType.STRING)
    @Column(name = "absence_category", length = 20)
    private AbsenceCategory absenceCategory;

    @Column(name = "absence_fraction", precision = 4, scale = 2)
    private BigDecimal absenceFraction;

    @Column(name = "holiday_category")
    private Integer holidayCategory;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
