package sp.sistemaspalacios.chronos_calc.entity.ledger;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import sp.sistemaspalacios.chronos_calc.dto.ledger.AccountKind;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Saldo anual de una cuenta de un empleado. Flextime y recargos van en minutos, vacaciones en días.
 */
@Entity
@Table(name = "account_ledger_entry",
        uniqueConstraints = @UniqueConstraint(name = "uk_ledger_employee_kind_year",
                columnNames = {"employee_id", "account_kind", "ledger_year"}))
@Data
public class AccountLedgerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_id", nullable = false)
    private Long employeeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_kind", nullable = false, length = 20)
    private AccountKind accountKind;

    @Column(name = "ledger_year", nullable = false)
    private int ledgerYear;

    @Column(name = "opening_balance", nullable = false, precision = 12, scale = 2)
    private BigDecimal openingBalance = BigDecimal.ZERO;

    @Column(name = "current_balance", nullable = false, precision = 12, scale = 2)
    private BigDecimal currentBalance = BigDecimal.ZERO;

    @Column(name = "closing_balance", precision = 12, scale = 2)
    private BigDecimal closingBalance;

    /** Derecho anual de vacaciones; cero para los otros tipos. */
    @Column(name = "entitlement", nullable = false, precision = 12, scale = 2)
    private BigDecimal entitlement = BigDecimal.ZERO;

    @Column(name = "used_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal used = BigDecimal.ZERO;

    @Column(name = "is_closed", nullable = false)
    private boolean closed;

    @Column(name = "closed_by", length = 100)
    private String closedBy;

    @Column(name = "closed_at")
    private LocalDateTime closedAt;

    @Version
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
