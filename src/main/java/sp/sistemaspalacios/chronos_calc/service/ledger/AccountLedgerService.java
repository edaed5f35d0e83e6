package sp.sistemaspalacios.chronos_calc.service.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.chronos_calc.dto.ledger.AccountKind;
import sp.sistemaspalacios.chronos_calc.dto.ledger.LedgerCaps;
import sp.sistemaspalacios.chronos_calc.entity.ledger.AccountLedgerEntry;
import sp.sistemaspalacios.chronos_calc.exception.InvalidPeriodStateException;
import sp.sistemaspalacios.chronos_calc.exception.PeriodClosedException;
import sp.sistemaspalacios.chronos_calc.exception.ResourceNotFoundException;
import sp.sistemaspalacios.chronos_calc.repository.ledger.AccountLedgerEntryRepository;
import sp.sistemaspalacios.chronos_calc.service.vacation.VacationEntitlementService;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Saldos anuales por (empleado, tipo de cuenta, año).
 * <p>
 * El saldo de vacaciones es derivado: {@code disponible = derecho + apertura - usado}. En flextime y
 * recargos el saldo es el saldo actual. Un año cerrado no admite más escrituras.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountLedgerService {

    private final AccountLedgerEntryRepository ledgerRepository;
    private final VacationEntitlementService vacationService;

    @Transactional
    public AccountLedgerEntry getOrCreate(Long employeeId, AccountKind kind, int year) {
        return ledgerRepository.findByEmployeeIdAndAccountKindAndLedgerYear(employeeId, kind, year)
                .orElseGet(() -> {
                    AccountLedgerEntry entry = new AccountLedgerEntry();
                    entry.setEmployeeId(employeeId);
                    entry.setAccountKind(kind);
                    entry.setLedgerYear(year);
                    log.debug("Abriendo cuenta {} {} para empleado {}", kind, year, employeeId);
                    return ledgerRepository.save(entry);
                });
    }

    @Transactional(readOnly = true)
    public AccountLedgerEntry getEntry(Long employeeId, AccountKind kind, int year) {
        return ledgerRepository.findByEmployeeIdAndAccountKindAndLedgerYear(employeeId, kind, year)
                .orElseThrow(() -> new ResourceNotFoundException(
                        String.format("No %s ledger for employee %d in %d", kind.getCode(), employeeId, year)));
    }

    @Transactional(readOnly = true)
    public boolean isClosed(Long employeeId, AccountKind kind, int year) {
        return ledgerRepository.findByEmployeeIdAndAccountKindAndLedgerYear(employeeId, kind, year)
                .map(AccountLedgerEntry::isClosed)
                .orElse(false);
    }

    public BigDecimal available(AccountLedgerEntry entry) {
        if (entry.getAccountKind() == AccountKind.VACATION) {
            return entry.getEntitlement().add(entry.getOpeningBalance()).subtract(entry.getUsed());
        }
        return entry.getCurrentBalance();
    }

    @Transactional
    public AccountLedgerEntry setEntitlement(Long employeeId, int year, BigDecimal days) {
        AccountLedgerEntry entry = writable(employeeId, AccountKind.VACATION, year);
        entry.setEntitlement(days);
        entry.setCurrentBalance(available(entry));
        return ledgerRepository.save(entry);
    }

    @Transactional
    public AccountLedgerEntry recordVacationUsage(Long employeeId, int year, BigDecimal days) {
        AccountLedgerEntry entry = writable(employeeId, AccountKind.VACATION, year);
        entry.setUsed(entry.getUsed().add(days));
        entry.setCurrentBalance(available(entry));
        return ledgerRepository.save(entry);
    }

    /** Suma un movimiento con signo a una cuenta en minutos. */
    @Transactional
    public AccountLedgerEntry post(Long employeeId, AccountKind kind, int year, BigDecimal delta) {
        if (kind == AccountKind.VACATION) {
            throw new IllegalArgumentException("Vacation balances change through entitlement and usage");
        }
        AccountLedgerEntry entry = writable(employeeId, kind, year);
        entry.setCurrentBalance(entry.getCurrentBalance().add(delta));
        return ledgerRepository.save(entry);
    }

    /** Fija el saldo de flextime del año al saldo final de su último mes. */
    @Transactional
    public AccountLedgerEntry syncFlextime(Long employeeId, int year, int flextimeEnd) {
        AccountLedgerEntry entry = writable(employeeId, AccountKind.FLEXTIME, year);
        entry.setCurrentBalance(BigDecimal.valueOf(flextimeEnd));
        return ledgerRepository.save(entry);
    }

    /**
     * Congela el año y abre el siguiente con el saldo de cierre ya topado. Si la entrada del año
     * siguiente existe se actualiza y conserva los movimientos ya registrados.
     *
     * @return la entrada del año siguiente
     */
    @Transactional
    public AccountLedgerEntry closeYear(Long employeeId, AccountKind kind, int year, LedgerCaps caps, String actor) {
        AccountLedgerEntry entry = getEntry(employeeId, kind, year);
        if (entry.isClosed()) {
            throw new InvalidPeriodStateException(String.format("%s ledger %d of employee %d is already closed",
                    kind.getCode(), year, employeeId));
        }

        BigDecimal closing = closingBalance(kind, available(entry), caps != null ? caps : LedgerCaps.NONE);
        entry.setClosingBalance(closing);
        entry.setClosed(true);
        entry.setClosedBy(actor);
        entry.setClosedAt(LocalDateTime.now());
        ledgerRepository.save(entry);

        AccountLedgerEntry next = writable(employeeId, kind, year + 1);
        BigDecimal movements = next.getCurrentBalance().subtract(next.getOpeningBalance());
        next.setOpeningBalance(closing);
        next.setCurrentBalance(kind == AccountKind.VACATION ? available(next) : closing.add(movements));
        ledgerRepository.save(next);

        log.info("🔒 Cuenta {} {} de empleado {} cerrada por {}: saldo de cierre {}",
                kind.getCode(), year, employeeId, actor, closing);
        return next;
    }

    /**
     * Saldo que pasa al año siguiente. Vacaciones pasa como mucho el tope positivo y nunca un saldo
     * negativo. Las cuentas en minutos se acotan a los topes y luego flextime al piso anual.
     */
    public BigDecimal closingBalance(AccountKind kind, BigDecimal balance, LedgerCaps caps) {
        if (kind == AccountKind.VACATION) {
            return vacationService.carryover(balance, caps.positiveCap());
        }
        BigDecimal value = balance;
        if (caps.positiveCap() != null && value.compareTo(caps.positiveCap()) > 0) {
            value = caps.positiveCap();
        }
        if (caps.negativeCap() != null && value.compareTo(caps.negativeCap().negate()) < 0) {
            value = caps.negativeCap().negate();
        }
        if (kind == AccountKind.FLEXTIME && caps.annualFloor() != null
                && value.compareTo(caps.annualFloor().negate()) < 0) {
            value = caps.annualFloor().negate();
        }
        return value;
    }

    private AccountLedgerEntry writable(Long employeeId, AccountKind kind, int year) {
        AccountLedgerEntry entry = getOrCreate(employeeId, kind, year);
        if (entry.isClosed()) {
            throw new PeriodClosedException(String.format("%s ledger %d of employee %d is closed",
                    kind.getCode(), year, employeeId));
        }
        return entry;
    }
}
