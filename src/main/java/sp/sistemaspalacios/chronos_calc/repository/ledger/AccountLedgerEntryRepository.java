package sp.sistemaspalacios.chronos_calc.repository.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.chronos_calc.dto.ledger.AccountKind;
import sp.sistemaspalacios.chronos_calc.entity.ledger.AccountLedgerEntry;

import java.util.List;
import java.util.Optional;

@Repository
public interface AccountLedgerEntryRepository extends JpaRepository<AccountLedgerEntry, Long> {

    Optional<AccountLedgerEntry> findByEmployeeIdAndAccountKindAndLedgerYear(Long employeeId,
                                                                             AccountKind accountKind,
                                                                             int ledgerYear);

    List<AccountLedgerEntry> findByEmployeeIdAndLedgerYear(Long employeeId, int ledgerYear);
}
