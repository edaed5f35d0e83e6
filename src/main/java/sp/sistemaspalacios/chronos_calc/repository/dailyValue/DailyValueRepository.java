package sp.sistemaspalacios.chronos_calc.repository.dailyValue;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.chronos_calc.entity.dailyValue.DailyValue;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface DailyValueRepository extends JpaRepository<DailyValue, Long> {

    Optional<DailyValue> findByEmployeeIdAndValueDate(Long employeeId, LocalDate valueDate);

    List<DailyValue> findByEmployeeIdAndValueDateBetweenOrderByValueDateAsc(Long employeeId, LocalDate from, LocalDate to);

    List<DailyValue> findByEmployeeIdAndHasErrorTrueAndValueDateBetweenOrderByValueDateAsc(Long employeeId,
                                                                                          LocalDate from,
                                                                                          LocalDate to);
}
