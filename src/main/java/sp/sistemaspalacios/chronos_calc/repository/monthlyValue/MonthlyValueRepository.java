package sp.sistemaspalacios.chronos_calc.repository.monthlyValue;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.chronos_calc.entity.monthlyValue.MonthlyValue;

import java.util.List;
import java.util.Optional;

@Repository
public interface MonthlyValueRepository extends JpaRepository<MonthlyValue, Long> {

    Optional<MonthlyValue> findByEmployeeIdAndPeriodYearAndPeriodMonth(Long employeeId, int periodYear, int periodMonth);

    List<MonthlyValue> findByEmployeeIdAndPeriodYearOrderByPeriodMonthAsc(Long employeeId, int periodYear);

    List<MonthlyValue> findByEmployeeIdOrderByPeriodYearAscPeriodMonthAsc(Long employeeId);

    boolean existsByEmployeeIdAndPeriodYearAndPeriodMonthAndClosedTrue(Long employeeId, int periodYear, int periodMonth);
}
