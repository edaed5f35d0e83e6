package sp.sistemaspalacios.chronos_calc.dto.surcharge;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Abona a una cuenta de recargo el trabajo dentro de {@code [timeFrom, timeTo)}. La franja no puede
 * cruzar la medianoche.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SurchargeRule {

    private String accountCode;
    private int timeFrom;
    private int timeTo;
    private boolean appliesOnWorkday;
    private boolean appliesOnHoliday;

    /** Categorías de festivo a las que se limita la regla; vacío significa todas. */
    @Builder.Default
    private List<Integer> holidayCategories = new ArrayList<>();

    public static SurchargeRule workday(String account, int from, int to) {
        return SurchargeRule.builder().accountCode(account).timeFrom(from).timeTo(to).appliesOnWorkday(true).build();
    }

    public static SurchargeRule holiday(String account, int from, int to) {
        return SurchargeRule.builder().accountCode(account).timeFrom(from).timeTo(to).appliesOnHoliday(true).build();
    }
}
