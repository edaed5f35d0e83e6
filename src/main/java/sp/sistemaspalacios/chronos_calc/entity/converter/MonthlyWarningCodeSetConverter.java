package sp.sistemaspalacios.chronos_calc.entity.converter;

import jakarta.persistence.Converter;
import sp.sistemaspalacios.chronos_calc.dto.monthly.MonthlyWarningCode;

@Converter
public class MonthlyWarningCodeSetConverter extends EnumCodeSetConverter<MonthlyWarningCode> {

    public MonthlyWarningCodeSetConverter() {
        super(MonthlyWarningCode.class, MonthlyWarningCode::valueOf);
    }
}
