package sp.sistemaspalacios.chronos_calc.entity.converter;

import jakarta.persistence.Converter;
import sp.sistemaspalacios.chronos_calc.dto.daily.DayWarningCode;

@Converter
public class DayWarningCodeSetConverter extends EnumCodeSetConverter<DayWarningCode> {

    public DayWarningCodeSetConverter() {
        super(DayWarningCode.class, DayWarningCode::fromCode);
    }
}
